package com.bit.ledger.blockchain;

import com.bit.ledger.structure.attendance.AttendanceRecord;
import com.bit.ledger.structure.attendance.AttendanceStats;
import com.bit.ledger.structure.block.Block;
import com.bit.ledger.structure.dto.BulkAttendanceRequest;
import com.bit.ledger.structure.dto.BulkAttendanceResult;
import com.bit.ledger.structure.dto.MarkAttendanceRequest;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 全部实体链的注册中心
 * 负责创建协议（查父链、取父链最新哈希交给子链创世块）、按链串行化写入、写入后持久化
 * 所有写操作返回时区块已挖出且已落盘
 */
public interface ChainRegistry {

    /**
     * 从存储加载全部链，启动时调用一次
     */
    void load();

    /**
     * @param id 为空时自动生成
     */
    RootChain createRoot(String id, String name, Map<String, Object> fields);

    GroupChain createGroup(String id, String name, String rootId, Map<String, Object> fields);

    LeafChain createLeaf(String id, String name, String groupId, Map<String, Object> fields);

    /**
     * 不存在时抛出 NOT_FOUND
     */
    EntityChain get(EntityKind kind, String id);

    Optional<EntityChain> find(EntityKind kind, String id);

    RootChain getRoot(String id);

    GroupChain getGroup(String id);

    LeafChain getLeaf(String id);

    /**
     * 按创建时间排序
     */
    List<EntityChain> list(EntityKind kind);

    List<RootChain> listRoots();

    List<GroupChain> listGroups();

    List<LeafChain> listLeaves();

    List<GroupChain> listGroupsByRoot(String rootId);

    List<LeafChain> listLeavesByGroup(String groupId);

    List<LeafChain> listLeavesByRoot(String rootId);

    /**
     * 追加字段更新块
     */
    Block update(EntityKind kind, String id, Map<String, Object> patch);

    /**
     * 追加软删除块
     */
    Block delete(EntityKind kind, String id);

    /**
     * 追加一条考勤记录，返回新挖出的区块
     */
    Block markAttendance(MarkAttendanceRequest request);

    BulkAttendanceResult markAttendanceBulk(BulkAttendanceRequest request);

    Optional<AttendanceRecord> getAttendanceByDate(String studentId, String date);

    List<AttendanceRecord> getAttendanceHistory(String studentId);

    AttendanceStats getAttendanceStats(String studentId);

    /**
     * 新建链使用的难度
     */
    int getDifficulty();
}
