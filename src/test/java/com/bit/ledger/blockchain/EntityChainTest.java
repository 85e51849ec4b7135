package com.bit.ledger.blockchain;

import com.bit.ledger.database.ChainRecord;
import com.bit.ledger.exception.ErrorType;
import com.bit.ledger.exception.LedgerException;
import com.bit.ledger.structure.attendance.AttendanceRecord;
import com.bit.ledger.structure.attendance.AttendanceStats;
import com.bit.ledger.structure.block.Block;
import com.bit.ledger.structure.tx.TransactionType;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
public class EntityChainTest {

    private static final int DIFFICULTY = 1;

    private static RootChain root() {
        RootChain root = new RootChain("dept-1", "Computing", DIFFICULTY);
        root.initialize(Map.of("code", "CS", "description", "School of Computing"));
        return root;
    }

    private static LeafChain leaf(String parentHash) {
        LeafChain leaf = new LeafChain("student-1", "Alice", "class-1", "dept-1", parentHash, DIFFICULTY);
        leaf.initialize(Map.of("rollNumber", "CS-001", "email", "alice@example.com"));
        return leaf;
    }

    private static AttendanceRecord record(String date, String status) {
        return AttendanceRecord.builder()
                .studentId("student-1")
                .studentName("Alice")
                .rollNumber("CS-001")
                .classId("class-1")
                .departmentId("dept-1")
                .date(date)
                .status(status)
                .markedAt(System.currentTimeMillis())
                .build();
    }

    @Test
    void rootGenesisSnapshotAndReplay() {
        RootChain root = root();
        Block genesis = root.getChain().getGenesisBlock();

        assertEquals("0", genesis.getPrevHash(), "根链创世块 prev_hash 应为 \"0\"");
        assertEquals(TransactionType.ROOT, genesis.getFirstTransaction().getType());
        Map<String, Object> state = root.getCurrentState();
        assertEquals("dept-1", state.get("id"));
        assertEquals("CS", state.get("code"));
        assertEquals("active", state.get("status"));
        assertEquals(genesis.getTimestamp(), root.getCreatedAt());

        root.appendUpdate(Map.of("name", "Computer Science", "description", "Updated"));
        state = root.getCurrentState();
        assertEquals("Computer Science", state.get("name"), "更新应合并到回放状态");
        assertEquals("Updated", state.get("description"));
        assertEquals("CS", state.get("code"), "未更新的字段保持不变");
        assertEquals("Computer Science", root.getCurrentName());
        assertEquals("Computing", root.getDisplayName(), "创建名称不随更新改变");
        assertEquals(2, root.getChainLength());
        assertTrue(root.getChain().verify().isValid());
    }

    @Test
    void softDeleteIsIdempotent() {
        RootChain root = root();
        root.appendDelete();
        assertTrue(root.isDeleted());
        assertEquals(2, root.getChainLength());

        root.appendDelete();
        assertEquals("deleted", root.getStatus(), "重复删除后状态保持 deleted");
        assertEquals(3, root.getChainLength(), "删除只追加区块，不移除任何区块");
        assertEquals(TransactionType.DELETE, root.getLatestBlock().getFirstTransaction().getType());
    }

    @Test
    void invalidPatchesRejectedWithoutMining() {
        RootChain root = root();

        LedgerException empty = assertThrows(LedgerException.class, () -> root.appendUpdate(Map.of()));
        assertEquals(ErrorType.INPUT_ERROR, empty.getErrorType());

        LedgerException status = assertThrows(LedgerException.class,
                () -> root.appendUpdate(Map.of("status", "active")));
        assertEquals(ErrorType.INPUT_ERROR, status.getErrorType());

        Map<String, Object> blankName = new HashMap<>();
        blankName.put("name", " ");
        assertThrows(LedgerException.class, () -> root.appendUpdate(blankName));

        assertEquals(1, root.getChainLength(), "被拒绝的补丁不应出块");
    }

    @Test
    void groupProtectsParentField() {
        RootChain root = root();
        GroupChain group = new GroupChain("class-1", "CS101", "dept-1", root.getLatestHash(), DIFFICULTY);
        group.initialize(Map.of("code", "CS101", "semester", "Fall", "year", 2024));

        assertEquals(root.getLatestHash(), group.getChain().getGenesisBlock().getPrevHash(),
                "班级创世块应绑定部门链最新哈希");
        assertEquals("dept-1", group.getCurrentState().get("departmentId"));
        assertEquals(2024, group.getCurrentState().get("year"));

        LedgerException ex = assertThrows(LedgerException.class,
                () -> group.appendUpdate(Map.of("departmentId", "dept-2")));
        assertEquals(ErrorType.INPUT_ERROR, ex.getErrorType());
        assertThrows(IllegalArgumentException.class,
                () -> new GroupChain("class-2", "CS102", "dept-1", null, DIFFICULTY), "子链必须携带父链哈希");
    }

    @Test
    void parentLinkSurvivesParentGrowth() {
        RootChain root = root();
        String hashAtCreation = root.getLatestHash();
        GroupChain group = new GroupChain("class-1", "CS101", "dept-1", hashAtCreation, DIFFICULTY);
        group.initialize(Map.of());

        root.appendUpdate(Map.of("description", "grown"));
        String grown = root.getLatestHash();

        assertTrue(group.validateParentLink(grown), "父链继续出块不影响创建时的绑定");
        assertTrue(group.parentHasGrown(grown));
        assertFalse(group.parentHasGrown(hashAtCreation));
        assertEquals(hashAtCreation, group.getChain().getGenesisBlock().getPrevHash());
    }

    @Test
    void leafRequiresRollNumber() {
        LeafChain leaf = new LeafChain("student-1", "Alice", "class-1", "dept-1", "00ab", DIFFICULTY);
        LedgerException ex = assertThrows(LedgerException.class, () -> leaf.initialize(Map.of("email", "a@b.c")));
        assertEquals(ErrorType.INPUT_ERROR, ex.getErrorType());
        assertTrue(leaf.getChain().isEmpty(), "缺少学号时不应挖出创世块");
    }

    @Test
    void duplicateDateRejected() {
        LeafChain leaf = leaf("00ab");
        leaf.appendRecord(record("2024-11-16", "Present"));
        assertEquals(2, leaf.getChainLength());

        LedgerException ex = assertThrows(LedgerException.class, () -> leaf.appendRecord(record("2024-11-16", "Absent")));
        assertEquals(ErrorType.CONFLICT, ex.getErrorType(), "同一日期重复考勤应返回冲突");
        assertEquals(2, leaf.getChainLength(), "被拒绝的考勤不应出块");

        AttendanceRecord found = leaf.getRecordByDate("2024-11-16").orElseThrow();
        assertEquals("Present", found.getStatus());
        assertTrue(leaf.getRecordByDate("2024-11-17").isEmpty());
        assertEquals("active", leaf.getStatus(), "考勤记录不影响当前状态");
    }

    @Test
    void invalidRecordsRejected() {
        LeafChain leaf = leaf("00ab");
        assertEquals(ErrorType.INPUT_ERROR, assertThrows(LedgerException.class,
                () -> leaf.appendRecord(record("2024-11-16", "present"))).getErrorType());
        assertEquals(ErrorType.INPUT_ERROR, assertThrows(LedgerException.class,
                () -> leaf.appendRecord(record("2024-13-40", "Present"))).getErrorType());
        assertEquals(ErrorType.INPUT_ERROR, assertThrows(LedgerException.class,
                () -> leaf.appendRecord(record("16/11/2024", "Present"))).getErrorType());

        leaf.appendDelete();
        LedgerException deleted = assertThrows(LedgerException.class,
                () -> leaf.appendRecord(record("2024-11-16", "Present")));
        assertEquals(ErrorType.INPUT_ERROR, deleted.getErrorType(), "已删除学生不能考勤");
        assertEquals(2, leaf.getChainLength());
    }

    @Test
    void attendanceStatistics() {
        LeafChain leaf = leaf("00ab");
        leaf.appendRecord(record("2024-11-14", "Present"));
        leaf.appendRecord(record("2024-11-15", "Absent"));
        leaf.appendRecord(record("2024-11-16", "Present"));

        List<AttendanceRecord> history = leaf.getRecordHistory();
        assertEquals(3, history.size());
        assertEquals("2024-11-14", history.get(0).getDate(), "历史按链顺序返回");

        AttendanceStats stats = leaf.getRecordStats();
        assertEquals(3, stats.getTotal());
        assertEquals(2, stats.getPresent());
        assertEquals(1, stats.getAbsent());
        assertEquals(0, stats.getLeave());
        assertEquals(66.67, stats.getPercentage(), 0.0001);
        assertEquals(0.0, AttendanceStats.of(List.of()).getPercentage());
    }

    @Test
    void recordRoundTripKeepsCommittedPrefix() {
        LeafChain leaf = leaf("00ab");
        leaf.markCommitted();
        leaf.appendRecord(record("2024-11-16", "Leave"));

        ChainRecord committed = leaf.toRecord(false);
        assertEquals(1, committed.getChain().size(), "未提交的区块不应出现在快照中");
        assertEquals("class-1", committed.getGroupId());
        assertEquals("dept-1", committed.getRootId());
        assertEquals("00ab", committed.getParentLinkHash());

        ChainRecord full = leaf.toRecord(true);
        assertEquals(2, full.getChain().size());

        LeafChain restored = (LeafChain) EntityChain.fromRecord(EntityKind.LEAF, full);
        assertEquals(2, restored.getCommittedLength());
        assertEquals(leaf.getLatestHash(), restored.getLatestHash());
        assertEquals("CS-001", restored.getRollNumber());
        assertEquals("Leave", restored.getRecordByDate("2024-11-16").orElseThrow().getStatus());
        assertTrue(restored.getChain().verify().isValid());
    }

    @Test
    @SuppressWarnings("unchecked")
    void nestedPayloadCannotBeChangedAfterAppend() {
        RootChain root = root();
        Map<String, Object> profile = new HashMap<>();
        profile.put("head", "Ada");
        List<Object> tags = new ArrayList<>(List.of("science"));
        Map<String, Object> patch = new HashMap<>();
        patch.put("profile", profile);
        patch.put("tags", tags);
        Block block = root.appendUpdate(patch);

        // 出块后再改调用方自己的对象
        profile.put("head", "Eve");
        tags.add("arts");
        assertTrue(block.isValid(), "调用方修改补丁不应影响已出块的数据");

        Map<String, Object> state = root.getCurrentState();
        Map<String, Object> replayedProfile = (Map<String, Object>) state.get("profile");
        assertEquals("Ada", replayedProfile.get("head"));
        assertEquals(List.of("science"), state.get("tags"));
        assertThrows(UnsupportedOperationException.class, () -> replayedProfile.put("head", "Mallory"));
        assertThrows(UnsupportedOperationException.class, () -> ((List<Object>) state.get("tags")).add("x"));

        state.put("code", "XX");
        assertEquals("CS", root.getCurrentState().get("code"), "回放结果是新副本");
        assertTrue(block.isValid());
        assertTrue(root.getChain().verify().isValid());
    }
}
