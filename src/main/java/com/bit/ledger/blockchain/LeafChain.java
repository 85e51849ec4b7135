package com.bit.ledger.blockchain;

import com.bit.ledger.database.ChainRecord;
import com.bit.ledger.exception.LedgerException;
import com.bit.ledger.structure.attendance.AttendanceRecord;
import com.bit.ledger.structure.attendance.AttendanceStats;
import com.bit.ledger.structure.attendance.AttendanceStatus;
import com.bit.ledger.structure.block.Block;
import com.bit.ledger.structure.tx.Transaction;
import com.bit.ledger.structure.tx.TransactionType;
import com.bit.ledger.util.LedgerDates;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 学生链：创世块绑定所属班级链的最新哈希，之后可追加考勤记录
 */
@Slf4j
public class LeafChain extends EntityChain {

    private static final Set<String> PROTECTED =
            Set.of(FIELD_ID, FIELD_STATUS, FIELD_CREATED_AT, "classId", "departmentId");

    private final String groupId;

    private final String rootId;

    public LeafChain(String id, String displayName, String groupId, String rootId, String parentLinkHash, int difficulty) {
        this(id, displayName, groupId, rootId, parentLinkHash, new Chain(difficulty));
    }

    LeafChain(String id, String displayName, String groupId, String rootId, String parentLinkHash, Chain chain) {
        super(id, displayName, GroupChain.requireLink(parentLinkHash), chain);
        this.groupId = groupId;
        this.rootId = rootId;
    }

    @Override
    public EntityKind getKind() {
        return EntityKind.LEAF;
    }

    @Override
    public String getParentId() {
        return groupId;
    }

    public String getGroupId() {
        return groupId;
    }

    public String getRootId() {
        return rootId;
    }

    /**
     * 学号，取回放后的状态
     */
    public String getRollNumber() {
        Map<String, Object> state = getCurrentState();
        Object rollNumber = state == null ? null : state.get("rollNumber");
        return rollNumber == null ? null : rollNumber.toString();
    }

    @Override
    protected Set<String> protectedFields() {
        return PROTECTED;
    }

    @Override
    protected Map<String, Object> buildGenesisSnapshot(Map<String, Object> fields, long createdAt) {
        String rollNumber = stringField(fields, "rollNumber", null);
        if (rollNumber == null || rollNumber.isBlank()) {
            throw LedgerException.inputError("rollNumber is required");
        }
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put(FIELD_ID, getId());
        snapshot.put(FIELD_NAME, getDisplayName());
        snapshot.put("rollNumber", rollNumber);
        putIfPresent(snapshot, "email", fields.get("email"));
        snapshot.put("classId", groupId);
        snapshot.put("departmentId", rootId);
        snapshot.put(FIELD_CREATED_AT, createdAt);
        snapshot.put(FIELD_STATUS, STATUS_ACTIVE);
        return snapshot;
    }

    @Override
    protected void fillParentIds(ChainRecord record) {
        record.setRootId(rootId);
        record.setGroupId(groupId);
    }

    /**
     * 追加一条考勤记录并挖矿
     * 同一日期已有记录时拒绝，不追加也不挖矿
     */
    public Block appendRecord(AttendanceRecord record) {
        if (record == null) {
            throw LedgerException.inputError("attendance record is required");
        }
        if (AttendanceStatus.fromLabel(record.getStatus()) == null) {
            throw LedgerException.inputError("Status must be Present, Absent, or Leave");
        }
        if (!LedgerDates.isValidDate(record.getDate())) {
            throw LedgerException.inputError("Invalid date format. Use YYYY-MM-DD");
        }
        if (isDeleted()) {
            throw LedgerException.inputError("Cannot mark attendance for deleted student " + getId());
        }
        if (getRecordByDate(record.getDate()).isPresent()) {
            throw LedgerException.conflict("Attendance already marked for " + record.getDate());
        }
        long now = System.currentTimeMillis();
        Map<String, Object> data = record.toData();
        data.put("recordedAt", now);
        Block block = chain.append(List.of(new Transaction(TransactionType.ATTENDANCE, data, now)));
        log.info("Attendance recorded: {} - {} ({}), block #{}", getDisplayName(), record.getStatus(),
                record.getDate(), block.getIndex());
        return block;
    }

    public List<AttendanceRecord> getRecordHistory() {
        List<AttendanceRecord> history = new ArrayList<>();
        for (Block block : chain.getBlocks()) {
            for (Transaction tx : block.getTransactions()) {
                if (tx.getType() == TransactionType.ATTENDANCE) {
                    history.add(AttendanceRecord.fromData(tx.getData()));
                }
            }
        }
        return history;
    }

    public Optional<AttendanceRecord> getRecordByDate(String date) {
        if (date == null) {
            return Optional.empty();
        }
        for (Block block : chain.getBlocks()) {
            for (Transaction tx : block.getTransactions()) {
                if (tx.getType() == TransactionType.ATTENDANCE && date.equals(tx.getData().get("date"))) {
                    return Optional.of(AttendanceRecord.fromData(tx.getData()));
                }
            }
        }
        return Optional.empty();
    }

    public AttendanceStats getRecordStats() {
        return AttendanceStats.of(getRecordHistory());
    }
}
