package com.bit.ledger.blockchain;

import com.bit.ledger.database.ChainRecord;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 班级链：创世块 prev_hash 为所属部门链在班级创建时刻的最新哈希
 * 部门链之后继续出块不影响该绑定；部门链被追溯篡改才会使班级失效
 */
public class GroupChain extends EntityChain {

    private static final Set<String> PROTECTED = Set.of(FIELD_ID, FIELD_STATUS, FIELD_CREATED_AT, "departmentId");

    private final String rootId;

    public GroupChain(String id, String displayName, String rootId, String parentLinkHash, int difficulty) {
        this(id, displayName, rootId, parentLinkHash, new Chain(difficulty));
    }

    GroupChain(String id, String displayName, String rootId, String parentLinkHash, Chain chain) {
        super(id, displayName, requireLink(parentLinkHash), chain);
        this.rootId = rootId;
    }

    @Override
    public EntityKind getKind() {
        return EntityKind.GROUP;
    }

    @Override
    public String getParentId() {
        return rootId;
    }

    public String getRootId() {
        return rootId;
    }

    @Override
    protected Set<String> protectedFields() {
        return PROTECTED;
    }

    @Override
    protected Map<String, Object> buildGenesisSnapshot(Map<String, Object> fields, long createdAt) {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put(FIELD_ID, getId());
        snapshot.put(FIELD_NAME, getDisplayName());
        snapshot.put("code", stringField(fields, "code", ""));
        snapshot.put("departmentId", rootId);
        putIfPresent(snapshot, "semester", fields.get("semester"));
        putIfPresent(snapshot, "year", fields.get("year"));
        snapshot.put(FIELD_CREATED_AT, createdAt);
        snapshot.put(FIELD_STATUS, STATUS_ACTIVE);
        return snapshot;
    }

    @Override
    protected void fillParentIds(ChainRecord record) {
        record.setRootId(rootId);
    }

    static String requireLink(String parentLinkHash) {
        if (parentLinkHash == null || parentLinkHash.isEmpty()) {
            throw new IllegalArgumentException("子链必须携带父链哈希");
        }
        return parentLinkHash;
    }
}
