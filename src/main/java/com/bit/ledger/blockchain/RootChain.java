package com.bit.ledger.blockchain;

import com.bit.ledger.database.ChainRecord;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 部门链：层级的根，创世块 prev_hash 固定为 "0"
 */
public class RootChain extends EntityChain {

    public RootChain(String id, String displayName, int difficulty) {
        this(id, displayName, new Chain(difficulty));
    }

    RootChain(String id, String displayName, Chain chain) {
        super(id, displayName, null, chain);
    }

    @Override
    public EntityKind getKind() {
        return EntityKind.ROOT;
    }

    @Override
    public String getParentId() {
        return null;
    }

    @Override
    protected Map<String, Object> buildGenesisSnapshot(Map<String, Object> fields, long createdAt) {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put(FIELD_ID, getId());
        snapshot.put(FIELD_NAME, getDisplayName());
        snapshot.put("code", stringField(fields, "code", ""));
        snapshot.put("description", stringField(fields, "description", ""));
        snapshot.put(FIELD_CREATED_AT, createdAt);
        snapshot.put(FIELD_STATUS, STATUS_ACTIVE);
        return snapshot;
    }

    @Override
    protected void fillParentIds(ChainRecord record) {
        // 根链无父级
    }
}
