package com.bit.ledger.blockchain;

import com.bit.ledger.database.ChainRecord;
import com.bit.ledger.exception.LedgerException;
import com.bit.ledger.structure.block.Block;
import com.bit.ledger.structure.tx.Transaction;
import com.bit.ledger.structure.tx.TransactionType;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 带实体身份的链：部门 / 班级 / 学生共用的创建、更新、软删除与状态回放
 *
 * 当前状态不存储，由区块回放得出：创建快照为基，update 逐个合并字段，delete 把 status 置为 deleted
 * 子链在构造时由注册中心传入父链最新哈希并原样保存，实体自己从不查找父链
 */
@Slf4j
public abstract class EntityChain {

    public static final String FIELD_ID = "id";
    public static final String FIELD_NAME = "name";
    public static final String FIELD_STATUS = "status";
    public static final String FIELD_CREATED_AT = "createdAt";

    public static final String STATUS_ACTIVE = "active";
    public static final String STATUS_DELETED = "deleted";

    private static final Set<String> IDENTITY_FIELDS = Set.of(FIELD_ID, FIELD_STATUS, FIELD_CREATED_AT);

    @Getter
    private final String id;

    /**
     * 创建时的名称；名称更新只体现在回放状态里
     */
    @Getter
    private final String displayName;

    /**
     * 创建时刻父链的最新哈希，根链为 null
     */
    @Getter
    private final String parentLinkHash;

    @Getter
    protected final Chain chain;

    /**
     * 已写入快照的区块数，快照只写已提交部分
     */
    private volatile int committedLength;

    protected EntityChain(String id, String displayName, String parentLinkHash, Chain chain) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("实体ID不能为空");
        }
        this.id = id;
        this.displayName = displayName;
        this.parentLinkHash = parentLinkHash;
        this.chain = chain;
    }

    public abstract EntityKind getKind();

    /**
     * 直接父实体ID，根链为 null
     */
    public abstract String getParentId();

    /**
     * 创世块中的创建快照
     */
    protected abstract Map<String, Object> buildGenesisSnapshot(Map<String, Object> fields, long createdAt);

    /**
     * 记录中的父级字段（root_id / group_id）
     */
    protected abstract void fillParentIds(ChainRecord record);

    /**
     * 更新补丁中不允许出现的字段
     */
    protected Set<String> protectedFields() {
        return IDENTITY_FIELDS;
    }

    /**
     * 挖出创世块：根链 prev_hash 为 "0"，子链为保存的父链哈希
     */
    public Block initialize(Map<String, Object> fields) {
        long now = System.currentTimeMillis();
        Map<String, Object> snapshot = buildGenesisSnapshot(fields == null ? Map.of() : fields, now);
        Transaction create = new Transaction(getKind().getCreateType(), snapshot, now);
        String prevHash = parentLinkHash == null ? Chain.ROOT_MARKER : parentLinkHash;
        Block genesis = chain.pushGenesis(List.of(create), prevHash);
        log.info("{} chain created: {} ({}), genesis hash={}", getKind().getLabel(), displayName, id, genesis.getHash());
        return genesis;
    }

    public Block appendUpdate(Map<String, Object> patch) {
        if (patch == null || patch.isEmpty()) {
            throw LedgerException.inputError("update patch is empty");
        }
        Set<String> forbidden = protectedFields();
        for (Map.Entry<String, Object> entry : patch.entrySet()) {
            String key = entry.getKey();
            if (key == null || key.isBlank()) {
                throw LedgerException.inputError("update patch contains a blank field name");
            }
            if (forbidden.contains(key)) {
                throw LedgerException.inputError("field '" + key + "' cannot be updated");
            }
        }
        if (patch.containsKey(FIELD_NAME)) {
            Object name = patch.get(FIELD_NAME);
            if (!(name instanceof String text) || text.isBlank()) {
                throw LedgerException.inputError("name must be a non-empty string");
            }
        }
        long now = System.currentTimeMillis();
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(getKind().getIdField(), id);
        data.put("updates", new LinkedHashMap<>(patch));
        data.put("updatedAt", now);
        Block block = chain.append(List.of(new Transaction(TransactionType.UPDATE, data, now)));
        log.info("{} updated: {} ({}), block #{}", getKind().getLabel(), displayName, id, block.getIndex());
        return block;
    }

    /**
     * 软删除：追加删除标记块，不移除任何区块；重复删除同样追加，状态保持 deleted
     */
    public Block appendDelete() {
        long now = System.currentTimeMillis();
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(getKind().getIdField(), id);
        data.put(FIELD_STATUS, STATUS_DELETED);
        data.put("deletedAt", now);
        Block block = chain.append(List.of(new Transaction(TransactionType.DELETE, data, now)));
        log.info("{} marked as deleted: {} ({}), block #{}", getKind().getLabel(), displayName, id, block.getIndex());
        return block;
    }

    /**
     * 回放全部区块得出当前状态，链为空时返回 null
     * 考勤交易不参与回放；返回的顶层 Map 每次新建，嵌套的 Map / List 来自交易数据，只读
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> getCurrentState() {
        Map<String, Object> state = null;
        for (Block block : chain.getBlocks()) {
            for (Transaction tx : block.getTransactions()) {
                TransactionType type = tx.getType();
                if (type.isCreate()) {
                    if (state == null) {
                        state = new LinkedHashMap<>(tx.getData());
                    }
                } else if (state == null) {
                    continue;
                } else if (type == TransactionType.UPDATE) {
                    Object updates = tx.getData().get("updates");
                    if (updates instanceof Map) {
                        state.putAll((Map<String, Object>) updates);
                    }
                } else if (type == TransactionType.DELETE) {
                    state.put(FIELD_STATUS, STATUS_DELETED);
                }
            }
        }
        return state;
    }

    public String getStatus() {
        Map<String, Object> state = getCurrentState();
        Object status = state == null ? null : state.get(FIELD_STATUS);
        return status == null ? null : status.toString();
    }

    public boolean isDeleted() {
        return STATUS_DELETED.equals(getStatus());
    }

    /**
     * 当前名称（回放后），为空时退回创建名称
     */
    public String getCurrentName() {
        Map<String, Object> state = getCurrentState();
        Object name = state == null ? null : state.get(FIELD_NAME);
        return name == null ? displayName : name.toString();
    }

    /**
     * 校验创建时记录的父子绑定：创世块 prev_hash == 保存的父链哈希
     * 父链之后继续出块不影响结果，只有父链被追溯篡改才会破坏绑定
     */
    public boolean validateParentLink(String currentParentHash) {
        Block genesis = chain.getGenesisBlock();
        if (genesis == null) {
            return false;
        }
        String expected = parentLinkHash == null ? Chain.ROOT_MARKER : parentLinkHash;
        if (!expected.equals(genesis.getPrevHash())) {
            log.error("{} {}: parent link broken in genesis block", getKind().getLabel(), id);
            return false;
        }
        if (parentHasGrown(currentParentHash)) {
            log.warn("{} {}: parent chain has been extended since creation", getKind().getLabel(), id);
        }
        return true;
    }

    /**
     * 父链在本链创建后是否又出了块，仅作提示
     */
    public boolean parentHasGrown(String currentParentHash) {
        return parentLinkHash != null && currentParentHash != null && !parentLinkHash.equals(currentParentHash);
    }

    public Block getLatestBlock() {
        return chain.getLatestBlock();
    }

    public String getLatestHash() {
        return chain.getLatestBlock().getHash();
    }

    public int getChainLength() {
        return chain.length();
    }

    public long getCreatedAt() {
        Block genesis = chain.getGenesisBlock();
        return genesis == null ? 0L : genesis.getTimestamp();
    }

    public int getCommittedLength() {
        return committedLength;
    }

    /**
     * 当前全部区块已写入快照
     */
    public void markCommitted() {
        this.committedLength = chain.length();
    }

    /**
     * @param includePending true 时包含尚未提交的区块
     */
    public ChainRecord toRecord(boolean includePending) {
        ChainRecord record = new ChainRecord();
        record.setId(id);
        record.setDisplayName(displayName);
        record.setParentLinkHash(parentLinkHash);
        record.setDifficulty(chain.getDifficulty());
        record.setChain(chain.getBlocks(includePending ? chain.length() : committedLength));
        fillParentIds(record);
        return record;
    }

    /**
     * 从快照记录恢复，恢复出的区块视为已提交
     */
    public static EntityChain fromRecord(EntityKind kind, ChainRecord record) {
        Chain chain = Chain.restore(record.getDifficulty(), record.getChain());
        EntityChain entity;
        switch (kind) {
            case ROOT:
                entity = new RootChain(record.getId(), record.getDisplayName(), chain);
                break;
            case GROUP:
                entity = new GroupChain(record.getId(), record.getDisplayName(), record.getRootId(),
                        record.getParentLinkHash(), chain);
                break;
            case LEAF:
                entity = new LeafChain(record.getId(), record.getDisplayName(), record.getGroupId(),
                        record.getRootId(), record.getParentLinkHash(), chain);
                break;
            default:
                throw new IllegalArgumentException("未知实体类型: " + kind);
        }
        entity.markCommitted();
        return entity;
    }

    protected static void putIfPresent(Map<String, Object> target, String key, Object value) {
        if (value != null) {
            target.put(key, value);
        }
    }

    protected static String stringField(Map<String, Object> fields, String key, String defaultValue) {
        Object value = fields.get(key);
        return value == null ? defaultValue : value.toString();
    }
}
