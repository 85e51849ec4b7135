package com.bit.ledger.blockchain.impl;

import com.bit.ledger.blockchain.Chain;
import com.bit.ledger.blockchain.ChainRegistry;
import com.bit.ledger.blockchain.EntityChain;
import com.bit.ledger.blockchain.EntityKind;
import com.bit.ledger.blockchain.GroupChain;
import com.bit.ledger.blockchain.LeafChain;
import com.bit.ledger.blockchain.MiningWorkerPool;
import com.bit.ledger.blockchain.RootChain;
import com.bit.ledger.database.ChainRecord;
import com.bit.ledger.database.ChainStore;
import com.bit.ledger.exception.ErrorType;
import com.bit.ledger.exception.LedgerException;
import com.bit.ledger.structure.attendance.AttendanceRecord;
import com.bit.ledger.structure.attendance.AttendanceStats;
import com.bit.ledger.structure.block.Block;
import com.bit.ledger.structure.dto.BulkAttendanceRequest;
import com.bit.ledger.structure.dto.BulkAttendanceResult;
import com.bit.ledger.structure.dto.MarkAttendanceRequest;
import com.bit.ledger.util.IdGenerator;
import com.bit.ledger.util.LedgerDates;
import com.google.common.util.concurrent.Striped;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * 注册中心实现
 *
 * 写操作流程：在挖矿线程池中按 "类型:ID" 加分段锁 → 挖矿追加 → 持久化受影响的那一级 → 解锁
 * 创建子链时同时锁住子链ID和父链ID，保证取到的父链哈希就是父链此刻已提交的最新哈希
 * 持久化失败时撤销本次内存修改（新建链移除、追加块丢弃），内存与快照保持一致
 */
@Slf4j
public class ChainRegistryImpl implements ChainRegistry {

    private static final int LOCK_STRIPES = 64;

    private static final Comparator<EntityChain> CREATION_ORDER =
            Comparator.comparingLong(EntityChain::getCreatedAt).thenComparing(EntityChain::getId);

    private final int difficulty;

    private final ChainStore store;

    private final MiningWorkerPool miningPool;

    private final Map<EntityKind, ConcurrentMap<String, EntityChain>> chains = new EnumMap<>(EntityKind.class);

    /**
     * 按链串行化写入，不同链之间互不阻塞
     */
    private final Striped<Lock> chainLocks = Striped.lock(LOCK_STRIPES);

    /**
     * 快照写入串行化，注册新链也在这把锁内完成
     */
    private final ReentrantLock persistLock = new ReentrantLock();

    /**
     * 正在创建中的学号，防止两个并发创建抢占同一学号
     */
    private final Set<String> reservedRollNumbers = ConcurrentHashMap.newKeySet();

    public ChainRegistryImpl(int difficulty, ChainStore store, MiningWorkerPool miningPool) {
        if (difficulty < 0 || difficulty > Chain.MAX_DIFFICULTY) {
            throw new LedgerException(ErrorType.CONFIG_INVALID,
                    "difficulty must be between 0 and " + Chain.MAX_DIFFICULTY + ": " + difficulty);
        }
        this.difficulty = difficulty;
        this.store = Objects.requireNonNull(store, "store");
        this.miningPool = Objects.requireNonNull(miningPool, "miningPool");
        for (EntityKind kind : EntityKind.values()) {
            chains.put(kind, new ConcurrentHashMap<>());
        }
    }

    @Override
    public void load() {
        store.open();
        for (EntityKind kind : EntityKind.values()) {
            ConcurrentMap<String, EntityChain> target = chains.get(kind);
            target.clear();
            for (ChainRecord record : store.load(kind)) {
                if (record.getId() == null || record.getId().isBlank()) {
                    log.warn("Skipping {} record without id", kind.getLabel());
                    continue;
                }
                try {
                    target.put(record.getId(), EntityChain.fromRecord(kind, record));
                } catch (IllegalArgumentException e) {
                    throw new LedgerException(ErrorType.PERSIST_FAILED,
                            kind.getLabel() + " record " + record.getId() + " is malformed: " + e.getMessage(), e);
                }
            }
            log.info("Loaded {} {} chains from {}", target.size(), kind.getLabel(), store.describe());
        }
    }

    @Override
    public RootChain createRoot(String id, String name, Map<String, Object> fields) {
        String rootId = resolveId(EntityKind.ROOT, id);
        String rootName = requireName(name);
        return withLocks(List.of(key(EntityKind.ROOT, rootId)), () -> {
            ensureAbsent(EntityKind.ROOT, rootId);
            RootChain root = new RootChain(rootId, rootName, difficulty);
            root.initialize(fields);
            persist(EntityKind.ROOT, List.of(root), root);
            return root;
        });
    }

    @Override
    public GroupChain createGroup(String id, String name, String rootId, Map<String, Object> fields) {
        String groupId = resolveId(EntityKind.GROUP, id);
        String groupName = requireName(name);
        if (rootId == null || rootId.isBlank()) {
            throw LedgerException.inputError("departmentId is required");
        }
        return withLocks(List.of(key(EntityKind.GROUP, groupId), key(EntityKind.ROOT, rootId)), () -> {
            RootChain root = getRoot(rootId);
            if (root.isDeleted()) {
                throw LedgerException.inputError("Cannot create class under deleted department");
            }
            ensureAbsent(EntityKind.GROUP, groupId);
            GroupChain group = new GroupChain(groupId, groupName, rootId, root.getLatestHash(), difficulty);
            group.initialize(fields);
            persist(EntityKind.GROUP, List.of(group), group);
            return group;
        });
    }

    @Override
    public LeafChain createLeaf(String id, String name, String groupId, Map<String, Object> fields) {
        String leafId = resolveId(EntityKind.LEAF, id);
        String leafName = requireName(name);
        if (groupId == null || groupId.isBlank()) {
            throw LedgerException.inputError("classId is required");
        }
        Object roll = fields == null ? null : fields.get("rollNumber");
        if (roll == null || roll.toString().isBlank()) {
            throw LedgerException.inputError("rollNumber is required");
        }
        String rollNumber = roll.toString();
        return withLocks(List.of(key(EntityKind.LEAF, leafId), key(EntityKind.GROUP, groupId)), () -> {
            GroupChain group = getGroup(groupId);
            if (group.isDeleted()) {
                throw LedgerException.inputError("Cannot create student under deleted class");
            }
            ensureAbsent(EntityKind.LEAF, leafId);
            if (!reservedRollNumbers.add(rollNumber)) {
                throw LedgerException.conflict("Roll number " + rollNumber + " already exists");
            }
            try {
                if (rollNumberTaken(rollNumber)) {
                    throw LedgerException.conflict("Roll number " + rollNumber + " already exists");
                }
                LeafChain leaf = new LeafChain(leafId, leafName, groupId, group.getRootId(),
                        group.getLatestHash(), difficulty);
                leaf.initialize(fields);
                persist(EntityKind.LEAF, List.of(leaf), leaf);
                return leaf;
            } finally {
                reservedRollNumbers.remove(rollNumber);
            }
        });
    }

    @Override
    public EntityChain get(EntityKind kind, String id) {
        return find(kind, id).orElseThrow(() -> LedgerException.notFound(kind.getLabel() + " " + id + " not found"));
    }

    @Override
    public Optional<EntityChain> find(EntityKind kind, String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(chains.get(kind).get(id));
    }

    @Override
    public RootChain getRoot(String id) {
        return (RootChain) get(EntityKind.ROOT, id);
    }

    @Override
    public GroupChain getGroup(String id) {
        return (GroupChain) get(EntityKind.GROUP, id);
    }

    @Override
    public LeafChain getLeaf(String id) {
        return (LeafChain) get(EntityKind.LEAF, id);
    }

    @Override
    public List<EntityChain> list(EntityKind kind) {
        return chains.get(kind).values().stream()
                .sorted(CREATION_ORDER)
                .collect(Collectors.toList());
    }

    @Override
    public List<RootChain> listRoots() {
        return list(EntityKind.ROOT).stream().map(RootChain.class::cast).collect(Collectors.toList());
    }

    @Override
    public List<GroupChain> listGroups() {
        return list(EntityKind.GROUP).stream().map(GroupChain.class::cast).collect(Collectors.toList());
    }

    @Override
    public List<LeafChain> listLeaves() {
        return list(EntityKind.LEAF).stream().map(LeafChain.class::cast).collect(Collectors.toList());
    }

    @Override
    public List<GroupChain> listGroupsByRoot(String rootId) {
        return listGroups().stream()
                .filter(group -> Objects.equals(group.getRootId(), rootId))
                .collect(Collectors.toList());
    }

    @Override
    public List<LeafChain> listLeavesByGroup(String groupId) {
        return listLeaves().stream()
                .filter(leaf -> Objects.equals(leaf.getGroupId(), groupId))
                .collect(Collectors.toList());
    }

    @Override
    public List<LeafChain> listLeavesByRoot(String rootId) {
        return listLeaves().stream()
                .filter(leaf -> Objects.equals(leaf.getRootId(), rootId))
                .collect(Collectors.toList());
    }

    @Override
    public Block update(EntityKind kind, String id, Map<String, Object> patch) {
        return withLocks(List.of(key(kind, id)), () -> {
            EntityChain entity = get(kind, id);
            Block block = entity.appendUpdate(patch);
            commitAppend(entity, block);
            return block;
        });
    }

    @Override
    public Block delete(EntityKind kind, String id) {
        return withLocks(List.of(key(kind, id)), () -> {
            EntityChain entity = get(kind, id);
            Block block = entity.appendDelete();
            commitAppend(entity, block);
            return block;
        });
    }

    @Override
    public Block markAttendance(MarkAttendanceRequest request) {
        if (request == null || isBlank(request.getStudentId()) || isBlank(request.getStatus())) {
            throw LedgerException.inputError("studentId and status are required");
        }
        String studentId = request.getStudentId();
        return withLocks(List.of(key(EntityKind.LEAF, studentId)), () -> {
            LeafChain leaf = getLeaf(studentId);
            AttendanceRecord record = buildRecord(leaf, request.getStatus(), request.getDate(), request.getMarkedBy());
            Block block = leaf.appendRecord(record);
            commitAppend(leaf, block);
            return block;
        });
    }

    @Override
    public BulkAttendanceResult markAttendanceBulk(BulkAttendanceRequest request) {
        if (request == null || request.getAttendanceRecords() == null || request.getAttendanceRecords().isEmpty()) {
            throw LedgerException.inputError("attendanceRecords must be a non-empty array");
        }
        List<MarkAttendanceRequest> items = request.getAttendanceRecords();
        List<String> keys = items.stream()
                .filter(Objects::nonNull)
                .map(MarkAttendanceRequest::getStudentId)
                .filter(Objects::nonNull)
                .distinct()
                .map(studentId -> key(EntityKind.LEAF, studentId))
                .collect(Collectors.toList());

        // 一个任务内持有全部相关学生的锁，整批只写一次快照
        return withLocks(keys, () -> {
            BulkAttendanceResult result = new BulkAttendanceResult();
            List<LeafChain> touched = new ArrayList<>();
            List<Block> appended = new ArrayList<>();
            for (MarkAttendanceRequest item : items) {
                String studentId = item == null ? null : item.getStudentId();
                if (isBlank(studentId) || isBlank(item.getStatus())) {
                    result.failure(studentId, "Missing studentId or status");
                    continue;
                }
                try {
                    LeafChain leaf = getLeaf(studentId);
                    String markedBy = item.getMarkedBy() != null ? item.getMarkedBy() : request.getMarkedBy();
                    AttendanceRecord record = buildRecord(leaf, item.getStatus(), item.getDate(), markedBy);
                    Block block = leaf.appendRecord(record);
                    touched.add(leaf);
                    appended.add(block);
                    result.success(studentId, record.getDate(), block.getIndex(), block.getHash());
                } catch (LedgerException e) {
                    result.failure(studentId, e.getDetail());
                }
            }
            if (!appended.isEmpty()) {
                try {
                    persist(EntityKind.LEAF, touched, null);
                } catch (LedgerException e) {
                    for (int i = appended.size() - 1; i >= 0; i--) {
                        touched.get(i).getChain().discardLatest(appended.get(i));
                    }
                    throw e;
                }
            }
            log.info("Bulk attendance: {} successful, {} failed", result.getSuccessful(), result.getFailed());
            return result;
        });
    }

    @Override
    public Optional<AttendanceRecord> getAttendanceByDate(String studentId, String date) {
        return getLeaf(studentId).getRecordByDate(date);
    }

    @Override
    public List<AttendanceRecord> getAttendanceHistory(String studentId) {
        return getLeaf(studentId).getRecordHistory();
    }

    @Override
    public AttendanceStats getAttendanceStats(String studentId) {
        return getLeaf(studentId).getRecordStats();
    }

    @Override
    public int getDifficulty() {
        return difficulty;
    }

    private AttendanceRecord buildRecord(LeafChain leaf, String status, String date, String markedBy) {
        String day = isBlank(date) ? LedgerDates.today() : date;
        return AttendanceRecord.builder()
                .studentId(leaf.getId())
                .studentName(leaf.getCurrentName())
                .rollNumber(leaf.getRollNumber())
                .classId(leaf.getGroupId())
                .departmentId(leaf.getRootId())
                .date(day)
                .status(status)
                .markedAt(System.currentTimeMillis())
                .markedBy(markedBy)
                .build();
    }

    /**
     * 持久化一次追加，失败则丢弃该区块
     */
    private void commitAppend(EntityChain entity, Block block) {
        try {
            persist(entity.getKind(), List.of(entity), null);
        } catch (LedgerException e) {
            entity.getChain().discardLatest(block);
            throw e;
        }
    }

    /**
     * 重写某一级的快照：pending 中的链写入全部区块，其他链只写已提交部分
     * @param created 本次新建的链，在锁内注册，写入失败时移除
     */
    private void persist(EntityKind kind, Collection<? extends EntityChain> pending, EntityChain created) {
        ConcurrentMap<String, EntityChain> target = chains.get(kind);
        persistLock.lock();
        try {
            if (created != null) {
                target.put(created.getId(), created);
            }
            List<ChainRecord> records = new ArrayList<>();
            for (EntityChain entity : list(kind)) {
                records.add(entity.toRecord(pending.contains(entity)));
            }
            store.save(kind, records);
            for (EntityChain entity : pending) {
                entity.markCommitted();
            }
        } catch (RuntimeException e) {
            if (created != null) {
                target.remove(created.getId(), created);
            }
            log.error("Persisting {} chains failed, mutation rolled back: {}", kind.getLabel(), e.getMessage());
            if (e instanceof LedgerException ledger && ledger.getErrorType() == ErrorType.PERSIST_FAILED) {
                throw ledger;
            }
            throw new LedgerException(ErrorType.PERSIST_FAILED, "写入 " + kind.getFileName() + " 失败", e);
        } finally {
            persistLock.unlock();
        }
    }

    /**
     * 在挖矿线程池中持锁执行，调用方等待完成
     */
    private <T> T withLocks(List<String> keys, Callable<T> task) {
        return miningPool.execute(() -> {
            List<Lock> acquired = new ArrayList<>();
            try {
                // bulkGet 按分段顺序返回，避免多把锁之间死锁
                for (Lock lock : chainLocks.bulkGet(keys)) {
                    lock.lock();
                    acquired.add(lock);
                }
                return task.call();
            } finally {
                for (int i = acquired.size() - 1; i >= 0; i--) {
                    acquired.get(i).unlock();
                }
            }
        });
    }

    private boolean rollNumberTaken(String rollNumber) {
        for (EntityChain entity : chains.get(EntityKind.LEAF).values()) {
            LeafChain leaf = (LeafChain) entity;
            if (rollNumber.equals(leaf.getRollNumber()) && !leaf.isDeleted()) {
                return true;
            }
        }
        return false;
    }

    private void ensureAbsent(EntityKind kind, String id) {
        if (chains.get(kind).containsKey(id)) {
            throw LedgerException.conflict(kind.getLabel() + " " + id + " already exists");
        }
    }

    private static String key(EntityKind kind, String id) {
        return kind.name() + ":" + id;
    }

    private static String resolveId(EntityKind kind, String id) {
        return isBlank(id) ? IdGenerator.generateId(kind.getIdPrefix()) : id.trim();
    }

    private static String requireName(String name) {
        if (isBlank(name)) {
            throw LedgerException.inputError("name is required");
        }
        return name.trim();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
