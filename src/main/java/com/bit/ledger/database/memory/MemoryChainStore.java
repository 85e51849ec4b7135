package com.bit.ledger.database.memory;

import com.bit.ledger.blockchain.EntityKind;
import com.bit.ledger.database.ChainRecord;
import com.bit.ledger.database.ChainStore;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 内存快照，进程退出即丢失；用于测试和 storage-type=memory
 */
public class MemoryChainStore implements ChainStore {

    private final Map<EntityKind, List<ChainRecord>> collections = new EnumMap<>(EntityKind.class);

    @Override
    public void open() {
        synchronized (collections) {
            for (EntityKind kind : EntityKind.values()) {
                collections.putIfAbsent(kind, List.of());
            }
        }
    }

    @Override
    public List<ChainRecord> load(EntityKind kind) {
        synchronized (collections) {
            return collections.getOrDefault(kind, List.of());
        }
    }

    @Override
    public void save(EntityKind kind, List<ChainRecord> records) {
        synchronized (collections) {
            collections.put(kind, List.copyOf(records));
        }
    }

    @Override
    public String describe() {
        return "memory";
    }
}
