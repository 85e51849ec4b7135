package com.bit.ledger.database;

import com.bit.ledger.blockchain.EntityKind;

import java.util.List;

/**
 * 实体链快照存储：每一级实体一个集合
 * 写入是整集合替换，实现需保证写到一半崩溃时对外可见的数据不损坏
 */
public interface ChainStore {

    /**
     * 准备存储（创建目录、初始化空集合）
     */
    void open();

    /**
     * 读取某一级的全部链记录，集合不存在时返回空列表
     */
    List<ChainRecord> load(EntityKind kind);

    /**
     * 原子地替换某一级的全部链记录
     */
    void save(EntityKind kind, List<ChainRecord> records);

    /**
     * 存储位置描述，用于日志
     */
    String describe();
}
