package com.bit.ledger.blockchain;

import com.bit.ledger.structure.block.Block;
import com.bit.ledger.structure.tx.Transaction;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 有序、只追加的区块序列，所有区块共享同一个难度
 *
 * 不变量：
 * 初始化后 blocks 非空；blocks[0].index == 0；
 * i > 0 时 blocks[i].prev_hash == blocks[i-1].hash 且 blocks[i].index == i；
 * 每个区块哈希都有 difficulty 个前导 '0'
 *
 * 写入由上层按链加锁串行化；读使用写时复制列表，校验和快照无需加锁
 */
@Slf4j
public class Chain {

    /**
     * 根链创世块的 prev_hash
     */
    public static final String ROOT_MARKER = "0";

    public static final int MAX_DIFFICULTY = 6;

    private final CopyOnWriteArrayList<Block> blocks;

    @Getter
    private final int difficulty;

    public Chain(int difficulty) {
        if (difficulty < 0 || difficulty > MAX_DIFFICULTY) {
            throw new IllegalArgumentException("难度必须在 0.." + MAX_DIFFICULTY + " 之间: " + difficulty);
        }
        this.difficulty = difficulty;
        this.blocks = new CopyOnWriteArrayList<>();
    }

    /**
     * 从快照恢复，区块原样装入，不做任何校验
     */
    public static Chain restore(int difficulty, List<Block> blocks) {
        Chain chain = new Chain(difficulty);
        if (blocks != null) {
            chain.blocks.addAll(blocks);
        }
        return chain;
    }

    /**
     * 构造并挖出 index 0 的创世块
     * @param parentHash 根链传 {@link #ROOT_MARKER}，子链传父链在此刻的最新哈希
     */
    public Block pushGenesis(List<Transaction> payload, String parentHash) {
        if (!blocks.isEmpty()) {
            throw new IllegalStateException("创世块已存在，链长度: " + blocks.size());
        }
        if (parentHash == null || parentHash.isEmpty()) {
            throw new IllegalArgumentException("创世块 prev_hash 不能为空");
        }
        Block genesis = Block.mine(0, System.currentTimeMillis(), payload, parentHash, difficulty);
        blocks.add(genesis);
        return genesis;
    }

    /**
     * 以最新区块哈希为 prev_hash 构造下一个区块，同步挖矿后追加
     * 调用方拿到的一定是已挖出的区块
     */
    public Block append(List<Transaction> payload) {
        if (blocks.isEmpty()) {
            throw new IllegalStateException("链尚未初始化创世块");
        }
        if (payload == null || payload.isEmpty()) {
            throw new IllegalArgumentException("区块载荷不能为空");
        }
        Block latest = getLatestBlock();
        Block block = Block.mine(blocks.size(), System.currentTimeMillis(), payload, latest.getHash(), difficulty);
        blocks.add(block);
        return block;
    }

    /**
     * 撤销最后一次追加：仅在持久化失败、区块尚未对外提交时使用
     * @return 最新区块确为 expected 且已移除时返回 true
     */
    public boolean discardLatest(Block expected) {
        int last = blocks.size() - 1;
        if (last < 0 || !blocks.get(last).equals(expected)) {
            return false;
        }
        blocks.remove(last);
        log.warn("Block {} discarded (hash={})", expected.getIndex(), expected.getHash());
        return true;
    }

    /**
     * 整链完整性校验，返回第一个失败区块
     * 每个区块检查：序号、哈希重算、与前一区块的链接（创世块除外）、工作量证明
     * 创世块只豁免链接检查，哈希和难度照常检查
     */
    public ChainVerification verify() {
        // 写时复制列表的快照，校验期间的追加不影响本次结果
        Object[] snapshot = blocks.toArray();
        int length = snapshot.length;
        if (length == 0) {
            return ChainVerification.failed(0, VerificationFailure.EMPTY_CHAIN, 0);
        }
        for (int i = 0; i < length; i++) {
            Block current = (Block) snapshot[i];
            if (current.getIndex() != i) {
                return ChainVerification.failed(i, VerificationFailure.BAD_INDEX, length);
            }
            if (!current.isValid()) {
                return ChainVerification.failed(i, VerificationFailure.HASH_MISMATCH, length);
            }
            if (i > 0) {
                Block previous = (Block) snapshot[i - 1];
                if (!Objects.equals(previous.getHash(), current.getPrevHash())) {
                    return ChainVerification.failed(i, VerificationFailure.BROKEN_LINK, length);
                }
            }
            if (!current.meetsDifficulty(difficulty)) {
                return ChainVerification.failed(i, VerificationFailure.INSUFFICIENT_WORK, length);
            }
        }
        return ChainVerification.ok(length);
    }

    /**
     * 所有区块是否都满足本链难度
     */
    public boolean meetsProofOfWork() {
        for (Block block : blocks) {
            if (!block.meetsDifficulty(difficulty)) {
                return false;
            }
        }
        return true;
    }

    public Block getLatestBlock() {
        if (blocks.isEmpty()) {
            throw new IllegalStateException("链为空");
        }
        return blocks.get(blocks.size() - 1);
    }

    public Block getGenesisBlock() {
        return blocks.isEmpty() ? null : blocks.get(0);
    }

    public Block getBlock(int index) {
        if (index < 0 || index >= blocks.size()) {
            return null;
        }
        return blocks.get(index);
    }

    public int length() {
        return blocks.size();
    }

    public boolean isEmpty() {
        return blocks.isEmpty();
    }

    /**
     * 是否存在哈希为 hash 的区块；快照中的区块哈希可能缺失
     */
    public boolean containsHash(String hash) {
        if (hash == null) {
            return false;
        }
        for (Block block : blocks) {
            if (hash.equals(block.getHash())) {
                return true;
            }
        }
        return false;
    }

    public List<Block> getBlocks() {
        return Collections.unmodifiableList(blocks);
    }

    /**
     * 前 limit 个区块的不可变副本
     */
    public List<Block> getBlocks(int limit) {
        Object[] snapshot = blocks.toArray();
        int end = Math.min(Math.max(limit, 0), snapshot.length);
        Block[] copy = new Block[end];
        System.arraycopy(snapshot, 0, copy, 0, end);
        return List.of(copy);
    }
}
