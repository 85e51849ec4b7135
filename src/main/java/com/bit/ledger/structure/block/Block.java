package com.bit.ledger.structure.block;

import com.bit.ledger.structure.tx.Transaction;
import com.bit.ledger.util.CanonicalJson;
import com.bit.ledger.util.Sha;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * 单条链中的一个区块
 * 不可变：挖矿在构造前完成，追加到链上之后任何字段都不能再修改
 *
 * 哈希计算：SHA-256(index + prev_hash + timestamp + 规范化JSON(transactions) + nonce)
 * 区块有效 ⇔ 按当前字段重新计算出的哈希等于存储的 hash
 */
@Slf4j
@Getter
@ToString(of = {"index", "prevHash", "nonce", "hash"})
@EqualsAndHashCode
@JsonPropertyOrder({"index", "timestamp", "prev_hash", "nonce", "hash", "transactions"})
public final class Block {

    /**
     * 链中的位置，创世块为 0
     */
    private final long index;

    /**
     * 出块时间（毫秒）
     */
    private final long timestamp;

    private final List<Transaction> transactions;

    /**
     * 前一区块哈希；根链创世块为 "0"，子链创世块为父链在子链创建时刻的最新哈希
     */
    @JsonProperty("prev_hash")
    private final String prevHash;

    private final long nonce;

    private final String hash;

    /**
     * 从快照恢复区块，字段原样保留，不重新计算哈希（篡改要留给校验去发现）
     */
    @JsonCreator
    public Block(@JsonProperty("index") long index,
                 @JsonProperty("timestamp") long timestamp,
                 @JsonProperty("transactions") List<Transaction> transactions,
                 @JsonProperty("prev_hash") String prevHash,
                 @JsonProperty("nonce") long nonce,
                 @JsonProperty("hash") String hash) {
        this.index = index;
        this.timestamp = timestamp;
        this.transactions = transactions == null ? List.of() : List.copyOf(transactions);
        this.prevHash = prevHash;
        this.nonce = nonce;
        this.hash = hash;
    }

    /**
     * 工作量证明：nonce 从 0 递增，直到哈希前 difficulty 个十六进制字符全为 '0'
     * 没有尝试次数上限，difficulty 由调用方约束在 0..6
     */
    public static Block mine(long index, long timestamp, List<Transaction> transactions, String prevHash, int difficulty) {
        if (difficulty < 0) {
            throw new IllegalArgumentException("难度不能为负数: " + difficulty);
        }
        List<Transaction> payload = transactions == null ? List.of() : List.copyOf(transactions);
        // 除 nonce 以外的部分只序列化一次
        String prefix = hashPrefix(index, prevHash, timestamp, payload);
        String target = target(difficulty);

        long nonce = 0;
        String hash = Sha.sha256Hex(prefix + nonce);
        while (!hash.startsWith(target)) {
            nonce++;
            hash = Sha.sha256Hex(prefix + nonce);
        }
        log.debug("Block mined: index={}, hash={}, nonce={}", index, hash, nonce);
        return new Block(index, timestamp, payload, prevHash, nonce, hash);
    }

    /**
     * 按当前字段重新计算哈希
     */
    public String calculateHash() {
        return Sha.sha256Hex(hashPrefix(index, prevHash, timestamp, transactions) + nonce);
    }

    @JsonIgnore
    public boolean isValid() {
        return hash != null && hash.equals(calculateHash());
    }

    /**
     * 存储的哈希是否满足给定难度（只看前缀，不重新计算）
     */
    public boolean meetsDifficulty(int difficulty) {
        return hash != null && hash.startsWith(target(difficulty));
    }

    /**
     * 取第一条交易，每个区块至少一条
     */
    @JsonIgnore
    public Transaction getFirstTransaction() {
        return transactions.isEmpty() ? null : transactions.get(0);
    }

    public static String target(int difficulty) {
        return "0".repeat(Math.max(0, difficulty));
    }

    private static String hashPrefix(long index, String prevHash, long timestamp, List<Transaction> transactions) {
        return index + String.valueOf(prevHash) + timestamp + CanonicalJson.write(transactions);
    }
}
