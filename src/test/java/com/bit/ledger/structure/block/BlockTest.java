package com.bit.ledger.structure.block;

import com.bit.ledger.structure.tx.Transaction;
import com.bit.ledger.structure.tx.TransactionType;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
public class BlockTest {

    private static List<Transaction> payload(String name) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("id", "dept-1");
        data.put("name", name);
        data.put("createdAt", 1731715200000L);
        return List.of(new Transaction(TransactionType.ROOT, data, 1731715200000L));
    }

    @Test
    void minedBlockMeetsDifficultyAndIsValid() {
        Block block = Block.mine(0, 1731715200000L, payload("Computing"), "0", 2);
        log.info("区块 {}", block);

        assertTrue(block.getHash().startsWith("00"), "哈希应有两个前导0");
        assertTrue(block.isValid(), "刚挖出的区块应当有效");
        assertTrue(block.meetsDifficulty(2));
        assertEquals(block.getHash(), block.calculateHash());
        assertEquals(64, block.getHash().length(), "SHA-256 十六进制长度应为64");
        assertEquals(block.getHash().toLowerCase(), block.getHash(), "哈希应为小写十六进制");
    }

    @Test
    void changedPayloadInvalidatesStoredHash() {
        Block original = Block.mine(1, 1731715200000L, payload("Computing"), "00abc", 1);
        Block tampered = new Block(original.getIndex(), original.getTimestamp(), payload("Hacked"),
                original.getPrevHash(), original.getNonce(), original.getHash());

        assertTrue(original.isValid());
        assertFalse(tampered.isValid(), "修改载荷而不重新挖矿，区块应失效");

        Block otherNonce = new Block(original.getIndex(), original.getTimestamp(), original.getTransactions(),
                original.getPrevHash(), original.getNonce() + 1, original.getHash());
        assertFalse(otherNonce.isValid(), "修改 nonce 后区块应失效");
    }

    @Test
    void zeroDifficultyAcceptsFirstNonce() {
        Block block = Block.mine(0, 1L, payload("Computing"), "0", 0);
        assertEquals(0, block.getNonce());
        assertTrue(block.isValid());
        assertEquals("", Block.target(0));
        assertEquals("000", Block.target(3));
    }

    @Test
    void hashSurvivesSnapshotReload() throws Exception {
        Map<String, Object> patch = new LinkedHashMap<>();
        patch.put("name", "Computer Science");
        patch.put("code", "CS");
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("departmentId", "dept-1");
        data.put("updates", patch);
        data.put("updatedAt", 1731715200123L);
        Block block = Block.mine(3, 1731715200456L,
                List.of(new Transaction(TransactionType.UPDATE, data, 1731715200123L)), "00ff", 1);

        ObjectMapper mapper = new ObjectMapper();
        String json = mapper.writeValueAsString(block);
        log.info("快照 {}", json);
        assertTrue(json.contains("\"prev_hash\""), "快照字段名应为 prev_hash");
        assertFalse(json.contains("\"valid\""), "isValid 不应写入快照");

        Block loaded = mapper.readValue(json, Block.class);
        assertEquals(block, loaded);
        assertTrue(loaded.isValid(), "重新加载后哈希应保持一致");
        assertEquals(TransactionType.UPDATE, loaded.getFirstTransaction().getType());
    }

    @Test
    void negativeDifficultyRejected() {
        assertThrows(IllegalArgumentException.class, () -> Block.mine(0, 1L, payload("x"), "0", -1));
    }
}
