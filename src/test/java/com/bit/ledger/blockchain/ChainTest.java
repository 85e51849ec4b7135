package com.bit.ledger.blockchain;

import com.bit.ledger.structure.block.Block;
import com.bit.ledger.structure.tx.Transaction;
import com.bit.ledger.structure.tx.TransactionType;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
public class ChainTest {

    private static List<Transaction> tx(String value) {
        return List.of(Transaction.of(TransactionType.UPDATE, Map.of("value", value)));
    }

    private static Chain chainOf(int difficulty, int appended) {
        Chain chain = new Chain(difficulty);
        chain.pushGenesis(List.of(Transaction.of(TransactionType.ROOT, Map.of("id", "r"))), Chain.ROOT_MARKER);
        for (int i = 0; i < appended; i++) {
            chain.append(tx("v" + i));
        }
        return chain;
    }

    @Test
    void appendedBlocksAreLinkedAndMined() {
        Chain chain = chainOf(2, 3);

        assertEquals(4, chain.length());
        assertEquals("0", chain.getGenesisBlock().getPrevHash());
        for (int i = 1; i < chain.length(); i++) {
            Block block = chain.getBlock(i);
            assertEquals(i, block.getIndex(), "区块序号应连续");
            assertEquals(chain.getBlock(i - 1).getHash(), block.getPrevHash(), "区块应链接到前一区块");
            assertTrue(block.getHash().startsWith("00"));
        }
        ChainVerification verification = chain.verify();
        assertTrue(verification.isValid(), verification.describe());
        assertEquals(4, verification.getCheckedLength());
        assertTrue(chain.meetsProofOfWork());
        assertTrue(chain.containsHash(chain.getGenesisBlock().getHash()));
        assertFalse(chain.containsHash("ffff"));
    }

    @Test
    void tamperedPayloadFailsAtThatIndex() {
        Chain chain = chainOf(1, 2);
        List<Block> blocks = new ArrayList<>(chain.getBlocks());
        Block original = blocks.get(1);
        blocks.set(1, new Block(original.getIndex(), original.getTimestamp(), tx("tampered"),
                original.getPrevHash(), original.getNonce(), original.getHash()));

        ChainVerification verification = Chain.restore(1, blocks).verify();
        assertFalse(verification.isValid());
        assertEquals(1, verification.getFailedIndex(), "应从被篡改的区块 1 开始失败");
        assertEquals(VerificationFailure.HASH_MISMATCH, verification.getFailure());
        log.info("校验结果 {}", verification.describe());
    }

    @Test
    void remintedBlockWithWrongPrevHashBreaksLink() {
        Chain chain = chainOf(1, 2);
        List<Block> blocks = new ArrayList<>(chain.getBlocks());
        Block original = blocks.get(2);
        // 重新挖矿使区块自身有效，但链接指向错误的哈希
        blocks.set(2, Block.mine(2, original.getTimestamp(), original.getTransactions(), "0" + "f".repeat(63), 1));

        ChainVerification verification = Chain.restore(1, blocks).verify();
        assertFalse(verification.isValid());
        assertEquals(2, verification.getFailedIndex());
        assertEquals(VerificationFailure.BROKEN_LINK, verification.getFailure());
    }

    @Test
    void verificationUsesChainOwnDifficulty() {
        Chain easy = chainOf(0, 1);
        assertTrue(easy.verify().isValid(), "难度0的链应按自身难度校验通过");

        ChainVerification stricter = Chain.restore(6, easy.getBlocks()).verify();
        assertFalse(stricter.isValid());
        assertEquals(0, stricter.getFailedIndex(), "创世块同样需要满足工作量证明");
        assertEquals(VerificationFailure.INSUFFICIENT_WORK, stricter.getFailure());
    }

    @Test
    void emptyChainAndBadArguments() {
        Chain chain = new Chain(1);
        assertEquals(VerificationFailure.EMPTY_CHAIN, chain.verify().getFailure());
        assertThrows(IllegalStateException.class, () -> chain.append(tx("x")), "未初始化的链不能追加");
        assertThrows(IllegalStateException.class, chain::getLatestBlock);
        assertNull(chain.getGenesisBlock());
        assertThrows(IllegalArgumentException.class, () -> new Chain(7));
        assertThrows(IllegalArgumentException.class, () -> new Chain(-1));

        chain.pushGenesis(tx("g"), Chain.ROOT_MARKER);
        assertThrows(IllegalStateException.class, () -> chain.pushGenesis(tx("g2"), Chain.ROOT_MARKER),
                "创世块只能有一个");
        assertThrows(IllegalArgumentException.class, () -> chain.append(List.of()));
    }

    @Test
    void discardLatestOnlyRemovesExpectedBlock() {
        Chain chain = chainOf(1, 1);
        Block latest = chain.getLatestBlock();
        Block genesis = chain.getGenesisBlock();

        assertFalse(chain.discardLatest(genesis), "不是最新区块时不能丢弃");
        assertEquals(2, chain.length());
        assertTrue(chain.discardLatest(latest));
        assertEquals(1, chain.length());
        assertEquals(genesis, chain.getLatestBlock());
    }

    @Test
    void limitedBlockCopy() {
        Chain chain = chainOf(0, 3);
        assertEquals(2, chain.getBlocks(2).size());
        assertEquals(4, chain.getBlocks(10).size());
        assertTrue(chain.getBlocks(0).isEmpty());
        assertNull(chain.getBlock(4));
        assertNull(chain.getBlock(-1));
    }
}
