package com.bit.ledger.blockchain;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Chain.verify() 的结果：成功，或第一个失败区块的序号与原因
 */
@Getter
@ToString
@AllArgsConstructor
public class ChainVerification {

    private final boolean valid;

    /**
     * 第一个失败区块序号，成功时为 -1
     */
    private final int failedIndex;

    private final VerificationFailure failure;

    /**
     * 校验时链的长度；链只追加，长度不变则结果可复用
     */
    private final int checkedLength;

    public static ChainVerification ok(int checkedLength) {
        return new ChainVerification(true, -1, null, checkedLength);
    }

    public static ChainVerification failed(int index, VerificationFailure failure, int checkedLength) {
        return new ChainVerification(false, index, failure, checkedLength);
    }

    public String describe() {
        if (valid) {
            return "chain valid (" + checkedLength + " blocks)";
        }
        return "Block " + failedIndex + ": " + failure.getDesc();
    }
}
