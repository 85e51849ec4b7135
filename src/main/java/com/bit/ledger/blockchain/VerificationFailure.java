package com.bit.ledger.blockchain;

public enum VerificationFailure {
    EMPTY_CHAIN("链为空"),
    BAD_INDEX("区块序号不连续"),
    HASH_MISMATCH("区块哈希与内容不符"),
    BROKEN_LINK("prev_hash 与前一区块哈希不符"),
    INSUFFICIENT_WORK("哈希不满足工作量证明难度");

    private final String desc;

    VerificationFailure(String desc) {
        this.desc = desc;
    }

    public String getDesc() {
        return desc;
    }
}
