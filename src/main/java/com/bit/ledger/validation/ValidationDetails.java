package com.bit.ledger.validation;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

/**
 * 各项检查结果，未执行到的检查为 null
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ValidationDetails {
    private Integer chainLength;
    private Integer difficulty;
    private Boolean genesisValid;
    private Boolean chainIntegrity;
    private Boolean proofOfWork;

    /**
     * 创世块 prev_hash 与创建时记录的父链哈希一致
     */
    private Boolean parentLink;

    /**
     * 父链中仍能找到该哈希对应的区块
     */
    private Boolean parentAnchored;

    private Boolean parentValid;
}
