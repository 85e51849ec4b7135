package com.bit.ledger.validation;

import com.bit.ledger.blockchain.EntityKind;

/**
 * 级联校验：子链有效要求自身链完整、创世块父链绑定正确、且祖先链全部有效
 * 只产出诊断结果，不修复任何数据
 */
public interface ValidationService {

    /**
     * 部门不存在时抛出 NOT_FOUND
     */
    ValidationResult validateRoot(String id);

    ValidationResult validateGroup(String id);

    ValidationResult validateLeaf(String id);

    ValidationResult validate(EntityKind kind, String id);

    /**
     * 校验失败时抛出 INTEGRITY_FAILURE，错误信息为全部失败原因
     */
    ValidationResult requireValid(EntityKind kind, String id);

    SystemValidationResult validateSystem();
}
