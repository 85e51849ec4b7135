package com.bit.ledger.validation;

/**
 * 单个实体的校验进度
 * UNCHECKED → CHAIN_CHECKED → PARENT_LINK_CHECKED → VALID | INVALID
 * 根链没有父链步骤，可从 CHAIN_CHECKED 直接结束；任何阶段发现致命问题都可直接进入 INVALID
 */
public enum ValidationState {
    UNCHECKED,
    CHAIN_CHECKED,
    PARENT_LINK_CHECKED,
    VALID,
    INVALID;

    public boolean canAdvanceTo(ValidationState next) {
        switch (this) {
            case UNCHECKED:
                return next == CHAIN_CHECKED || next == INVALID;
            case CHAIN_CHECKED:
                return next == PARENT_LINK_CHECKED || next == VALID || next == INVALID;
            case PARENT_LINK_CHECKED:
                return next == VALID || next == INVALID;
            default:
                return false;
        }
    }

    public boolean isTerminal() {
        return this == VALID || this == INVALID;
    }
}
