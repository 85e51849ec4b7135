package com.bit.ledger.validation;

import com.bit.ledger.blockchain.EntityKind;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class ValidationResult {
    private boolean valid = true;
    private ValidationState state = ValidationState.UNCHECKED;
    private String entityType;
    private String entityId;
    private String entityName;
    private List<String> errors = new ArrayList<>();
    private List<String> warnings = new ArrayList<>();
    private ValidationDetails details = new ValidationDetails();

    public ValidationResult() {
    }

    public ValidationResult(EntityKind kind, String entityId) {
        this.entityType = kind.getLabel();
        this.entityId = entityId;
    }

    public void error(String message) {
        errors.add(message);
        valid = false;
    }

    public void warning(String message) {
        warnings.add(message);
    }

    public void advance(ValidationState next) {
        if (!state.canAdvanceTo(next)) {
            throw new IllegalStateException("illegal validation transition " + state + " -> " + next);
        }
        state = next;
    }

    /**
     * 结束校验：没有错误为 VALID，否则 INVALID
     */
    public ValidationResult finish() {
        advance(errors.isEmpty() ? ValidationState.VALID : ValidationState.INVALID);
        valid = state == ValidationState.VALID;
        return this;
    }
}
