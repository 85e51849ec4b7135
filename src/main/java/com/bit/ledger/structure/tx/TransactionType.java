package com.bit.ledger.structure.tx;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

import java.util.HashMap;
import java.util.Map;

/**
 * 交易类型，持久化时写入 label
 * ROOT / GROUP / LEAF 为各级实体创世块中的创建交易
 * DEPARTMENT / CLASS / STUDENT 是旧版快照的创建交易标签，只在加载时出现，写回时保持原标签，哈希不变
 */
public enum TransactionType {
    ROOT("root"),
    GROUP("group"),
    LEAF("leaf"),
    UPDATE("update"),
    DELETE("delete"),
    ATTENDANCE("attendance"),
    DEPARTMENT("department"),
    CLASS("class"),
    STUDENT("student");

    @Getter
    private final String label;

    TransactionType(String label) {
        this.label = label;
    }

    private static final Map<String, TransactionType> LABEL_TO_ENUM = new HashMap<>();

    static {
        for (TransactionType type : values()) {
            LABEL_TO_ENUM.put(type.label, type);
        }
    }

    @JsonValue
    public String toJson() {
        return label;
    }

    @JsonCreator
    public static TransactionType fromLabel(String label) {
        TransactionType type = LABEL_TO_ENUM.get(label);
        if (type == null) {
            throw new IllegalArgumentException("未知交易类型: " + label);
        }
        return type;
    }

    public boolean isCreate() {
        return this == ROOT || this == GROUP || this == LEAF
                || this == DEPARTMENT || this == CLASS || this == STUDENT;
    }
}
