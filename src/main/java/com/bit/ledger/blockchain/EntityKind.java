package com.bit.ledger.blockchain;

import com.bit.ledger.structure.tx.TransactionType;
import lombok.Getter;

/**
 * 三级实体：部门(根) → 班级(组) → 学生(叶)
 */
@Getter
public enum EntityKind {
    ROOT("department", "departmentId", "dept", TransactionType.ROOT, "roots.json"),
    GROUP("class", "classId", "class", TransactionType.GROUP, "groups.json"),
    LEAF("student", "studentId", "student", TransactionType.LEAF, "leaves.json");

    /**
     * 业务名称，用于日志和校验报告
     */
    private final String label;

    /**
     * 更新/删除交易中标识实体的字段名
     */
    private final String idField;

    /**
     * 自动生成ID的前缀
     */
    private final String idPrefix;

    private final TransactionType createType;

    /**
     * 快照文件名
     */
    private final String fileName;

    EntityKind(String label, String idField, String idPrefix, TransactionType createType, String fileName) {
        this.label = label;
        this.idField = idField;
        this.idPrefix = idPrefix;
        this.createType = createType;
        this.fileName = fileName;
    }

    public static EntityKind fromLabel(String label) {
        for (EntityKind kind : values()) {
            if (kind.label.equalsIgnoreCase(label) || kind.name().equalsIgnoreCase(label)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("未知实体类型: " + label);
    }
}
