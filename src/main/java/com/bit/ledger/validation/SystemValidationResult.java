package com.bit.ledger.validation;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 全系统校验报告：系统有效 ⇔ 每个实体都有效
 */
@Data
public class SystemValidationResult {
    private boolean valid = true;
    private Summary summary = new Summary();
    private InvalidEntities invalidEntities = new InvalidEntities();
    private List<ValidationResult> details = new ArrayList<>();

    @Data
    public static class Summary {
        private int totalDepartments;
        private int validDepartments;
        private int totalClasses;
        private int validClasses;
        private int totalStudents;
        private int validStudents;
    }

    @Data
    public static class InvalidEntities {
        private List<String> departments = new ArrayList<>();
        private List<String> classes = new ArrayList<>();
        private List<String> students = new ArrayList<>();
    }
}
