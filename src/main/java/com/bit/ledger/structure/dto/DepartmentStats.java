package com.bit.ledger.structure.dto;

import lombok.Data;

@Data
public class DepartmentStats {
    private String departmentId;
    private int chainLength;
    private int totalClasses;
    private int activeClasses;
    private int totalStudents;
    private int activeStudents;
    private long createdAt;
}
