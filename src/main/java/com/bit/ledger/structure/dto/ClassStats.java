package com.bit.ledger.structure.dto;

import lombok.Data;

@Data
public class ClassStats {
    private String classId;
    private String departmentId;
    private int chainLength;
    private int totalStudents;
    private int activeStudents;
    private long createdAt;
}
