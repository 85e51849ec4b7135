package com.bit.ledger.structure.dto;

import com.bit.ledger.structure.attendance.AttendanceRecord;
import com.bit.ledger.structure.attendance.AttendanceStats;
import lombok.Data;

import java.util.List;

@Data
public class StudentAttendance {
    private String studentId;
    private String studentName;
    private String rollNumber;
    private AttendanceStats stats;
    private List<AttendanceRecord> records;
}
