package com.bit.ledger.structure.dto;

import com.bit.ledger.structure.attendance.AttendanceRecord;
import com.bit.ledger.structure.attendance.AttendanceStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 某一天一个班级（或部门、或全校）在籍学生的考勤表，未点名的学生 attendance 为 null
 */
@Data
public class AttendanceSheet {
    private String scope;
    private String scopeId;
    private String scopeName;
    private String date;
    private Summary summary = new Summary();
    private List<Entry> records = new ArrayList<>();

    public void add(Entry entry) {
        records.add(entry);
        summary.total++;
        AttendanceRecord attendance = entry.getAttendance();
        if (attendance == null) {
            summary.unmarked++;
            return;
        }
        summary.marked++;
        AttendanceStatus status = AttendanceStatus.fromLabel(attendance.getStatus());
        if (status == AttendanceStatus.PRESENT) {
            summary.present++;
        } else if (status == AttendanceStatus.ABSENT) {
            summary.absent++;
        } else if (status == AttendanceStatus.LEAVE) {
            summary.leave++;
        }
    }

    @Data
    public static class Summary {
        private int total;
        private int marked;
        private int unmarked;
        private int present;
        private int absent;
        private int leave;
    }

    @Data
    @JsonInclude(JsonInclude.Include.ALWAYS)
    public static class Entry {
        private String studentId;
        private String studentName;
        private String rollNumber;
        private String classId;
        private AttendanceRecord attendance;
    }
}
