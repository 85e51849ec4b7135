package com.bit.ledger.structure.attendance;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 一条考勤记录，作为 attendance 交易的 data 写入学生链
 * 不影响学生的当前状态，只累积为可按日期查询的历史
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AttendanceRecord {
    private String studentId;
    private String studentName;
    private String rollNumber;
    private String classId;
    private String departmentId;

    /**
     * YYYY-MM-DD，同一学生同一日期只能有一条
     */
    private String date;

    /**
     * Present / Absent / Leave
     */
    private String status;

    private long markedAt;

    private String markedBy;

    public Map<String, Object> toData() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("studentId", studentId);
        data.put("studentName", studentName);
        data.put("rollNumber", rollNumber);
        data.put("classId", classId);
        data.put("departmentId", departmentId);
        data.put("date", date);
        data.put("status", status);
        data.put("markedAt", markedAt);
        if (markedBy != null) {
            data.put("markedBy", markedBy);
        }
        return data;
    }

    public static AttendanceRecord fromData(Map<String, Object> data) {
        AttendanceRecord record = new AttendanceRecord();
        record.setStudentId(asString(data.get("studentId")));
        record.setStudentName(asString(data.get("studentName")));
        record.setRollNumber(asString(data.get("rollNumber")));
        record.setClassId(asString(data.get("classId")));
        record.setDepartmentId(asString(data.get("departmentId")));
        record.setDate(asString(data.get("date")));
        record.setStatus(asString(data.get("status")));
        Object markedAt = data.get("markedAt");
        record.setMarkedAt(markedAt instanceof Number ? ((Number) markedAt).longValue() : 0L);
        record.setMarkedBy(asString(data.get("markedBy")));
        return record;
    }

    private static String asString(Object value) {
        return value == null ? null : value.toString();
    }
}
