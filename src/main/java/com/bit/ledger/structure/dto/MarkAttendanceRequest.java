package com.bit.ledger.structure.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MarkAttendanceRequest {
    private String studentId;

    /**
     * Present / Absent / Leave
     */
    private String status;

    /**
     * YYYY-MM-DD，缺省为当天
     */
    private String date;

    private String markedBy;

    public MarkAttendanceRequest(String studentId, String status, String date) {
        this(studentId, status, date, null);
    }
}
