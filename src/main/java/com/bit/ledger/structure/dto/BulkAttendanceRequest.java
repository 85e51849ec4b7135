package com.bit.ledger.structure.dto;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 批量考勤：逐条处理，单条失败不影响其他条目；整批只写一次快照
 */
@Data
public class BulkAttendanceRequest {
    private List<MarkAttendanceRequest> attendanceRecords = new ArrayList<>();

    private String markedBy;
}
