package com.bit.ledger.structure.attendance;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AttendanceStats {
    private int total;
    private int present;
    private int absent;
    private int leave;

    /**
     * 出勤率（百分比，保留两位小数）
     */
    private double percentage;

    public static AttendanceStats of(List<AttendanceRecord> history) {
        int present = 0;
        int absent = 0;
        int leave = 0;
        for (AttendanceRecord record : history) {
            AttendanceStatus status = AttendanceStatus.fromLabel(record.getStatus());
            if (status == null) {
                continue;
            }
            switch (status) {
                case PRESENT:
                    present++;
                    break;
                case ABSENT:
                    absent++;
                    break;
                case LEAVE:
                    leave++;
                    break;
                default:
                    break;
            }
        }
        int total = history.size();
        return new AttendanceStats(total, present, absent, leave, percentage(present, total));
    }

    public static double percentage(int present, int total) {
        if (total == 0) {
            return 0;
        }
        return Math.round(present * 10000.0 / total) / 100.0;
    }
}
