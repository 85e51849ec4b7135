package com.bit.ledger.structure.attendance;

import lombok.Getter;

public enum AttendanceStatus {
    PRESENT("Present"),
    ABSENT("Absent"),
    LEAVE("Leave");

    @Getter
    private final String label;

    AttendanceStatus(String label) {
        this.label = label;
    }

    /**
     * 按标签解析，大小写敏感，非法值返回 null
     */
    public static AttendanceStatus fromLabel(String label) {
        for (AttendanceStatus status : values()) {
            if (status.label.equals(label)) {
                return status;
            }
        }
        return null;
    }
}
