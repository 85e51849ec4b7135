package com.bit.ledger.structure.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
public class BulkAttendanceResult {
    private int successful;
    private int failed;
    private List<Item> results = new ArrayList<>();
    private List<Item> errors = new ArrayList<>();

    public void success(String studentId, String date, long blockIndex, String blockHash) {
        results.add(new Item(studentId, date, blockIndex, blockHash, null));
        successful++;
    }

    public void failure(String studentId, String error) {
        errors.add(new Item(studentId, null, -1, null, error));
        failed++;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Item {
        private String studentId;
        private String date;
        private long blockIndex;
        private String blockHash;
        private String error;
    }
}
