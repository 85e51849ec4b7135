package com.bit.ledger.api;

import com.bit.ledger.blockchain.ChainRegistry;
import com.bit.ledger.exception.LedgerException;
import com.bit.ledger.result.Result;
import com.bit.ledger.service.LedgerQueryService;
import com.bit.ledger.structure.attendance.AttendanceRecord;
import com.bit.ledger.structure.block.Block;
import com.bit.ledger.structure.dto.AttendanceSheet;
import com.bit.ledger.structure.dto.BulkAttendanceRequest;
import com.bit.ledger.structure.dto.BulkAttendanceResult;
import com.bit.ledger.structure.dto.MarkAttendanceRequest;
import com.bit.ledger.structure.dto.StudentAttendance;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/attendance")
public class AttendanceApi {

    @Autowired
    private ChainRegistry chainRegistry;

    @Autowired
    private LedgerQueryService queryService;

    //点名：在学生链上追加并挖出一个考勤块
    @PostMapping("/mark")
    @ResponseStatus(HttpStatus.CREATED)
    public Result<Map<String, Object>> mark(@RequestBody MarkAttendanceRequest request) {
        Block block = chainRegistry.markAttendance(request);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("attendance", block.getFirstTransaction().getData());
        data.put("blockIndex", block.getIndex());
        data.put("blockHash", block.getHash());
        data.put("nonce", block.getNonce());
        return Result.created("Attendance marked successfully", data);
    }

    //批量点名，整批一次落盘
    @PostMapping("/bulk")
    public Result<BulkAttendanceResult> bulk(@RequestBody BulkAttendanceRequest request) {
        BulkAttendanceResult result = chainRegistry.markAttendanceBulk(request);
        return Result.OK("Marked " + result.getSuccessful() + " attendance records, " + result.getFailed() + " failed", result);
    }

    @GetMapping("/student/{studentId}")
    public Result<StudentAttendance> student(@PathVariable String studentId) {
        return Result.OK(queryService.studentAttendance(studentId));
    }

    @GetMapping("/student/{studentId}/{date}")
    public Result<AttendanceRecord> studentOnDate(@PathVariable String studentId, @PathVariable String date) {
        AttendanceRecord record = chainRegistry.getAttendanceByDate(studentId, date)
                .orElseThrow(() -> LedgerException.notFound("No attendance for " + studentId + " on " + date));
        return Result.OK(record);
    }

    @GetMapping("/class/{classId}")
    public Result<AttendanceSheet> classSheet(@PathVariable String classId, @RequestParam(required = false) String date) {
        return Result.OK(queryService.classSheet(classId, date));
    }

    @GetMapping("/department/{departmentId}")
    public Result<AttendanceSheet> departmentSheet(@PathVariable String departmentId,
                                                   @RequestParam(required = false) String date) {
        return Result.OK(queryService.departmentSheet(departmentId, date));
    }

    @GetMapping("/today")
    public Result<AttendanceSheet> today() {
        return Result.OK(queryService.todaySheet());
    }
}
