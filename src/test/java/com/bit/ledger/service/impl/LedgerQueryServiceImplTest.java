package com.bit.ledger.service.impl;

import com.bit.ledger.blockchain.EntityKind;
import com.bit.ledger.blockchain.MiningWorkerPool;
import com.bit.ledger.blockchain.impl.ChainRegistryImpl;
import com.bit.ledger.database.memory.MemoryChainStore;
import com.bit.ledger.exception.ErrorType;
import com.bit.ledger.exception.LedgerException;
import com.bit.ledger.structure.dto.AttendanceSheet;
import com.bit.ledger.structure.dto.ClassStats;
import com.bit.ledger.structure.dto.DepartmentStats;
import com.bit.ledger.structure.dto.EntityView;
import com.bit.ledger.structure.dto.MarkAttendanceRequest;
import com.bit.ledger.structure.dto.StudentAttendance;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
public class LedgerQueryServiceImplTest {

    private MiningWorkerPool pool;
    private ChainRegistryImpl registry;
    private LedgerQueryServiceImpl queryService;

    @BeforeEach
    void setUp() {
        pool = new MiningWorkerPool(2, 32);
        registry = new ChainRegistryImpl(1, new MemoryChainStore(), pool);
        registry.load();
        queryService = new LedgerQueryServiceImpl(registry);

        registry.createRoot("dept-1", "School of Computing", Map.of("code", "SOC"));
        registry.createRoot("dept-2", "Physics", Map.of("code", "PHY"));
        registry.createGroup("class-1", "Data Structures", "dept-1", Map.of("code", "CS201"));
        registry.createGroup("class-2", "Algorithms", "dept-1", Map.of("code", "CS301"));
        registry.createLeaf("s1", "Alice", "class-1", Map.of("rollNumber", "CS-001"));
        registry.createLeaf("s2", "Bob", "class-1", Map.of("rollNumber", "CS-002"));
        registry.createLeaf("s3", "Carol", "class-2", Map.of("rollNumber", "CS-003"));
    }

    @AfterEach
    void tearDown() {
        pool.close();
    }

    private static List<String> ids(List<EntityView> views) {
        return views.stream().map(EntityView::getId).collect(Collectors.toList());
    }

    @Test
    void departmentAndClassStats() {
        registry.delete(EntityKind.GROUP, "class-2");
        registry.delete(EntityKind.LEAF, "s2");

        DepartmentStats dept = queryService.departmentStats("dept-1");
        assertEquals(1, dept.getChainLength());
        assertEquals(2, dept.getTotalClasses());
        assertEquals(1, dept.getActiveClasses());
        assertEquals(3, dept.getTotalStudents());
        assertEquals(2, dept.getActiveStudents());
        assertEquals(registry.getRoot("dept-1").getCreatedAt(), dept.getCreatedAt());

        ClassStats cls = queryService.classStats("class-1");
        assertEquals("dept-1", cls.getDepartmentId());
        assertEquals(2, cls.getTotalStudents());
        assertEquals(1, cls.getActiveStudents());

        assertEquals(ErrorType.NOT_FOUND, assertThrows(LedgerException.class,
                () -> queryService.departmentStats("dept-404")).getErrorType());
    }

    @Test
    void activeOnlyListings() {
        registry.delete(EntityKind.LEAF, "s2");

        assertEquals(List.of("s1", "s2"), ids(queryService.listStudentsByClass("class-1", false)));
        assertEquals(List.of("s1"), ids(queryService.listStudentsByClass("class-1", true)));
        assertEquals(2, queryService.listStudentsByDepartment("dept-1", true).size());
        assertEquals(List.of("class-1", "class-2"), ids(queryService.listClassesByDepartment("dept-1", true)));
        assertEquals(3, queryService.list(EntityKind.LEAF, false).size());

        EntityView deleted = queryService.view(EntityKind.LEAF, "s2");
        assertEquals("deleted", deleted.getStatus());
        assertEquals("class-1", deleted.getClassId());
        assertEquals("dept-1", deleted.getDepartmentId());
        assertEquals(2, deleted.getChainLength());
    }

    @Test
    void searchMatchesNameCodeAndRollNumber() {
        assertEquals(List.of("dept-1"), ids(queryService.search(EntityKind.ROOT, "computing")));
        assertEquals(List.of("dept-2"), ids(queryService.search(EntityKind.ROOT, "phy")));
        assertEquals(List.of("class-2"), ids(queryService.search(EntityKind.GROUP, "cs301")));
        assertEquals(List.of("s2"), ids(queryService.search(EntityKind.LEAF, "cs-002")));
        assertEquals(List.of("s3"), ids(queryService.search(EntityKind.LEAF, "CAROL")));

        registry.delete(EntityKind.LEAF, "s3");
        assertTrue(queryService.search(EntityKind.LEAF, "carol").isEmpty(), "搜索只返回在籍实体");

        registry.update(EntityKind.LEAF, "s1", Map.of("name", "Alicia"));
        assertEquals(List.of("s1"), ids(queryService.search(EntityKind.LEAF, "alicia")), "搜索使用回放后的名称");

        assertEquals(ErrorType.INPUT_ERROR, assertThrows(LedgerException.class,
                () -> queryService.search(EntityKind.LEAF, " ")).getErrorType());
    }

    @Test
    void attendanceSheets() {
        registry.markAttendance(new MarkAttendanceRequest("s1", "Present", "2024-11-16"));
        registry.markAttendance(new MarkAttendanceRequest("s3", "Leave", "2024-11-16"));
        registry.markAttendance(new MarkAttendanceRequest("s1", "Absent", "2024-11-17"));

        AttendanceSheet classSheet = queryService.classSheet("class-1", "2024-11-16");
        assertEquals("Data Structures", classSheet.getScopeName());
        assertEquals(2, classSheet.getSummary().getTotal());
        assertEquals(1, classSheet.getSummary().getMarked());
        assertEquals(1, classSheet.getSummary().getUnmarked());
        assertEquals(1, classSheet.getSummary().getPresent());
        assertNull(classSheet.getRecords().get(1).getAttendance(), "未点名的学生 attendance 为 null");

        AttendanceSheet deptSheet = queryService.departmentSheet("dept-1", "2024-11-16");
        assertEquals(3, deptSheet.getSummary().getTotal());
        assertEquals(1, deptSheet.getSummary().getLeave());

        registry.delete(EntityKind.LEAF, "s2");
        assertEquals(1, queryService.classSheet("class-1", "2024-11-16").getSummary().getTotal(), "考勤表只包含在籍学生");

        assertEquals(ErrorType.INPUT_ERROR, assertThrows(LedgerException.class,
                () -> queryService.classSheet("class-1", "16-11-2024")).getErrorType());
        assertNotNull(queryService.todaySheet().getDate());

        StudentAttendance attendance = queryService.studentAttendance("s1");
        assertEquals(2, attendance.getRecords().size());
        assertEquals(50.0, attendance.getStats().getPercentage());
        assertEquals("CS-001", attendance.getRollNumber());
    }

    @Test
    void blockExplorer() {
        registry.update(EntityKind.ROOT, "dept-1", Map.of("description", "updated"));

        assertEquals(2, queryService.blocks(EntityKind.ROOT, "dept-1").size());
        assertEquals(1, queryService.block(EntityKind.ROOT, "dept-1", 1).getIndex());
        assertEquals(ErrorType.NOT_FOUND, assertThrows(LedgerException.class,
                () -> queryService.block(EntityKind.ROOT, "dept-1", 5)).getErrorType());
    }
}
