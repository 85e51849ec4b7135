package com.bit.ledger.service.impl;

import com.bit.ledger.blockchain.ChainRegistry;
import com.bit.ledger.blockchain.EntityChain;
import com.bit.ledger.blockchain.EntityKind;
import com.bit.ledger.blockchain.GroupChain;
import com.bit.ledger.blockchain.LeafChain;
import com.bit.ledger.blockchain.RootChain;
import com.bit.ledger.exception.LedgerException;
import com.bit.ledger.service.LedgerQueryService;
import com.bit.ledger.structure.block.Block;
import com.bit.ledger.structure.dto.AttendanceSheet;
import com.bit.ledger.structure.dto.ClassStats;
import com.bit.ledger.structure.dto.DepartmentStats;
import com.bit.ledger.structure.dto.EntityView;
import com.bit.ledger.structure.dto.StudentAttendance;
import com.bit.ledger.util.LedgerDates;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
public class LedgerQueryServiceImpl implements LedgerQueryService {

    private final ChainRegistry registry;

    public LedgerQueryServiceImpl(ChainRegistry registry) {
        this.registry = registry;
    }

    @Override
    public EntityView view(EntityKind kind, String id) {
        return EntityView.of(registry.get(kind, id));
    }

    @Override
    public List<EntityView> list(EntityKind kind, boolean activeOnly) {
        return toViews(registry.list(kind), activeOnly);
    }

    @Override
    public List<EntityView> listClassesByDepartment(String departmentId, boolean activeOnly) {
        registry.getRoot(departmentId);
        return toViews(registry.listGroupsByRoot(departmentId), activeOnly);
    }

    @Override
    public List<EntityView> listStudentsByClass(String classId, boolean activeOnly) {
        registry.getGroup(classId);
        return toViews(registry.listLeavesByGroup(classId), activeOnly);
    }

    @Override
    public List<EntityView> listStudentsByDepartment(String departmentId, boolean activeOnly) {
        registry.getRoot(departmentId);
        return toViews(registry.listLeavesByRoot(departmentId), activeOnly);
    }

    @Override
    public List<EntityView> search(EntityKind kind, String query) {
        if (query == null || query.isBlank()) {
            throw LedgerException.inputError("Search query required");
        }
        String term = query.trim().toLowerCase(Locale.ROOT);
        String secondaryField = kind == EntityKind.LEAF ? "rollNumber" : "code";
        return registry.list(kind).stream()
                .filter(entity -> !entity.isDeleted())
                .filter(entity -> contains(entity.getCurrentName(), term)
                        || contains(field(entity, secondaryField), term))
                .map(EntityView::of)
                .collect(Collectors.toList());
    }

    @Override
    public DepartmentStats departmentStats(String departmentId) {
        RootChain root = registry.getRoot(departmentId);
        List<GroupChain> classes = registry.listGroupsByRoot(departmentId);
        List<LeafChain> students = registry.listLeavesByRoot(departmentId);

        DepartmentStats stats = new DepartmentStats();
        stats.setDepartmentId(departmentId);
        stats.setChainLength(root.getChainLength());
        stats.setTotalClasses(classes.size());
        stats.setActiveClasses(countActive(classes));
        stats.setTotalStudents(students.size());
        stats.setActiveStudents(countActive(students));
        stats.setCreatedAt(root.getCreatedAt());
        return stats;
    }

    @Override
    public ClassStats classStats(String classId) {
        GroupChain group = registry.getGroup(classId);
        List<LeafChain> students = registry.listLeavesByGroup(classId);

        ClassStats stats = new ClassStats();
        stats.setClassId(classId);
        stats.setDepartmentId(group.getRootId());
        stats.setChainLength(group.getChainLength());
        stats.setTotalStudents(students.size());
        stats.setActiveStudents(countActive(students));
        stats.setCreatedAt(group.getCreatedAt());
        return stats;
    }

    @Override
    public List<Block> blocks(EntityKind kind, String id) {
        return registry.get(kind, id).getChain().getBlocks();
    }

    @Override
    public Block block(EntityKind kind, String id, int index) {
        Block block = registry.get(kind, id).getChain().getBlock(index);
        if (block == null) {
            throw LedgerException.notFound("block " + index + " not found in " + kind.getLabel() + " " + id);
        }
        return block;
    }

    @Override
    public StudentAttendance studentAttendance(String studentId) {
        LeafChain leaf = registry.getLeaf(studentId);
        StudentAttendance attendance = new StudentAttendance();
        attendance.setStudentId(studentId);
        attendance.setStudentName(leaf.getCurrentName());
        attendance.setRollNumber(leaf.getRollNumber());
        attendance.setRecords(leaf.getRecordHistory());
        attendance.setStats(leaf.getRecordStats());
        return attendance;
    }

    @Override
    public AttendanceSheet classSheet(String classId, String date) {
        GroupChain group = registry.getGroup(classId);
        return sheet("class", classId, group.getCurrentName(), resolveDate(date), registry.listLeavesByGroup(classId));
    }

    @Override
    public AttendanceSheet departmentSheet(String departmentId, String date) {
        RootChain root = registry.getRoot(departmentId);
        return sheet("department", departmentId, root.getCurrentName(), resolveDate(date),
                registry.listLeavesByRoot(departmentId));
    }

    @Override
    public AttendanceSheet todaySheet() {
        return sheet("all", null, null, LedgerDates.today(), registry.listLeaves());
    }

    private AttendanceSheet sheet(String scope, String scopeId, String scopeName, String date, List<LeafChain> students) {
        AttendanceSheet sheet = new AttendanceSheet();
        sheet.setScope(scope);
        sheet.setScopeId(scopeId);
        sheet.setScopeName(scopeName);
        sheet.setDate(date);
        for (LeafChain leaf : students) {
            // 只统计在籍学生
            if (leaf.isDeleted()) {
                continue;
            }
            AttendanceSheet.Entry entry = new AttendanceSheet.Entry();
            entry.setStudentId(leaf.getId());
            entry.setStudentName(leaf.getCurrentName());
            entry.setRollNumber(leaf.getRollNumber());
            entry.setClassId(leaf.getGroupId());
            entry.setAttendance(leaf.getRecordByDate(date).orElse(null));
            sheet.add(entry);
        }
        log.debug("Attendance sheet {} {} on {}: {}", scope, scopeId, date, sheet.getSummary());
        return sheet;
    }

    private static String resolveDate(String date) {
        if (date == null || date.isBlank()) {
            return LedgerDates.today();
        }
        if (!LedgerDates.isValidDate(date)) {
            throw LedgerException.inputError("Invalid date format. Use YYYY-MM-DD");
        }
        return date;
    }

    private static List<EntityView> toViews(List<? extends EntityChain> chains, boolean activeOnly) {
        return chains.stream()
                .filter(entity -> !activeOnly || !entity.isDeleted())
                .map(EntityView::of)
                .collect(Collectors.toList());
    }

    private static int countActive(List<? extends EntityChain> chains) {
        int active = 0;
        for (EntityChain entity : chains) {
            if (EntityChain.STATUS_ACTIVE.equals(entity.getStatus())) {
                active++;
            }
        }
        return active;
    }

    private static String field(EntityChain entity, String key) {
        Map<String, Object> state = entity.getCurrentState();
        Object value = state == null ? null : state.get(key);
        return value == null ? null : value.toString();
    }

    private static boolean contains(String value, String term) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(term);
    }
}
