package com.bit.ledger.service;

import com.bit.ledger.blockchain.EntityKind;
import com.bit.ledger.structure.block.Block;
import com.bit.ledger.structure.dto.AttendanceSheet;
import com.bit.ledger.structure.dto.ClassStats;
import com.bit.ledger.structure.dto.DepartmentStats;
import com.bit.ledger.structure.dto.EntityView;
import com.bit.ledger.structure.dto.StudentAttendance;

import java.util.List;

/**
 * 只读查询：列表、搜索、统计、区块浏览、考勤表
 * 全部基于回放状态，不修改任何链
 */
public interface LedgerQueryService {

    EntityView view(EntityKind kind, String id);

    /**
     * @param activeOnly true 时过滤掉已软删除的实体
     */
    List<EntityView> list(EntityKind kind, boolean activeOnly);

    List<EntityView> listClassesByDepartment(String departmentId, boolean activeOnly);

    List<EntityView> listStudentsByClass(String classId, boolean activeOnly);

    List<EntityView> listStudentsByDepartment(String departmentId, boolean activeOnly);

    /**
     * 在籍实体中按名称（部门/班级还匹配 code，学生还匹配学号）不区分大小写搜索
     */
    List<EntityView> search(EntityKind kind, String query);

    DepartmentStats departmentStats(String departmentId);

    ClassStats classStats(String classId);

    List<Block> blocks(EntityKind kind, String id);

    Block block(EntityKind kind, String id, int index);

    StudentAttendance studentAttendance(String studentId);

    /**
     * @param date 为空时取当天
     */
    AttendanceSheet classSheet(String classId, String date);

    AttendanceSheet departmentSheet(String departmentId, String date);

    AttendanceSheet todaySheet();
}
