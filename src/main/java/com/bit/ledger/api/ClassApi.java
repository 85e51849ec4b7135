package com.bit.ledger.api;

import com.bit.ledger.blockchain.ChainRegistry;
import com.bit.ledger.blockchain.EntityKind;
import com.bit.ledger.blockchain.GroupChain;
import com.bit.ledger.result.Result;
import com.bit.ledger.service.LedgerQueryService;
import com.bit.ledger.structure.block.Block;
import com.bit.ledger.structure.dto.ClassStats;
import com.bit.ledger.structure.dto.CreateEntityRequest;
import com.bit.ledger.structure.dto.EntityView;
import com.bit.ledger.validation.ValidationResult;
import com.bit.ledger.validation.ValidationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/classes")
public class ClassApi {

    @Autowired
    private ChainRegistry chainRegistry;

    @Autowired
    private LedgerQueryService queryService;

    @Autowired
    private ValidationService validationService;

    //创建班级链，创世块绑定部门链最新哈希
    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Result<EntityView> create(@RequestBody CreateEntityRequest request) {
        GroupChain group = chainRegistry.createGroup(request.getId(), request.getName(),
                request.getDepartmentId(), request.getFields());
        return Result.created("Class created successfully", EntityView.of(group));
    }

    @GetMapping
    public Result<List<EntityView>> list(@RequestParam(defaultValue = "false") boolean activeOnly) {
        return Result.OK(queryService.list(EntityKind.GROUP, activeOnly));
    }

    @GetMapping("/search")
    public Result<List<EntityView>> search(@RequestParam String q) {
        return Result.OK(queryService.search(EntityKind.GROUP, q));
    }

    @GetMapping("/department/{departmentId}")
    public Result<List<EntityView>> byDepartment(@PathVariable String departmentId,
                                                 @RequestParam(defaultValue = "false") boolean activeOnly) {
        return Result.OK(queryService.listClassesByDepartment(departmentId, activeOnly));
    }

    @GetMapping("/{id}")
    public Result<EntityView> get(@PathVariable String id) {
        return Result.OK(queryService.view(EntityKind.GROUP, id));
    }

    @PutMapping("/{id}")
    public Result<EntityView> update(@PathVariable String id, @RequestBody Map<String, Object> patch) {
        chainRegistry.update(EntityKind.GROUP, id, patch);
        return Result.OK("Class updated successfully", queryService.view(EntityKind.GROUP, id));
    }

    @DeleteMapping("/{id}")
    public Result<EntityView> delete(@PathVariable String id) {
        chainRegistry.delete(EntityKind.GROUP, id);
        return Result.OK("Class marked as deleted", queryService.view(EntityKind.GROUP, id));
    }

    @GetMapping("/{id}/validate")
    public Result<ValidationResult> validate(@PathVariable String id,
                                             @RequestParam(defaultValue = "false") boolean strict) {
        if (strict) {
            return Result.OK(validationService.requireValid(EntityKind.GROUP, id));
        }
        return Result.OK(validationService.validateGroup(id));
    }

    @GetMapping("/{id}/stats")
    public Result<ClassStats> stats(@PathVariable String id) {
        return Result.OK(queryService.classStats(id));
    }

    @GetMapping("/{id}/blocks")
    public Result<List<Block>> blocks(@PathVariable String id) {
        return Result.OK(queryService.blocks(EntityKind.GROUP, id));
    }

    @GetMapping("/{id}/blocks/{index}")
    public Result<Block> block(@PathVariable String id, @PathVariable int index) {
        return Result.OK(queryService.block(EntityKind.GROUP, id, index));
    }

    @GetMapping("/{id}/students")
    public Result<List<EntityView>> students(@PathVariable String id,
                                             @RequestParam(defaultValue = "false") boolean activeOnly) {
        return Result.OK(queryService.listStudentsByClass(id, activeOnly));
    }
}
