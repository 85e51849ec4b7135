package com.bit.ledger.api;

import com.bit.ledger.blockchain.ChainRegistry;
import com.bit.ledger.blockchain.EntityKind;
import com.bit.ledger.blockchain.RootChain;
import com.bit.ledger.result.Result;
import com.bit.ledger.service.LedgerQueryService;
import com.bit.ledger.structure.block.Block;
import com.bit.ledger.structure.dto.CreateEntityRequest;
import com.bit.ledger.structure.dto.DepartmentStats;
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
@RequestMapping("/api/departments")
public class DepartmentApi {

    @Autowired
    private ChainRegistry chainRegistry;

    @Autowired
    private LedgerQueryService queryService;

    @Autowired
    private ValidationService validationService;

    //创建部门链（创世块 prev_hash = "0"）
    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Result<EntityView> create(@RequestBody CreateEntityRequest request) {
        RootChain root = chainRegistry.createRoot(request.getId(), request.getName(), request.getFields());
        return Result.created("Department created successfully", EntityView.of(root));
    }

    @GetMapping
    public Result<List<EntityView>> list(@RequestParam(defaultValue = "false") boolean activeOnly) {
        return Result.OK(queryService.list(EntityKind.ROOT, activeOnly));
    }

    @GetMapping("/search")
    public Result<List<EntityView>> search(@RequestParam String q) {
        return Result.OK(queryService.search(EntityKind.ROOT, q));
    }

    @GetMapping("/{id}")
    public Result<EntityView> get(@PathVariable String id) {
        return Result.OK(queryService.view(EntityKind.ROOT, id));
    }

    //更新：追加 update 块，历史区块不变
    @PutMapping("/{id}")
    public Result<EntityView> update(@PathVariable String id, @RequestBody Map<String, Object> patch) {
        chainRegistry.update(EntityKind.ROOT, id, patch);
        return Result.OK("Department updated successfully", queryService.view(EntityKind.ROOT, id));
    }

    //软删除：追加 delete 块
    @DeleteMapping("/{id}")
    public Result<EntityView> delete(@PathVariable String id) {
        chainRegistry.delete(EntityKind.ROOT, id);
        return Result.OK("Department marked as deleted", queryService.view(EntityKind.ROOT, id));
    }

    @GetMapping("/{id}/validate")
    public Result<ValidationResult> validate(@PathVariable String id,
                                             @RequestParam(defaultValue = "false") boolean strict) {
        if (strict) {
            return Result.OK(validationService.requireValid(EntityKind.ROOT, id));
        }
        return Result.OK(validationService.validateRoot(id));
    }

    @GetMapping("/{id}/stats")
    public Result<DepartmentStats> stats(@PathVariable String id) {
        return Result.OK(queryService.departmentStats(id));
    }

    @GetMapping("/{id}/blocks")
    public Result<List<Block>> blocks(@PathVariable String id) {
        return Result.OK(queryService.blocks(EntityKind.ROOT, id));
    }

    @GetMapping("/{id}/blocks/{index}")
    public Result<Block> block(@PathVariable String id, @PathVariable int index) {
        return Result.OK(queryService.block(EntityKind.ROOT, id, index));
    }

    @GetMapping("/{id}/classes")
    public Result<List<EntityView>> classes(@PathVariable String id,
                                            @RequestParam(defaultValue = "false") boolean activeOnly) {
        return Result.OK(queryService.listClassesByDepartment(id, activeOnly));
    }

    @GetMapping("/{id}/students")
    public Result<List<EntityView>> students(@PathVariable String id,
                                             @RequestParam(defaultValue = "false") boolean activeOnly) {
        return Result.OK(queryService.listStudentsByDepartment(id, activeOnly));
    }
}
