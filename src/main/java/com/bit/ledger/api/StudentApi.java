package com.bit.ledger.api;

import com.bit.ledger.blockchain.ChainRegistry;
import com.bit.ledger.blockchain.EntityKind;
import com.bit.ledger.blockchain.GroupChain;
import com.bit.ledger.blockchain.LeafChain;
import com.bit.ledger.exception.LedgerException;
import com.bit.ledger.result.Result;
import com.bit.ledger.service.LedgerQueryService;
import com.bit.ledger.structure.block.Block;
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
@RequestMapping("/api/students")
public class StudentApi {

    @Autowired
    private ChainRegistry chainRegistry;

    @Autowired
    private LedgerQueryService queryService;

    @Autowired
    private ValidationService validationService;

    //创建学生链，创世块绑定班级链最新哈希
    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Result<EntityView> create(@RequestBody CreateEntityRequest request) {
        String departmentId = request.getDepartmentId();
        if (departmentId != null && request.getClassId() != null) {
            GroupChain group = chainRegistry.getGroup(request.getClassId());
            if (!departmentId.equals(group.getRootId())) {
                throw LedgerException.inputError("class " + group.getId() + " does not belong to department " + departmentId);
            }
        }
        LeafChain leaf = chainRegistry.createLeaf(request.getId(), request.getName(),
                request.getClassId(), request.getFields());
        return Result.created("Student created successfully", EntityView.of(leaf));
    }

    @GetMapping
    public Result<List<EntityView>> list(@RequestParam(defaultValue = "false") boolean activeOnly) {
        return Result.OK(queryService.list(EntityKind.LEAF, activeOnly));
    }

    //按姓名或学号搜索
    @GetMapping("/search")
    public Result<List<EntityView>> search(@RequestParam String q) {
        return Result.OK(queryService.search(EntityKind.LEAF, q));
    }

    @GetMapping("/class/{classId}")
    public Result<List<EntityView>> byClass(@PathVariable String classId,
                                            @RequestParam(defaultValue = "false") boolean activeOnly) {
        return Result.OK(queryService.listStudentsByClass(classId, activeOnly));
    }

    @GetMapping("/department/{departmentId}")
    public Result<List<EntityView>> byDepartment(@PathVariable String departmentId,
                                                 @RequestParam(defaultValue = "false") boolean activeOnly) {
        return Result.OK(queryService.listStudentsByDepartment(departmentId, activeOnly));
    }

    @GetMapping("/{id}")
    public Result<EntityView> get(@PathVariable String id) {
        return Result.OK(queryService.view(EntityKind.LEAF, id));
    }

    @PutMapping("/{id}")
    public Result<EntityView> update(@PathVariable String id, @RequestBody Map<String, Object> patch) {
        chainRegistry.update(EntityKind.LEAF, id, patch);
        return Result.OK("Student updated successfully", queryService.view(EntityKind.LEAF, id));
    }

    @DeleteMapping("/{id}")
    public Result<EntityView> delete(@PathVariable String id) {
        chainRegistry.delete(EntityKind.LEAF, id);
        return Result.OK("Student marked as deleted", queryService.view(EntityKind.LEAF, id));
    }

    @GetMapping("/{id}/validate")
    public Result<ValidationResult> validate(@PathVariable String id,
                                             @RequestParam(defaultValue = "false") boolean strict) {
        if (strict) {
            return Result.OK(validationService.requireValid(EntityKind.LEAF, id));
        }
        return Result.OK(validationService.validateLeaf(id));
    }

    @GetMapping("/{id}/blocks")
    public Result<List<Block>> blocks(@PathVariable String id) {
        return Result.OK(queryService.blocks(EntityKind.LEAF, id));
    }

    @GetMapping("/{id}/blocks/{index}")
    public Result<Block> block(@PathVariable String id, @PathVariable int index) {
        return Result.OK(queryService.block(EntityKind.LEAF, id, index));
    }
}
