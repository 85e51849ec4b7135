package com.bit.ledger.api;

import com.bit.ledger.blockchain.EntityKind;
import com.bit.ledger.result.Result;
import com.bit.ledger.validation.SystemValidationResult;
import com.bit.ledger.validation.ValidationResult;
import com.bit.ledger.validation.ValidationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/validate")
public class ValidationApi {

    @Autowired
    private ValidationService validationService;

    //全系统级联校验
    @GetMapping("/system")
    public Result<SystemValidationResult> system() {
        SystemValidationResult report = validationService.validateSystem();
        return Result.OK(report.isValid() ? "System is valid" : "System has invalid chains", report);
    }

    // level: department / class / student
    @GetMapping("/{level}/{id}")
    public Result<ValidationResult> entity(@PathVariable String level, @PathVariable String id,
                                           @RequestParam(defaultValue = "false") boolean strict) {
        EntityKind kind = EntityKind.fromLabel(level);
        if (strict) {
            return Result.OK(validationService.requireValid(kind, id));
        }
        return Result.OK(validationService.validate(kind, id));
    }
}
