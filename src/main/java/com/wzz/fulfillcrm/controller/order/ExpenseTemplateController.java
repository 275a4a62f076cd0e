package com.wzz.fulfillcrm.controller.order;

import cn.dev33.satoken.annotation.SaCheckRole;
import cn.dev33.satoken.annotation.SaMode;
import com.wzz.fulfillcrm.common.Result;
import com.wzz.fulfillcrm.dto.CreatDTO.ExpenseTemplateCreateDTO;
import com.wzz.fulfillcrm.entity.ExpenseTemplate;
import com.wzz.fulfillcrm.service.ExpenseTemplateService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 费用模板接口
 */
@RestController
@RequestMapping("/api/expense-templates")
public class ExpenseTemplateController {

    private final ExpenseTemplateService expenseTemplateService;

    public ExpenseTemplateController(ExpenseTemplateService expenseTemplateService) {
        this.expenseTemplateService = expenseTemplateService;
    }

    @GetMapping
    public Result<List<ExpenseTemplate>> list(@RequestParam(defaultValue = "false") boolean activeOnly) {
        return Result.success(expenseTemplateService.listTemplates(activeOnly));
    }

    @GetMapping("/{id}")
    public Result<ExpenseTemplate> get(@PathVariable("id") Long id) {
        return Result.success(expenseTemplateService.getTemplate(id));
    }

    @SaCheckRole(value = {"ADMIN", "MANAGER"}, mode = SaMode.OR)
    @PostMapping
    public Result<ExpenseTemplate> create(@Valid @RequestBody ExpenseTemplateCreateDTO dto) {
        return Result.success("模板已创建", expenseTemplateService.createTemplate(dto));
    }

    @SaCheckRole(value = {"ADMIN", "MANAGER"}, mode = SaMode.OR)
    @PutMapping("/{id}")
    public Result<ExpenseTemplate> update(@PathVariable("id") Long id, @Valid @RequestBody ExpenseTemplateCreateDTO dto) {
        return Result.success("模板已更新", expenseTemplateService.updateTemplate(id, dto));
    }

    @SaCheckRole(value = {"ADMIN", "MANAGER"}, mode = SaMode.OR)
    @DeleteMapping("/{id}")
    public Result<?> delete(@PathVariable("id") Long id) {
        expenseTemplateService.deleteTemplate(id);
        return Result.success("模板已删除", null);
    }

    @SaCheckRole(value = {"ADMIN", "MANAGER"}, mode = SaMode.OR)
    @PostMapping("/{id}/duplicate")
    public Result<ExpenseTemplate> duplicate(@PathVariable("id") Long id) {
        return Result.success("模板已复制", expenseTemplateService.duplicateTemplate(id));
    }
}
