package com.wzz.fulfillcrm.controller.finance;

import cn.dev33.satoken.annotation.SaCheckRole;
import cn.dev33.satoken.annotation.SaMode;
import com.wzz.fulfillcrm.common.Result;
import com.wzz.fulfillcrm.dto.CreatDTO.IncomeOperationCreateDTO;
import com.wzz.fulfillcrm.dto.CreatDTO.PaymentDTO;
import com.wzz.fulfillcrm.dto.update.IncomeOperationUpdateDTO;
import com.wzz.fulfillcrm.entity.IncomeOperation;
import com.wzz.fulfillcrm.service.IncomeOperationService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 收入操作接口
 */
@RestController
@RequestMapping("/api/income-operations")
public class IncomeOperationController {

    private final IncomeOperationService incomeOperationService;

    public IncomeOperationController(IncomeOperationService incomeOperationService) {
        this.incomeOperationService = incomeOperationService;
    }

    @GetMapping("/order/{orderId}")
    public Result<List<IncomeOperation>> listByOrder(@PathVariable("orderId") Long orderId) {
        return Result.success(incomeOperationService.listByOrder(orderId));
    }

    @SaCheckRole(value = {"ADMIN", "MANAGER"}, mode = SaMode.OR)
    @PostMapping
    public Result<IncomeOperation> create(@Valid @RequestBody IncomeOperationCreateDTO dto) {
        return Result.success("发票已开具", incomeOperationService.createInvoice(dto));
    }

    @SaCheckRole(value = {"ADMIN", "MANAGER"}, mode = SaMode.OR)
    @PostMapping("/{id}/payment")
    public Result<IncomeOperation> payment(@PathVariable("id") Long id, @Valid @RequestBody PaymentDTO dto) {
        return Result.success("收款已登记", incomeOperationService.recordPayment(id, dto));
    }

    @SaCheckRole(value = {"ADMIN", "MANAGER"}, mode = SaMode.OR)
    @PutMapping("/{id}")
    public Result<IncomeOperation> update(@PathVariable("id") Long id, @Valid @RequestBody IncomeOperationUpdateDTO dto) {
        return Result.success("更新成功", incomeOperationService.updateOperation(id, dto));
    }

    @SaCheckRole("ADMIN")
    @DeleteMapping("/{id}")
    public Result<?> delete(@PathVariable("id") Long id) {
        incomeOperationService.deleteOperation(id);
        return Result.success("删除成功", null);
    }
}
