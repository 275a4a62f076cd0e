package com.wzz.fulfillcrm.controller.finance;

import cn.dev33.satoken.annotation.SaCheckRole;
import cn.dev33.satoken.annotation.SaMode;
import com.wzz.fulfillcrm.common.Result;
import com.wzz.fulfillcrm.dto.CreatDTO.CostOperationCreateDTO;
import com.wzz.fulfillcrm.dto.update.CostOperationUpdateDTO;
import com.wzz.fulfillcrm.entity.CostOperation;
import com.wzz.fulfillcrm.service.CostOperationService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 成本操作接口
 */
@RestController
@RequestMapping("/api/cost-operations")
public class CostOperationController {

    private final CostOperationService costOperationService;

    public CostOperationController(CostOperationService costOperationService) {
        this.costOperationService = costOperationService;
    }

    @GetMapping("/order/{orderId}")
    public Result<List<CostOperation>> listByOrder(@PathVariable("orderId") Long orderId) {
        return Result.success(costOperationService.listByOrder(orderId));
    }

    @SaCheckRole(value = {"ADMIN", "MANAGER"}, mode = SaMode.OR)
    @PostMapping
    public Result<CostOperation> create(@Valid @RequestBody CostOperationCreateDTO dto) {
        return Result.success("成本已登记", costOperationService.createOperation(dto));
    }

    @SaCheckRole(value = {"ADMIN", "MANAGER"}, mode = SaMode.OR)
    @PutMapping("/{id}")
    public Result<CostOperation> update(@PathVariable("id") Long id, @Valid @RequestBody CostOperationUpdateDTO dto) {
        return Result.success("成本已更新", costOperationService.updateOperation(id, dto));
    }

    @SaCheckRole("ADMIN")
    @DeleteMapping("/{id}")
    public Result<?> delete(@PathVariable("id") Long id) {
        costOperationService.deleteOperation(id);
        return Result.success("成本已删除", null);
    }
}
