package com.wzz.fulfillcrm.controller.order;

import cn.dev33.satoken.annotation.SaCheckRole;
import cn.dev33.satoken.annotation.SaMode;
import com.wzz.fulfillcrm.common.Result;
import com.wzz.fulfillcrm.dto.CreatDTO.ExpenseBulkCreateDTO;
import com.wzz.fulfillcrm.dto.CreatDTO.ExpenseCreateDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.ExpenseCategoryDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.ExpenseListDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.PriceChangesDTO;
import com.wzz.fulfillcrm.dto.update.ExpenseUpdateDTO;
import com.wzz.fulfillcrm.entity.ExpenseTemplate;
import com.wzz.fulfillcrm.entity.OrderExpense;
import com.wzz.fulfillcrm.service.ExpenseTemplateService;
import com.wzz.fulfillcrm.service.OrderExpenseService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 订单费用接口，变更类操作会触发订单成本重算
 */
@RestController
@RequestMapping("/api/order-expenses")
public class OrderExpenseController {

    private final OrderExpenseService orderExpenseService;
    private final ExpenseTemplateService expenseTemplateService;

    public OrderExpenseController(OrderExpenseService orderExpenseService,
                                  ExpenseTemplateService expenseTemplateService) {
        this.orderExpenseService = orderExpenseService;
        this.expenseTemplateService = expenseTemplateService;
    }

    @GetMapping("/categories")
    public Result<List<ExpenseCategoryDTO>> categories() {
        return Result.success(orderExpenseService.categories());
    }

    /**
     * 可套用的启用模板
     */
    @GetMapping("/templates")
    public Result<List<ExpenseTemplate>> templates() {
        return Result.success(expenseTemplateService.listTemplates(true));
    }

    @GetMapping("/order/{orderId}")
    public Result<ExpenseListDTO> listByOrder(@PathVariable("orderId") Long orderId) {
        return Result.success(orderExpenseService.listByOrder(orderId));
    }

    @SaCheckRole(value = {"ADMIN", "MANAGER"}, mode = SaMode.OR)
    @PostMapping("/order/{orderId}")
    public Result<OrderExpense> create(@PathVariable("orderId") Long orderId,
                                       @Valid @RequestBody ExpenseCreateDTO dto) {
        return Result.success("费用已添加", orderExpenseService.createExpense(orderId, dto));
    }

    @SaCheckRole(value = {"ADMIN", "MANAGER"}, mode = SaMode.OR)
    @PutMapping("/{id}")
    public Result<OrderExpense> update(@PathVariable("id") Long id, @Valid @RequestBody ExpenseUpdateDTO dto) {
        return Result.success("费用已更新", orderExpenseService.updateExpense(id, dto));
    }

    @SaCheckRole(value = {"ADMIN", "MANAGER"}, mode = SaMode.OR)
    @DeleteMapping("/{id}")
    public Result<?> delete(@PathVariable("id") Long id) {
        orderExpenseService.deleteExpense(id);
        return Result.success("费用已删除", null);
    }

    @SaCheckRole(value = {"ADMIN", "MANAGER"}, mode = SaMode.OR)
    @PostMapping("/order/{orderId}/bulk")
    public Result<List<OrderExpense>> bulk(@PathVariable("orderId") Long orderId,
                                           @Valid @RequestBody ExpenseBulkCreateDTO dto) {
        List<OrderExpense> created = orderExpenseService.bulkCreate(orderId, dto.getExpenses());
        return Result.success("已添加 " + created.size() + " 条费用", created);
    }

    @SaCheckRole(value = {"ADMIN", "MANAGER"}, mode = SaMode.OR)
    @PostMapping("/order/{orderId}/clone/{sourceOrderId}")
    public Result<List<OrderExpense>> cloneFrom(@PathVariable("orderId") Long orderId,
                                                @PathVariable("sourceOrderId") Long sourceOrderId) {
        List<OrderExpense> cloned = orderExpenseService.cloneFromOrder(orderId, sourceOrderId);
        return Result.success("已复制 " + cloned.size() + " 条费用", cloned);
    }

    @SaCheckRole(value = {"ADMIN", "MANAGER"}, mode = SaMode.OR)
    @PostMapping("/order/{orderId}/apply-template/{templateId}")
    public Result<List<OrderExpense>> applyTemplate(@PathVariable("orderId") Long orderId,
                                                    @PathVariable("templateId") Long templateId) {
        List<OrderExpense> created = orderExpenseService.applyTemplate(orderId, templateId);
        return Result.success("已套用模板，生成 " + created.size() + " 条费用", created);
    }

    @GetMapping("/order/{orderId}/price-changes")
    public Result<PriceChangesDTO> priceChanges(@PathVariable("orderId") Long orderId) {
        return Result.success(orderExpenseService.priceChanges(orderId));
    }
}
