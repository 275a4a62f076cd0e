package com.wzz.fulfillcrm.controller.order;

import cn.dev33.satoken.annotation.SaCheckRole;
import cn.dev33.satoken.annotation.SaMode;
import cn.dev33.satoken.stp.StpUtil;
import com.baomidou.mybatisplus.core.metadata.IPage;
import com.wzz.fulfillcrm.common.Result;
import com.wzz.fulfillcrm.dto.CreatDTO.OrderCreateDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.OrderDetailDTO;
import com.wzz.fulfillcrm.dto.page.PageQuery;
import com.wzz.fulfillcrm.dto.update.OrderStatusUpdateDTO;
import com.wzz.fulfillcrm.dto.update.OrderUpdateDTO;
import com.wzz.fulfillcrm.entity.Order;
import com.wzz.fulfillcrm.enums.OrderStatus;
import com.wzz.fulfillcrm.enums.UserRole;
import com.wzz.fulfillcrm.service.OrderService;
import com.wzz.fulfillcrm.util.OrderCostCalculator.CostSnapshot;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;

/**
 * 订单接口
 */
@RestController
@RequestMapping("/api/orders")
public class OrderController {

    private final OrderService orderService;

    public OrderController(OrderService orderService) {
        this.orderService = orderService;
    }

    /**
     * 分页查询订单，search 匹配订单号或客户名称
     */
    @GetMapping
    public Result<IPage<Order>> list(@RequestParam(required = false) OrderStatus status,
                                     @RequestParam(required = false) Long clientId,
                                     @RequestParam(required = false) String search,
                                     @RequestParam(required = false) LocalDate dateFrom,
                                     @RequestParam(required = false) LocalDate dateTo,
                                     @Valid PageQuery pageQuery) {
        return Result.success(orderService.listOrders(status, clientId, search, dateFrom, dateTo, pageQuery));
    }

    /**
     * 按ID或订单号查询详情
     */
    @GetMapping("/{idOrNumber}")
    public Result<OrderDetailDTO> get(@PathVariable("idOrNumber") String idOrNumber) {
        return Result.success(orderService.getDetail(idOrNumber));
    }

    @SaCheckRole(value = {"ADMIN", "MANAGER"}, mode = SaMode.OR)
    @PostMapping
    public Result<Order> create(@Valid @RequestBody OrderCreateDTO dto) {
        return Result.success("订单已创建", orderService.createOrder(dto, StpUtil.getLoginIdAsLong()));
    }

    @SaCheckRole(value = {"ADMIN", "MANAGER"}, mode = SaMode.OR)
    @PatchMapping("/{id}/status")
    public Result<Order> updateStatus(@PathVariable("id") Long id, @Valid @RequestBody OrderStatusUpdateDTO dto) {
        return Result.success("状态已更新", orderService.updateStatus(id, dto.getStatus()));
    }

    @SaCheckRole(value = {"ADMIN", "MANAGER"}, mode = SaMode.OR)
    @PutMapping("/{id}")
    public Result<Order> update(@PathVariable("id") Long id, @RequestBody OrderUpdateDTO dto) {
        return Result.success("更新成功", orderService.updateOrder(id, dto));
    }

    /**
     * 管理员可删除任意订单，经理只能删除新建状态的订单
     */
    @SaCheckRole(value = {"ADMIN", "MANAGER"}, mode = SaMode.OR)
    @DeleteMapping("/{id}")
    public Result<?> delete(@PathVariable("id") Long id) {
        boolean admin = StpUtil.hasRole(UserRole.ADMIN.name());
        orderService.deleteOrder(id, admin);
        return Result.success("订单已删除", null);
    }

    @SaCheckRole(value = {"ADMIN", "MANAGER"}, mode = SaMode.OR)
    @PostMapping("/{id}/recalculate")
    public Result<CostSnapshot> recalculate(@PathVariable("id") Long id) {
        return Result.success("重算完成", orderService.recalculate(id));
    }
}
