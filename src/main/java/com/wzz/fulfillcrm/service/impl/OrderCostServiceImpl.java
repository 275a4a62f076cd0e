package com.wzz.fulfillcrm.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import com.wzz.fulfillcrm.entity.Order;
import com.wzz.fulfillcrm.entity.OrderExpense;
import com.wzz.fulfillcrm.entity.OrderItem;
import com.wzz.fulfillcrm.exception.BusinessException;
import com.wzz.fulfillcrm.mapper.OrderExpenseMapper;
import com.wzz.fulfillcrm.mapper.OrderItemMapper;
import com.wzz.fulfillcrm.mapper.OrderMapper;
import com.wzz.fulfillcrm.service.OrderCostService;
import com.wzz.fulfillcrm.util.OrderCostCalculator;
import com.wzz.fulfillcrm.util.OrderCostCalculator.CostSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

@Slf4j
@Service
public class OrderCostServiceImpl implements OrderCostService {

    @Autowired
    private OrderMapper orderMapper;

    @Autowired
    private OrderExpenseMapper orderExpenseMapper;

    @Autowired
    private OrderItemMapper orderItemMapper;

    @Override
    @Transactional(rollbackFor = Exception.class)
    public Order lockOrder(Long orderId) {
        Order order = orderMapper.selectByIdForUpdate(orderId);
        if (order == null) {
            throw BusinessException.notFound("订单不存在: " + orderId);
        }
        return order;
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public CostSnapshot recalculate(Long orderId) {
        // 1. 锁定订单，保证读取到一致的费用与商品快照
        Order order = lockOrder(orderId);

        // 2. 读取子记录并计算
        List<OrderExpense> expenses = orderExpenseMapper.selectList(new LambdaQueryWrapper<OrderExpense>()
                .eq(OrderExpense::getOrderId, orderId));
        List<OrderItem> items = orderItemMapper.selectList(new LambdaQueryWrapper<OrderItem>()
                .eq(OrderItem::getOrderId, orderId));
        CostSnapshot snapshot = OrderCostCalculator.calculate(expenses, items, order.getTotalIncome());

        // 3. 汇总字段映射为永不更新，这里显式 set 一次性写回
        orderMapper.update(null, new LambdaUpdateWrapper<Order>()
                .eq(Order::getId, orderId)
                .set(Order::getEstimatedCost, snapshot.getEstimatedCost())
                .set(Order::getActualCost, snapshot.getActualCost())
                .set(Order::getTotalIncome, snapshot.getTotalIncome())
                .set(Order::getProfit, snapshot.getProfit())
                .set(Order::getMarginPercent, snapshot.getMarginPercent())
                .set(Order::getUpdateTime, LocalDateTime.now()));

        log.info("订单 {} 成本重算完成: 费用{}条, 商品{}行, actualCost={}, totalIncome={}, profit={}, margin={}%",
                orderId, expenses.size(), items.size(), snapshot.getActualCost(),
                snapshot.getTotalIncome(), snapshot.getProfit(), snapshot.getMarginPercent());
        return snapshot;
    }
}
