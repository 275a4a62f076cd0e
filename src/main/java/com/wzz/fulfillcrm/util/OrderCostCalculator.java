package com.wzz.fulfillcrm.util;

import com.wzz.fulfillcrm.entity.OrderExpense;
import com.wzz.fulfillcrm.entity.OrderItem;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.math.BigDecimal;
import java.util.List;

/**
 * 订单成本与利润计算，纯函数，不访问数据库
 */
public final class OrderCostCalculator {

    private OrderCostCalculator() {}

    /**
     * 根据费用行与商品行计算订单汇总字段
     *
     * @param expenses       订单全部费用行
     * @param items          订单全部商品行
     * @param previousIncome 当前已保存的总收入，商品无售价时沿用
     */
    public static CostSnapshot calculate(List<OrderExpense> expenses, List<OrderItem> items, BigDecimal previousIncome) {
        BigDecimal expensesTotal = BigDecimal.ZERO;
        for (OrderExpense expense : expenses) {
            expensesTotal = expensesTotal.add(expense.effectiveAmount());
        }

        BigDecimal itemsCost = BigDecimal.ZERO;
        BigDecimal itemsRevenue = BigDecimal.ZERO;
        for (OrderItem item : items) {
            BigDecimal qty = BigDecimal.valueOf(item.getQuantity() == null ? 0 : item.getQuantity());
            itemsCost = itemsCost.add(MoneyUtil.nz(item.getUnitCost()).multiply(qty));
            itemsRevenue = itemsRevenue.add(MoneyUtil.nz(item.getUnitPrice()).multiply(qty));
        }

        BigDecimal estimatedCost = MoneyUtil.money(expensesTotal);
        BigDecimal actualCost = MoneyUtil.money(expensesTotal.add(itemsCost));
        BigDecimal totalIncome = itemsRevenue.signum() > 0
                ? MoneyUtil.money(itemsRevenue)
                : MoneyUtil.money(previousIncome);
        // 先取整再相减，保证 profit == totalIncome - actualCost 精确成立
        BigDecimal profit = totalIncome.subtract(actualCost);
        BigDecimal marginPercent = MoneyUtil.percent(profit, totalIncome);

        return new CostSnapshot(estimatedCost, actualCost, totalIncome, profit, marginPercent);
    }

    /**
     * 订单成本汇总结果
     */
    @Data
    @AllArgsConstructor
    public static class CostSnapshot {
        private BigDecimal estimatedCost;
        private BigDecimal actualCost;
        private BigDecimal totalIncome;
        private BigDecimal profit;
        private BigDecimal marginPercent;
    }
}
