package com.wzz.fulfillcrm.util;

import com.wzz.fulfillcrm.entity.OrderExpense;
import com.wzz.fulfillcrm.entity.OrderItem;
import com.wzz.fulfillcrm.util.OrderCostCalculator.CostSnapshot;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class OrderCostCalculatorTest {

    private static OrderExpense expense(String total, String actual) {
        OrderExpense e = new OrderExpense();
        e.setTotalAmount(new BigDecimal(total));
        e.setActualAmount(actual == null ? null : new BigDecimal(actual));
        return e;
    }

    private static OrderItem item(int qty, String unitCost, String unitPrice) {
        OrderItem i = new OrderItem();
        i.setQuantity(qty);
        i.setUnitCost(new BigDecimal(unitCost));
        i.setUnitPrice(new BigDecimal(unitPrice));
        return i;
    }

    @Test
    void incomeThousandExpenseHundredItemTwoHundred() {
        CostSnapshot s = OrderCostCalculator.calculate(
                Collections.singletonList(expense("100.00", "0")),
                Collections.singletonList(item(1, "200", "0")),
                new BigDecimal("1000"));

        assertThat(s.getEstimatedCost()).isEqualByComparingTo("100");
        assertThat(s.getActualCost()).isEqualByComparingTo("300");
        assertThat(s.getTotalIncome()).isEqualByComparingTo("1000");
        assertThat(s.getProfit()).isEqualByComparingTo("700");
        assertThat(s.getMarginPercent()).isEqualTo(new BigDecimal("70.00"));
    }

    @Test
    void nonZeroActualAmountReplacesPlannedTotal() {
        CostSnapshot s = OrderCostCalculator.calculate(
                Arrays.asList(expense("100", "80"), expense("50", null)),
                Collections.emptyList(),
                new BigDecimal("500"));

        assertThat(s.getActualCost()).isEqualByComparingTo("130");
        assertThat(s.getProfit()).isEqualByComparingTo("370");
    }

    @Test
    void negativeActualAmountFallsBackToPlannedTotal() {
        CostSnapshot s = OrderCostCalculator.calculate(
                Collections.singletonList(expense("100", "-20")),
                Collections.emptyList(),
                new BigDecimal("500"));

        assertThat(expense("100", "-20").effectiveAmount()).isEqualByComparingTo("100");
        assertThat(s.getActualCost()).isEqualByComparingTo("100");
        assertThat(s.getProfit()).isEqualByComparingTo("400");
    }

    @Test
    void itemsRevenueOverridesPreviousIncome() {
        List<OrderItem> items = Arrays.asList(item(2, "10", "40"), item(1, "5", "20"));
        CostSnapshot s = OrderCostCalculator.calculate(Collections.emptyList(), items, new BigDecimal("999"));

        assertThat(s.getTotalIncome()).isEqualByComparingTo("100");
        assertThat(s.getActualCost()).isEqualByComparingTo("25");
        assertThat(s.getProfit()).isEqualByComparingTo("75");
        assertThat(s.getMarginPercent()).isEqualTo(new BigDecimal("75.00"));
    }

    @Test
    void zeroIncomeGivesZeroMargin() {
        CostSnapshot s = OrderCostCalculator.calculate(
                Collections.singletonList(expense("40", "0")), Collections.emptyList(), BigDecimal.ZERO);

        assertThat(s.getProfit()).isEqualByComparingTo("-40");
        assertThat(s.getMarginPercent()).isEqualByComparingTo("0");
    }

    @Test
    void profitAlwaysEqualsIncomeMinusCost() {
        CostSnapshot s = OrderCostCalculator.calculate(
                Arrays.asList(expense("33.333", "0"), expense("0.005", "0")),
                Collections.singletonList(item(3, "1.111", "0")),
                new BigDecimal("123.456"));

        assertThat(s.getProfit()).isEqualByComparingTo(s.getTotalIncome().subtract(s.getActualCost()));
    }
}
