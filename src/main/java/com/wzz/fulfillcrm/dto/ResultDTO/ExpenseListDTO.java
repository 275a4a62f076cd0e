package com.wzz.fulfillcrm.dto.ResultDTO;

import com.wzz.fulfillcrm.entity.OrderExpense;
import com.wzz.fulfillcrm.enums.ExpenseCategory;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * 订单费用列表及汇总
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ExpenseListDTO {

    private List<OrderExpense> expenses;

    private Summary summary;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Summary {
        private BigDecimal totalPlanned;
        /**
         * 有效金额合计
         */
        private BigDecimal totalActual;
        private int totalItems;
        private List<CategoryGroup> byCategory = new ArrayList<>();
    }

    @Data
    @NoArgsConstructor
    public static class CategoryGroup {
        private ExpenseCategory category;
        private String categoryName;
        private List<OrderExpense> items = new ArrayList<>();
        private BigDecimal totalPlanned = BigDecimal.ZERO;
        private BigDecimal totalActual = BigDecimal.ZERO;
    }
}
