package com.wzz.fulfillcrm.dto.ResultDTO;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class OrdersReportDTO {

    private List<OrderReportRowDTO> orders;

    private Summary summary;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Summary {
        private int totalOrders;
        private BigDecimal totalRevenue;
        private BigDecimal totalCost;
        private BigDecimal totalProfit;
        /**
         * 各订单利润率的算术平均
         */
        private BigDecimal averageMargin;
    }
}
