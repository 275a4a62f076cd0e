package com.wzz.fulfillcrm.dto.ResultDTO;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 看板指标，change 为相对上一等长周期的变化百分比（保留一位小数）
 */
@Data
@NoArgsConstructor
public class DashboardKpiDTO {

    private Metric revenue;
    private Metric profit;
    private Metric cost;
    private Metric orders;
    private Metric shippedItems;

    /**
     * 订单平均毛利率
     */
    private Metric margin;

    private BigDecimal averageOrderValue;

    @JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss")
    private LocalDateTime periodFrom;

    @JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss")
    private LocalDateTime periodTo;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Metric {
        private BigDecimal value;
        private BigDecimal change;
    }
}
