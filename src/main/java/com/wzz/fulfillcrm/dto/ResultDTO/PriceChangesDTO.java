package com.wzz.fulfillcrm.dto.ResultDTO;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * 订单未锁价费用的供应商调价情况
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PriceChangesDTO {

    private List<PriceChange> changes;

    private int totalChanges;

    /**
     * 全部调价对订单成本的潜在影响
     */
    private BigDecimal totalImpact;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PriceChange {
        private Long expenseId;
        private String description;
        private Long vendorServiceId;
        private String vendorServiceName;
        private BigDecimal originalPrice;
        private BigDecimal currentPrice;
        private BigDecimal difference;
        /**
         * 保留一位小数
         */
        private BigDecimal differencePercent;
        private BigDecimal quantity;
        private BigDecimal potentialImpact;
    }
}
