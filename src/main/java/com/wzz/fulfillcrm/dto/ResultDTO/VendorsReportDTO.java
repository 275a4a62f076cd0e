package com.wzz.fulfillcrm.dto.ResultDTO;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class VendorsReportDTO {

    /**
     * 按成本倒序
     */
    private List<VendorReportRowDTO> vendors;

    private Summary summary;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Summary {
        private int totalVendors;
        private int activeVendors;
        private BigDecimal totalSpent;
    }
}
