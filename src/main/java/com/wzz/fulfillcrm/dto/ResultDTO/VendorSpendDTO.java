package com.wzz.fulfillcrm.dto.ResultDTO;

import lombok.Data;

import java.math.BigDecimal;

/**
 * 供应商成本汇总行
 */
@Data
public class VendorSpendDTO {
    private Long vendorId;
    private Long operationCount;
    private BigDecimal totalSpent;
}
