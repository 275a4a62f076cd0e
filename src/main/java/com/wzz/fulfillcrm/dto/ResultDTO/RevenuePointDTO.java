package com.wzz.fulfillcrm.dto.ResultDTO;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * 收入曲线上的一个点，date 为天、周首日或 yyyy-MM
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RevenuePointDTO {
    private String date;
    private BigDecimal revenue;
    private BigDecimal profit;
    private BigDecimal cost;
    private int orders;
}
