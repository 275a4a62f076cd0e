package com.wzz.fulfillcrm.dto.ResultDTO;

import lombok.Data;

import java.math.BigDecimal;

/**
 * 客户报表中的一行，不含已取消和已退回的订单
 */
@Data
public class ClientReportRowDTO {
    private Long id;
    private String name;
    private String companyName;
    private String email;
    private String phone;
    private Boolean isActive;
    private int ordersCount;
    private BigDecimal revenue;
    private BigDecimal cost;
    private BigDecimal profit;
    private BigDecimal marginPercent;
}
