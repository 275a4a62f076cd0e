package com.wzz.fulfillcrm.dto.ResultDTO;

import com.wzz.fulfillcrm.enums.OrderStatus;
import lombok.Data;

import java.math.BigDecimal;

/**
 * 订单报表中的一行
 */
@Data
public class OrderReportRowDTO {
    private String orderNumber;
    /**
     * yyyy-MM-dd
     */
    private String orderDate;
    private OrderStatus status;
    private String clientName;
    private String clientCompany;
    private String manager;
    /**
     * 商品总件数
     */
    private long itemsCount;
    private BigDecimal totalWeight;
    private BigDecimal revenue;
    private BigDecimal storageCost;
    private BigDecimal pickingCost;
    private BigDecimal packingCost;
    private BigDecimal shippingCost;
    /**
     * 收货、贴标、退货及其他服务成本
     */
    private BigDecimal otherCost;
    private BigDecimal totalCost;
    private BigDecimal profit;
    private BigDecimal marginPercent;
}
