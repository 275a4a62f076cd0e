package com.wzz.fulfillcrm.dto.ResultDTO;

import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.wzz.fulfillcrm.entity.Client;
import com.wzz.fulfillcrm.entity.Order;
import lombok.Data;

import java.math.BigDecimal;
import java.util.List;

@Data
public class ClientDetailDTO {

    @JsonUnwrapped
    private Client client;

    /**
     * 最近 10 个订单
     */
    private List<Order> recentOrders;

    private long totalOrders;

    private BigDecimal totalRevenue;

    private BigDecimal totalProfit;
}
