package com.wzz.fulfillcrm.dto.ResultDTO;

import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.wzz.fulfillcrm.entity.Client;
import com.wzz.fulfillcrm.entity.CostOperation;
import com.wzz.fulfillcrm.entity.IncomeOperation;
import com.wzz.fulfillcrm.entity.Order;
import com.wzz.fulfillcrm.entity.OrderExpense;
import com.wzz.fulfillcrm.entity.OrderItem;
import lombok.Data;

import java.util.List;

/**
 * 订单详情，订单字段平铺在顶层
 */
@Data
public class OrderDetailDTO {

    @JsonUnwrapped
    private Order order;

    private Client client;

    private List<OrderItem> items;

    private List<OrderExpense> expenses;

    private List<CostOperation> costOperations;

    private List<IncomeOperation> incomeOperations;
}
