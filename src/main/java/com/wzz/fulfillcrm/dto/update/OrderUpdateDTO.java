package com.wzz.fulfillcrm.dto.update;

import com.wzz.fulfillcrm.enums.OrderStatus;
import lombok.Data;

/**
 * 订单基本信息修改，字段为空表示不修改
 */
@Data
public class OrderUpdateDTO {
    private String shippingAddress;
    private String notes;
    private OrderStatus status;
}
