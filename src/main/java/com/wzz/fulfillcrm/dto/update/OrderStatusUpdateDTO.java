package com.wzz.fulfillcrm.dto.update;

import com.wzz.fulfillcrm.enums.OrderStatus;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class OrderStatusUpdateDTO {

    @NotNull(message = "状态不能为空")
    private OrderStatus status;
}
