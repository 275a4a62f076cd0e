package com.wzz.fulfillcrm.dto.CreatDTO;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;

@Data
public class IncomeOperationCreateDTO {

    @NotNull(message = "订单不能为空")
    private Long orderId;

    @NotNull(message = "开票金额不能为空")
    @DecimalMin(value = "0", inclusive = false, message = "开票金额必须大于0")
    private BigDecimal invoiceAmount;

    private String paymentMethod;

    private String description;
}
