package com.wzz.fulfillcrm.dto.CreatDTO;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;

/**
 * 登记一笔收款
 */
@Data
public class PaymentDTO {

    @NotNull(message = "收款金额不能为空")
    @DecimalMin(value = "0", inclusive = false, message = "收款金额必须大于0")
    private BigDecimal amount;

    private String paymentMethod;
}
