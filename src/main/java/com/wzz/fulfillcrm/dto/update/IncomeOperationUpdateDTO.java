package com.wzz.fulfillcrm.dto.update;

import jakarta.validation.constraints.DecimalMin;
import lombok.Data;

import java.math.BigDecimal;

@Data
public class IncomeOperationUpdateDTO {

    @DecimalMin(value = "0", inclusive = false, message = "开票金额必须大于0")
    private BigDecimal invoiceAmount;

    @DecimalMin(value = "0", message = "已收金额不能为负")
    private BigDecimal paidAmount;

    private String paymentMethod;
    private String description;
}
