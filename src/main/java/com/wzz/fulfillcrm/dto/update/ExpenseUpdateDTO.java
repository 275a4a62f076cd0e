package com.wzz.fulfillcrm.dto.update;

import com.wzz.fulfillcrm.enums.ExpenseCategory;
import com.wzz.fulfillcrm.enums.ExpenseStatus;
import com.wzz.fulfillcrm.enums.MeasureUnit;
import jakarta.validation.constraints.DecimalMin;
import lombok.Data;

import java.math.BigDecimal;

/**
 * 修改订单费用，字段为空表示不修改
 */
@Data
public class ExpenseUpdateDTO {
    private ExpenseCategory category;
    private String subcategory;
    private Long vendorId;
    private Long vendorServiceId;
    private String description;
    private MeasureUnit unit;

    @DecimalMin(value = "0", message = "数量不能为负")
    private BigDecimal quantity;

    @DecimalMin(value = "0", message = "单价不能为负")
    private BigDecimal unitPrice;

    private BigDecimal plannedAmount;

    /**
     * 实际发生金额，大于 0 时代替 数量 × 单价 计入成本
     */
    @DecimalMin(value = "0", message = "实际金额不能为负")
    private BigDecimal actualAmount;

    private Boolean isPriceLocked;
    private ExpenseStatus status;
    private String notes;
}
