package com.wzz.fulfillcrm.dto.CreatDTO;

import com.wzz.fulfillcrm.enums.ExpenseCategory;
import com.wzz.fulfillcrm.enums.MeasureUnit;
import jakarta.validation.constraints.DecimalMin;
import lombok.Data;

import java.math.BigDecimal;

/**
 * 新增订单费用，除订单外均可为空
 */
@Data
public class ExpenseCreateDTO {

    /**
     * 默认 OTHER
     */
    private ExpenseCategory category;

    private String subcategory;

    private Long vendorId;

    /**
     * 绑定供应商服务后，单价默认取服务报价
     */
    private Long vendorServiceId;

    private String description;

    /**
     * 默认 PIECE
     */
    private MeasureUnit unit;

    /**
     * 默认 1
     */
    @DecimalMin(value = "0", message = "数量不能为负")
    private BigDecimal quantity;

    @DecimalMin(value = "0", message = "单价不能为负")
    private BigDecimal unitPrice;

    /**
     * 默认等于 数量 × 单价
     */
    private BigDecimal plannedAmount;

    private Boolean isPriceLocked;

    private String notes;
}
