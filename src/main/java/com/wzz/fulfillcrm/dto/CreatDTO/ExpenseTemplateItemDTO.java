package com.wzz.fulfillcrm.dto.CreatDTO;

import com.wzz.fulfillcrm.enums.ExpenseCategory;
import com.wzz.fulfillcrm.enums.MeasureUnit;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.math.BigDecimal;

@Data
public class ExpenseTemplateItemDTO {

    private ExpenseCategory category;

    private String subcategory;

    @NotBlank(message = "明细描述不能为空")
    private String description;

    private Long vendorServiceId;

    private MeasureUnit unit;

    @DecimalMin(value = "0", message = "默认数量不能为负")
    private BigDecimal defaultQuantity;

    @DecimalMin(value = "0", message = "默认单价不能为负")
    private BigDecimal defaultPrice;

    /**
     * 数量公式，仅支持四则运算与括号，如 "totalWeight / 5 + 1"
     */
    private String quantityFormula;

    /**
     * 默认 true
     */
    private Boolean isRequired;

    /**
     * 为空时取明细在列表中的位置
     */
    private Integer sortOrder;
}
