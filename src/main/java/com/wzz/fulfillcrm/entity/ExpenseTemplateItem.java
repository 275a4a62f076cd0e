package com.wzz.fulfillcrm.entity;

import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableName;
import com.wzz.fulfillcrm.common.BaseEntity;
import com.wzz.fulfillcrm.enums.ExpenseCategory;
import com.wzz.fulfillcrm.enums.MeasureUnit;
import lombok.Data;
import lombok.EqualsAndHashCode;

import java.math.BigDecimal;

/**
 * 费用模板明细
 */
@Data
@EqualsAndHashCode(callSuper = true)
@TableName("expense_template_item")
public class ExpenseTemplateItem extends BaseEntity {

    /**
     * 所属模板ID
     */
    @TableField("template_id")
    private Long templateId;

    @TableField("category")
    private ExpenseCategory category;

    @TableField("subcategory")
    private String subcategory;

    @TableField("description")
    private String description;

    @TableField("vendor_service_id")
    private Long vendorServiceId;

    @TableField("unit")
    private MeasureUnit unit;

    @TableField("default_quantity")
    private BigDecimal defaultQuantity;

    @TableField("default_price")
    private BigDecimal defaultPrice;

    /**
     * 数量公式，可引用 itemsCount / totalWeight / totalVolume，结果向上取整
     */
    @TableField("quantity_formula")
    private String quantityFormula;

    @TableField("is_required")
    private Boolean isRequired;

    @TableField("sort_order")
    private Integer sortOrder;
}
