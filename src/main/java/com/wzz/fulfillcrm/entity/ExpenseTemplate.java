package com.wzz.fulfillcrm.entity;

import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableName;
import com.wzz.fulfillcrm.common.BaseEntity;
import lombok.Data;
import lombok.EqualsAndHashCode;

import java.math.BigDecimal;
import java.util.List;

/**
 * 费用模板
 */
@Data
@EqualsAndHashCode(callSuper = true)
@TableName("expense_template")
public class ExpenseTemplate extends BaseEntity {

    /**
     * 模板名称
     */
    @TableField("name")
    private String name;

    @TableField("description")
    private String description;

    /**
     * 适用的商品类别
     */
    @TableField("product_category")
    private String productCategory;

    @TableField("min_weight")
    private BigDecimal minWeight;

    @TableField("max_weight")
    private BigDecimal maxWeight;

    @TableField("delivery_method")
    private String deliveryMethod;

    @TableField("region")
    private String region;

    @TableField("is_active")
    private Boolean isActive;

    /**
     * 模板明细，按 sortOrder 排序
     */
    @TableField(exist = false)
    private List<ExpenseTemplateItem> items;
}
