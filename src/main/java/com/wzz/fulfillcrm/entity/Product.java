package com.wzz.fulfillcrm.entity;

import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableName;
import com.wzz.fulfillcrm.common.BaseEntity;
import lombok.Data;
import lombok.EqualsAndHashCode;

import java.math.BigDecimal;

/**
 * 库存商品，SKU 与条码各自唯一
 */
@Data
@EqualsAndHashCode(callSuper = true)
@TableName("product")
public class Product extends BaseEntity {

    @TableField("sku")
    private String sku;

    @TableField("barcode")
    private String barcode;

    @TableField("name")
    private String name;

    @TableField("description")
    private String description;

    @TableField("category")
    private String category;

    /**
     * 单件重量，单位 kg
     */
    @TableField("unit_weight")
    private BigDecimal unitWeight;

    /**
     * 单件体积，单位 m³
     */
    @TableField("unit_volume")
    private BigDecimal unitVolume;

    /**
     * 单件成本，报损时按此金额记账
     */
    @TableField("unit_cost")
    private BigDecimal unitCost;

    @TableField("unit_price")
    private BigDecimal unitPrice;

    @TableField("image_url")
    private String imageUrl;

    /**
     * 安全库存，可用数量低于此值视为低库存
     */
    @TableField("min_stock")
    private Integer minStock;

    @TableField("is_active")
    private Boolean isActive;
}
