package com.wzz.fulfillcrm.entity;

import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableName;
import com.wzz.fulfillcrm.common.BaseEntity;
import lombok.Data;
import lombok.EqualsAndHashCode;

import java.math.BigDecimal;

/**
 * 订单商品行
 */
@Data
@EqualsAndHashCode(callSuper = true)
@TableName("order_item")
public class OrderItem extends BaseEntity {

    @TableField("order_id")
    private Long orderId;

    @TableField("sku")
    private String sku;

    @TableField("name")
    private String name;

    @TableField("quantity")
    private Integer quantity;

    /**
     * 单件重量（千克）
     */
    @TableField("weight")
    private BigDecimal weight;

    /**
     * 单件体积（立方米）
     */
    @TableField("volume")
    private BigDecimal volume;

    /**
     * 单件成本
     */
    @TableField("unit_cost")
    private BigDecimal unitCost;

    /**
     * 单件售价
     */
    @TableField("unit_price")
    private BigDecimal unitPrice;
}
