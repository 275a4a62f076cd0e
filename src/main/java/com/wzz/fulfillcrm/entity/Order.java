package com.wzz.fulfillcrm.entity;

import com.baomidou.mybatisplus.annotation.FieldStrategy;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableName;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.wzz.fulfillcrm.common.BaseEntity;
import com.wzz.fulfillcrm.enums.OrderStatus;
import lombok.Data;
import lombok.EqualsAndHashCode;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 订单
 * <p>
 * estimatedCost / actualCost / totalIncome / profit / marginPercent 为缓存的汇总字段，
 * 映射为永不更新，只能由 {@code OrderCostService#recalculate} 显式写入。
 */
@Data
@EqualsAndHashCode(callSuper = true)
@TableName("orders")
public class Order extends BaseEntity {

    /**
     * 订单号，格式 ORD-yyMMdd-XXXXXX
     */
    @TableField("order_number")
    private String orderNumber;

    @TableField("client_id")
    private Long clientId;

    /**
     * 负责经理（创建人）ID
     */
    @TableField("manager_id")
    private Long managerId;

    @TableField("status")
    private OrderStatus status;

    @TableField("shipping_address")
    private String shippingAddress;

    @TableField("order_date")
    @JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss")
    private LocalDateTime orderDate;

    @TableField("shipped_date")
    @JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss")
    private LocalDateTime shippedDate;

    @TableField("delivered_date")
    @JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss")
    private LocalDateTime deliveredDate;

    @TableField("notes")
    private String notes;

    /**
     * 预估成本：费用有效金额之和
     */
    @TableField(value = "estimated_cost", updateStrategy = FieldStrategy.NEVER)
    private BigDecimal estimatedCost;

    /**
     * 实际成本：费用有效金额之和 + 商品成本
     */
    @TableField(value = "actual_cost", updateStrategy = FieldStrategy.NEVER)
    private BigDecimal actualCost;

    /**
     * 总收入
     */
    @TableField(value = "total_income", updateStrategy = FieldStrategy.NEVER)
    private BigDecimal totalIncome;

    /**
     * 利润 = 总收入 - 实际成本
     */
    @TableField(value = "profit", updateStrategy = FieldStrategy.NEVER)
    private BigDecimal profit;

    /**
     * 利润率（百分比）
     */
    @TableField(value = "margin_percent", updateStrategy = FieldStrategy.NEVER)
    private BigDecimal marginPercent;
}
