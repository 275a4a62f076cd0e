package com.wzz.fulfillcrm.entity;

import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableName;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.wzz.fulfillcrm.common.BaseEntity;
import com.wzz.fulfillcrm.enums.ExpenseCategory;
import com.wzz.fulfillcrm.enums.ExpenseStatus;
import com.wzz.fulfillcrm.enums.MeasureUnit;
import lombok.Data;
import lombok.EqualsAndHashCode;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 订单费用行
 */
@Data
@EqualsAndHashCode(callSuper = true)
@TableName("order_expense")
public class OrderExpense extends BaseEntity {

    @TableField("order_id")
    private Long orderId;

    @TableField("category")
    private ExpenseCategory category;

    @TableField("subcategory")
    private String subcategory;

    @TableField("vendor_id")
    private Long vendorId;

    /**
     * 绑定的供应商服务ID，绑定后单价默认取服务报价
     */
    @TableField("vendor_service_id")
    private Long vendorServiceId;

    @TableField("description")
    private String description;

    @TableField("unit")
    private MeasureUnit unit;

    @TableField("quantity")
    private BigDecimal quantity;

    @TableField("unit_price")
    private BigDecimal unitPrice;

    /**
     * 数量 × 单价
     */
    @TableField("total_amount")
    private BigDecimal totalAmount;

    @TableField("planned_amount")
    private BigDecimal plannedAmount;

    /**
     * 实际发生金额，未结算前为 0
     */
    @TableField("actual_amount")
    private BigDecimal actualAmount;

    /**
     * 是否锁价，锁价的费用不参与调价提醒
     */
    @TableField("is_price_locked")
    private Boolean isPriceLocked;

    @TableField("price_locked_at")
    @JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss")
    private LocalDateTime priceLockedAt;

    /**
     * 创建时供应商服务报价的快照
     */
    @TableField("original_price")
    private BigDecimal originalPrice;

    @TableField("status")
    private ExpenseStatus status;

    @TableField("notes")
    private String notes;

    /**
     * 有效金额：实际金额大于 0 时取实际金额，否则取 数量 × 单价
     */
    public BigDecimal effectiveAmount() {
        if (actualAmount != null && actualAmount.signum() > 0) {
            return actualAmount;
        }
        return totalAmount == null ? BigDecimal.ZERO : totalAmount;
    }
}
