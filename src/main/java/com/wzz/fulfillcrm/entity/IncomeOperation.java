package com.wzz.fulfillcrm.entity;

import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableName;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.wzz.fulfillcrm.common.BaseEntity;
import lombok.Data;
import lombok.EqualsAndHashCode;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 收入操作：向客户开票及收款
 */
@Data
@EqualsAndHashCode(callSuper = true)
@TableName("income_operation")
public class IncomeOperation extends BaseEntity {

    @TableField("order_id")
    private Long orderId;

    @TableField("client_id")
    private Long clientId;

    /**
     * 开票金额
     */
    @TableField("invoice_amount")
    private BigDecimal invoiceAmount;

    /**
     * 已收金额，累计
     */
    @TableField("paid_amount")
    private BigDecimal paidAmount;

    @TableField("payment_method")
    private String paymentMethod;

    @TableField("payment_date")
    @JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss")
    private LocalDateTime paymentDate;

    @TableField("description")
    private String description;
}
