package com.wzz.fulfillcrm.entity;

import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableName;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.wzz.fulfillcrm.common.BaseEntity;
import com.wzz.fulfillcrm.enums.CostOperationType;
import lombok.Data;
import lombok.EqualsAndHashCode;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 成本操作：供应商针对订单的计费
 */
@Data
@EqualsAndHashCode(callSuper = true)
@TableName("cost_operation")
public class CostOperation extends BaseEntity {

    @TableField("order_id")
    private Long orderId;

    @TableField("vendor_id")
    private Long vendorId;

    @TableField("vendor_service_id")
    private Long vendorServiceId;

    @TableField("operation_type")
    private CostOperationType operationType;

    @TableField("quantity")
    private BigDecimal quantity;

    /**
     * 创建时的服务报价快照
     */
    @TableField("unit_price")
    private BigDecimal unitPrice;

    /**
     * 数量 × 单价
     */
    @TableField("calculated_amount")
    private BigDecimal calculatedAmount;

    @TableField("actual_amount")
    private BigDecimal actualAmount;

    @TableField("description")
    private String description;

    @TableField("operation_date")
    @JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss")
    private LocalDateTime operationDate;
}
