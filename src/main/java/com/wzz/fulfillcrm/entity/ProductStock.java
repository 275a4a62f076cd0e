package com.wzz.fulfillcrm.entity;

import com.baomidou.mybatisplus.annotation.FieldStrategy;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableName;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.wzz.fulfillcrm.common.BaseEntity;
import lombok.Data;
import lombok.EqualsAndHashCode;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * 库位上某商品某批次的在库数量，quantity = reservedQty + availableQty
 * <p>
 * 三个数量字段只能通过库存移动修改
 */
@Data
@EqualsAndHashCode(callSuper = true)
@TableName("product_stock")
public class ProductStock extends BaseEntity {

    @TableField("product_id")
    private Long productId;

    @TableField("storage_location_id")
    private Long storageLocationId;

    @TableField(value = "quantity", updateStrategy = FieldStrategy.NEVER)
    private Integer quantity;

    @TableField(value = "reserved_qty", updateStrategy = FieldStrategy.NEVER)
    private Integer reservedQty;

    @TableField(value = "available_qty", updateStrategy = FieldStrategy.NEVER)
    private Integer availableQty;

    /**
     * 批次号，无批次时为空串
     */
    @TableField("batch_number")
    private String batchNumber;

    @TableField("expiry_date")
    private LocalDate expiryDate;

    @TableField("last_movement_at")
    @JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss")
    private LocalDateTime lastMovementAt;
}
