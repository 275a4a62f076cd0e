package com.wzz.fulfillcrm.entity;

import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableName;
import com.wzz.fulfillcrm.common.BaseEntity;
import com.wzz.fulfillcrm.enums.MovementType;
import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * 库存移动流水，只追加不修改
 */
@Data
@EqualsAndHashCode(callSuper = true)
@TableName("stock_movement")
public class StockMovement extends BaseEntity {

    @TableField("product_id")
    private Long productId;

    @TableField("from_location_id")
    private Long fromLocationId;

    @TableField("to_location_id")
    private Long toLocationId;

    /**
     * 移动数量；盘点调整时为差额，可为负
     */
    @TableField("quantity")
    private Integer quantity;

    @TableField("movement_type")
    private MovementType movementType;

    @TableField("task_id")
    private Long taskId;

    @TableField("order_id")
    private Long orderId;

    @TableField("batch_number")
    private String batchNumber;

    @TableField("reason")
    private String reason;

    @TableField("created_by")
    private Long createdBy;
}
