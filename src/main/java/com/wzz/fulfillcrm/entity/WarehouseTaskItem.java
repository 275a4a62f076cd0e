package com.wzz.fulfillcrm.entity;

import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableName;
import com.wzz.fulfillcrm.common.BaseEntity;
import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * 作业明细，完成时按作业类型生成库存移动
 */
@Data
@EqualsAndHashCode(callSuper = true)
@TableName("warehouse_task_item")
public class WarehouseTaskItem extends BaseEntity {

    @TableField("task_id")
    private Long taskId;

    @TableField("product_id")
    private Long productId;

    @TableField("expected_qty")
    private Integer expectedQty;

    @TableField("actual_qty")
    private Integer actualQty;

    @TableField("from_location_id")
    private Long fromLocationId;

    @TableField("to_location_id")
    private Long toLocationId;

    @TableField("is_completed")
    private Boolean isCompleted;

    @TableField("notes")
    private String notes;
}
