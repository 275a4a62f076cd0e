package com.wzz.fulfillcrm.entity;

import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableName;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.wzz.fulfillcrm.common.BaseEntity;
import com.wzz.fulfillcrm.enums.TaskPriority;
import com.wzz.fulfillcrm.enums.TaskStatus;
import com.wzz.fulfillcrm.enums.TaskType;
import lombok.Data;
import lombok.EqualsAndHashCode;

import java.time.LocalDateTime;

/**
 * 仓库作业单
 */
@Data
@EqualsAndHashCode(callSuper = true)
@TableName("warehouse_task")
public class WarehouseTask extends BaseEntity {

    /**
     * 作业单号，格式 WT-yyyyMMdd-0001
     */
    @TableField("task_number")
    private String taskNumber;

    @TableField("warehouse_id")
    private Long warehouseId;

    @TableField("order_id")
    private Long orderId;

    @TableField("type")
    private TaskType type;

    @TableField("status")
    private TaskStatus status;

    @TableField("priority")
    private TaskPriority priority;

    @TableField("assigned_to_id")
    private Long assignedToId;

    @TableField("planned_date")
    @JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss")
    private LocalDateTime plannedDate;

    @TableField("started_at")
    @JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss")
    private LocalDateTime startedAt;

    @TableField("completed_at")
    @JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss")
    private LocalDateTime completedAt;

    @TableField("notes")
    private String notes;
}
