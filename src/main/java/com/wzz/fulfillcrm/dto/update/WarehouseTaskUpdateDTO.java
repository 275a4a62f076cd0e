package com.wzz.fulfillcrm.dto.update;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.wzz.fulfillcrm.enums.TaskPriority;
import com.wzz.fulfillcrm.enums.TaskStatus;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 修改作业，字段为空表示不修改
 */
@Data
public class WarehouseTaskUpdateDTO {

    private TaskStatus status;

    private TaskPriority priority;

    private Long assignedToId;

    @JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss")
    private LocalDateTime plannedDate;

    private String notes;
}
