package com.wzz.fulfillcrm.dto.CreatDTO;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.wzz.fulfillcrm.enums.TaskPriority;
import com.wzz.fulfillcrm.enums.TaskType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

@Data
public class WarehouseTaskCreateDTO {

    @NotNull(message = "仓库不能为空")
    private Long warehouseId;

    @NotNull(message = "作业类型不能为空")
    private TaskType type;

    private Long orderId;

    private TaskPriority priority;

    private Long assignedToId;

    @JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss")
    private LocalDateTime plannedDate;

    private String notes;

    @Valid
    private List<WarehouseTaskItemDTO> items;
}
