package com.wzz.fulfillcrm.dto.CreatDTO;

import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class TaskItemCompleteDTO {

    /**
     * 实际数量，为空时取计划数量
     */
    @Min(value = 0, message = "实际数量不能为负")
    private Integer actualQty;

    /**
     * 实际目标库位，为空时取明细上的目标库位
     */
    private Long toLocationId;
}
