package com.wzz.fulfillcrm.dto.CreatDTO;

import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class WarehouseTaskItemDTO {

    private Long productId;

    @Min(value = 0, message = "计划数量不能为负")
    private Integer expectedQty;

    private Long fromLocationId;

    private Long toLocationId;

    private String notes;
}
