package com.wzz.fulfillcrm.dto.ResultDTO;

import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.wzz.fulfillcrm.entity.StockMovement;
import com.wzz.fulfillcrm.entity.WarehouseTask;
import com.wzz.fulfillcrm.entity.WarehouseTaskItem;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class WarehouseTaskDetailDTO {

    @JsonUnwrapped
    private WarehouseTask task;

    private String warehouseName;

    private List<WarehouseTaskItem> items;

    private List<StockMovement> movements;
}
