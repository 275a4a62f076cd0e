package com.wzz.fulfillcrm.dto.CreatDTO;

import com.wzz.fulfillcrm.enums.MovementType;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * 入库：商品放入指定库位
 */
@Data
public class StockReceiveDTO {

    @NotNull(message = "商品不能为空")
    private Long productId;

    @NotNull(message = "目标库位不能为空")
    private Long toLocationId;

    @NotNull(message = "数量不能为空")
    @Min(value = 1, message = "数量至少为1")
    private Integer quantity;

    /**
     * INBOUND 或 RETURN，为空时按 INBOUND
     */
    private MovementType movementType;

    private String batchNumber;

    private String reason;

    private Long orderId;
}
