package com.wzz.fulfillcrm.dto.CreatDTO;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class StockTransferDTO {

    @NotNull(message = "商品不能为空")
    private Long productId;

    @NotNull(message = "来源库位不能为空")
    private Long fromLocationId;

    @NotNull(message = "目标库位不能为空")
    private Long toLocationId;

    @NotNull(message = "数量不能为空")
    @Min(value = 1, message = "数量至少为1")
    private Integer quantity;

    private String batchNumber;

    private String reason;
}
