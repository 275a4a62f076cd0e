package com.wzz.fulfillcrm.dto.CreatDTO;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * 报损：从库位扣减并按商品成本记账
 */
@Data
public class StockWriteOffDTO {

    @NotNull(message = "商品不能为空")
    private Long productId;

    @NotNull(message = "库位不能为空")
    private Long locationId;

    @NotNull(message = "数量不能为空")
    @Min(value = 1, message = "数量至少为1")
    private Integer quantity;

    @NotBlank(message = "报损原因不能为空")
    private String reason;

    private String batchNumber;
}
