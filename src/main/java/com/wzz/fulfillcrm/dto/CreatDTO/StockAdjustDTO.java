package com.wzz.fulfillcrm.dto.CreatDTO;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * 盘点调整：把库位上的在库数量直接设为盘点结果
 */
@Data
public class StockAdjustDTO {

    @NotNull(message = "库位不能为空")
    private Long locationId;

    /**
     * 盘点后的在库数量
     */
    @NotNull(message = "数量不能为空")
    @Min(value = 0, message = "数量不能为负")
    private Integer quantity;

    @NotBlank(message = "调整原因不能为空")
    private String reason;

    private String batchNumber;
}
