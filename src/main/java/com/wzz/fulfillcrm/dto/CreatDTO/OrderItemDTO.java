package com.wzz.fulfillcrm.dto.CreatDTO;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;

@Data
public class OrderItemDTO {

    private String sku;

    @NotBlank(message = "商品名称不能为空")
    private String name;

    @NotNull(message = "商品数量不能为空")
    @Min(value = 1, message = "商品数量至少为1")
    private Integer quantity;

    /**
     * 单件重量（千克）
     */
    @DecimalMin(value = "0", message = "重量不能为负")
    private BigDecimal weight;

    /**
     * 单件体积（立方米）
     */
    @DecimalMin(value = "0", message = "体积不能为负")
    private BigDecimal volume;

    @DecimalMin(value = "0", message = "成本不能为负")
    private BigDecimal unitCost;

    @DecimalMin(value = "0", message = "售价不能为负")
    private BigDecimal unitPrice;
}
