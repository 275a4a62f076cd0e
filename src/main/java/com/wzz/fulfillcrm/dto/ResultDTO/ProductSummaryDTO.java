package com.wzz.fulfillcrm.dto.ResultDTO;

import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.wzz.fulfillcrm.entity.Product;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 商品及其全部库位的库存合计
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ProductSummaryDTO {

    @JsonUnwrapped
    private Product product;

    private long totalQuantity;
    private long totalReserved;
    private long totalAvailable;

    /**
     * 可用数量低于安全库存
     */
    private boolean lowStock;
}
