package com.wzz.fulfillcrm.dto.ResultDTO;

import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.wzz.fulfillcrm.entity.ProductStock;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 库存行，附带商品、库位与仓库的名称
 */
@Data
@NoArgsConstructor
public class StockLineDTO {

    @JsonUnwrapped
    private ProductStock stock;

    private String sku;
    private String productName;
    private String locationCode;
    private Long warehouseId;
    private String warehouseCode;
    private String warehouseName;
}
