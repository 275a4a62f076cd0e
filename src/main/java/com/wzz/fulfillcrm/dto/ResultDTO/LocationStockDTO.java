package com.wzz.fulfillcrm.dto.ResultDTO;

import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.wzz.fulfillcrm.entity.ProductStock;
import com.wzz.fulfillcrm.entity.StorageLocation;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 库位及其上的库存行
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LocationStockDTO {

    @JsonUnwrapped
    private StorageLocation location;

    private List<ProductStock> stocks;

    private long totalQuantity;
}
