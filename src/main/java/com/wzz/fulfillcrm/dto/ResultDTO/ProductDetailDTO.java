package com.wzz.fulfillcrm.dto.ResultDTO;

import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.wzz.fulfillcrm.entity.Product;
import com.wzz.fulfillcrm.entity.StockMovement;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ProductDetailDTO {

    @JsonUnwrapped
    private Product product;

    private List<StockLineDTO> stocks;

    /**
     * 最近的库存移动，按时间倒序
     */
    private List<StockMovement> movements;
}
