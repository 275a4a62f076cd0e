package com.wzz.fulfillcrm.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.wzz.fulfillcrm.dto.ResultDTO.ProductDetailDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.ProductSummaryDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.StockLineDTO;
import com.wzz.fulfillcrm.entity.Product;

import java.util.List;

public interface ProductService extends IService<Product> {

    /**
     * 按 SKU、名称、条码模糊查询，附带库存合计
     */
    List<ProductSummaryDTO> listProducts(String search, String category, Boolean isActive);

    ProductDetailDTO getDetail(Long id);

    /**
     * 按 SKU 或条码精确查找，只返回有可用数量的库存行
     */
    ProductDetailDTO lookup(String code);

    Product requireProduct(Long id);

    Product createProduct(Product product);

    Product updateProduct(Long id, Product patch);

    /**
     * 已有库存移动记录的商品不能删除，应改为停用
     */
    void deleteProduct(Long id);

    List<StockLineDTO> listStocks(Long warehouseId, Long productId);
}
