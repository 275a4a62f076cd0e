package com.wzz.fulfillcrm.controller.warehouse;

import cn.dev33.satoken.annotation.SaCheckRole;
import cn.dev33.satoken.annotation.SaMode;
import cn.dev33.satoken.stp.StpUtil;
import com.wzz.fulfillcrm.common.Result;
import com.wzz.fulfillcrm.dto.CreatDTO.StockAdjustDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.ProductDetailDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.ProductSummaryDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.StockLineDTO;
import com.wzz.fulfillcrm.entity.Product;
import com.wzz.fulfillcrm.entity.StockMovement;
import com.wzz.fulfillcrm.service.ProductService;
import com.wzz.fulfillcrm.service.StockMovementService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 商品与库存接口
 */
@RestController
@RequestMapping("/api/products")
public class ProductController {

    private final ProductService productService;
    private final StockMovementService stockMovementService;

    public ProductController(ProductService productService, StockMovementService stockMovementService) {
        this.productService = productService;
        this.stockMovementService = stockMovementService;
    }

    @GetMapping
    public Result<List<ProductSummaryDTO>> list(@RequestParam(required = false) String search,
                                                @RequestParam(required = false) String category,
                                                @RequestParam(required = false) Boolean isActive) {
        return Result.success(productService.listProducts(search, category, isActive));
    }

    @GetMapping("/stocks")
    public Result<List<StockLineDTO>> stocks(@RequestParam(required = false) Long warehouseId,
                                             @RequestParam(required = false) Long productId) {
        return Result.success(productService.listStocks(warehouseId, productId));
    }

    /**
     * 按 SKU 或条码查找，扫码枪入口
     */
    @GetMapping("/lookup/{code}")
    public Result<ProductDetailDTO> lookup(@PathVariable("code") String code) {
        return Result.success(productService.lookup(code));
    }

    @GetMapping("/{id}")
    public Result<ProductDetailDTO> get(@PathVariable("id") Long id) {
        return Result.success(productService.getDetail(id));
    }

    @GetMapping("/{productId}/stock")
    public Result<List<StockLineDTO>> productStock(@PathVariable("productId") Long productId) {
        productService.requireProduct(productId);
        return Result.success(productService.listStocks(null, productId));
    }

    @SaCheckRole(value = {"ADMIN", "MANAGER"}, mode = SaMode.OR)
    @PostMapping("/{productId}/adjust")
    public Result<StockMovement> adjust(@PathVariable("productId") Long productId,
                                        @Valid @RequestBody StockAdjustDTO dto) {
        return Result.success("调整成功", stockMovementService.adjust(productId, dto, StpUtil.getLoginIdAsLong()));
    }

    @SaCheckRole(value = {"ADMIN", "MANAGER"}, mode = SaMode.OR)
    @PostMapping
    public Result<Product> create(@RequestBody Product product) {
        return Result.success("创建成功", productService.createProduct(product));
    }

    @SaCheckRole(value = {"ADMIN", "MANAGER"}, mode = SaMode.OR)
    @PutMapping("/{id}")
    public Result<Product> update(@PathVariable("id") Long id, @RequestBody Product product) {
        return Result.success("更新成功", productService.updateProduct(id, product));
    }

    @SaCheckRole("ADMIN")
    @DeleteMapping("/{id}")
    public Result<?> delete(@PathVariable("id") Long id) {
        productService.deleteProduct(id);
        return Result.success("删除成功", null);
    }
}
