package com.wzz.fulfillcrm.service.impl;

import cn.hutool.core.util.StrUtil;
import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.wzz.fulfillcrm.common.Constants;
import com.wzz.fulfillcrm.dto.ResultDTO.ProductDetailDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.ProductSummaryDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.StockLineDTO;
import com.wzz.fulfillcrm.entity.Product;
import com.wzz.fulfillcrm.entity.ProductStock;
import com.wzz.fulfillcrm.entity.StockMovement;
import com.wzz.fulfillcrm.entity.StorageLocation;
import com.wzz.fulfillcrm.entity.Warehouse;
import com.wzz.fulfillcrm.exception.BusinessException;
import com.wzz.fulfillcrm.mapper.ProductMapper;
import com.wzz.fulfillcrm.mapper.ProductStockMapper;
import com.wzz.fulfillcrm.mapper.StockMovementMapper;
import com.wzz.fulfillcrm.mapper.StorageLocationMapper;
import com.wzz.fulfillcrm.mapper.WarehouseMapper;
import com.wzz.fulfillcrm.service.ProductService;
import com.wzz.fulfillcrm.util.MoneyUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Service
public class ProductServiceImpl extends ServiceImpl<ProductMapper, Product> implements ProductService {

    @Autowired
    private ProductStockMapper productStockMapper;

    @Autowired
    private StockMovementMapper stockMovementMapper;

    @Autowired
    private StorageLocationMapper storageLocationMapper;

    @Autowired
    private WarehouseMapper warehouseMapper;

    @Override
    public List<ProductSummaryDTO> listProducts(String search, String category, Boolean isActive) {
        LambdaQueryWrapper<Product> wrapper = new LambdaQueryWrapper<Product>()
                .eq(StrUtil.isNotBlank(category), Product::getCategory, category)
                .eq(isActive != null, Product::getIsActive, isActive);
        if (StrUtil.isNotBlank(search)) {
            wrapper.and(w -> w.like(Product::getSku, search)
                    .or().like(Product::getName, search)
                    .or().like(Product::getBarcode, search));
        }
        wrapper.orderByAsc(Product::getName);
        List<Product> products = this.list(wrapper);
        if (products.isEmpty()) {
            return Collections.emptyList();
        }
        Map<Long, List<ProductStock>> stocks = productStockMapper.selectList(new LambdaQueryWrapper<ProductStock>()
                        .in(ProductStock::getProductId, products.stream().map(Product::getId).collect(Collectors.toList())))
                .stream()
                .collect(Collectors.groupingBy(ProductStock::getProductId));
        return products.stream()
                .map(p -> summarize(p, stocks.getOrDefault(p.getId(), Collections.emptyList())))
                .collect(Collectors.toList());
    }

    @Override
    public ProductDetailDTO getDetail(Long id) {
        Product product = requireProduct(id);
        List<StockMovement> movements = stockMovementMapper.selectList(new LambdaQueryWrapper<StockMovement>()
                .eq(StockMovement::getProductId, id)
                .orderByDesc(StockMovement::getCreateTime)
                .orderByDesc(StockMovement::getId)
                .last("LIMIT " + Constants.MOVEMENT_RECENT_LIMIT));
        return new ProductDetailDTO(product, listStocks(null, id), movements);
    }

    @Override
    public ProductDetailDTO lookup(String code) {
        if (StrUtil.isBlank(code)) {
            throw BusinessException.badRequest("请输入 SKU 或条码");
        }
        String trimmed = code.trim();
        Product product = this.getOne(new LambdaQueryWrapper<Product>()
                .eq(Product::getSku, trimmed)
                .or().eq(Product::getBarcode, trimmed)
                .last("LIMIT 1"));
        if (product == null) {
            throw BusinessException.notFound("商品不存在: " + trimmed);
        }
        List<StockLineDTO> available = listStocks(null, product.getId()).stream()
                .filter(s -> s.getStock().getAvailableQty() > 0)
                .collect(Collectors.toList());
        return new ProductDetailDTO(product, available, Collections.emptyList());
    }

    @Override
    public Product requireProduct(Long id) {
        Product product = id == null ? null : this.getById(id);
        if (product == null) {
            throw BusinessException.notFound("商品不存在: " + id);
        }
        return product;
    }

    @Override
    public Product createProduct(Product product) {
        if (StrUtil.isBlank(product.getSku())) {
            throw BusinessException.badRequest("SKU 不能为空");
        }
        if (StrUtil.isBlank(product.getName())) {
            throw BusinessException.badRequest("商品名称不能为空");
        }
        product.setId(null);
        product.setSku(product.getSku().trim());
        product.setBarcode(StrUtil.isBlank(product.getBarcode()) ? null : product.getBarcode().trim());
        checkUnique(product.getSku(), product.getBarcode(), null);
        product.setUnitWeight(MoneyUtil.quantity(product.getUnitWeight()));
        product.setUnitVolume(MoneyUtil.nz(product.getUnitVolume()));
        product.setUnitCost(MoneyUtil.money(product.getUnitCost()));
        product.setUnitPrice(MoneyUtil.money(product.getUnitPrice()));
        checkNonNegative(product);
        if (product.getMinStock() == null) {
            product.setMinStock(0);
        }
        if (product.getIsActive() == null) {
            product.setIsActive(true);
        }
        this.save(product);
        log.info("新增商品 {}: {} ({})", product.getId(), product.getName(), product.getSku());
        return product;
    }

    @Override
    public Product updateProduct(Long id, Product patch) {
        requireProduct(id);
        if (patch.getSku() != null) {
            if (StrUtil.isBlank(patch.getSku())) {
                throw BusinessException.badRequest("SKU 不能为空");
            }
            patch.setSku(patch.getSku().trim());
        }
        if (patch.getName() != null && StrUtil.isBlank(patch.getName())) {
            throw BusinessException.badRequest("商品名称不能为空");
        }
        if (patch.getBarcode() != null) {
            patch.setBarcode(patch.getBarcode().trim());
            if (patch.getBarcode().isEmpty()) {
                throw BusinessException.badRequest("条码不能为空串");
            }
        }
        checkUnique(patch.getSku(), patch.getBarcode(), id);
        if (patch.getUnitCost() != null) {
            patch.setUnitCost(MoneyUtil.money(patch.getUnitCost()));
        }
        if (patch.getUnitPrice() != null) {
            patch.setUnitPrice(MoneyUtil.money(patch.getUnitPrice()));
        }
        checkNonNegative(patch);
        patch.setId(id);
        patch.setCreateTime(null);
        this.updateById(patch);
        return this.getById(id);
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public void deleteProduct(Long id) {
        requireProduct(id);
        Long movements = stockMovementMapper.selectCount(new LambdaQueryWrapper<StockMovement>()
                .eq(StockMovement::getProductId, id));
        if (movements > 0) {
            throw BusinessException.badRequest("商品已有库存移动记录，无法删除，请改为停用");
        }
        productStockMapper.delete(new LambdaQueryWrapper<ProductStock>().eq(ProductStock::getProductId, id));
        this.removeById(id);
        log.info("删除商品 {}", id);
    }

    @Override
    public List<StockLineDTO> listStocks(Long warehouseId, Long productId) {
        LambdaQueryWrapper<ProductStock> wrapper = new LambdaQueryWrapper<ProductStock>()
                .eq(productId != null, ProductStock::getProductId, productId);
        if (warehouseId != null) {
            List<Long> locationIds = storageLocationMapper.selectList(new LambdaQueryWrapper<StorageLocation>()
                            .eq(StorageLocation::getWarehouseId, warehouseId))
                    .stream().map(StorageLocation::getId).collect(Collectors.toList());
            if (locationIds.isEmpty()) {
                return Collections.emptyList();
            }
            wrapper.in(ProductStock::getStorageLocationId, locationIds);
        }
        List<ProductStock> stocks = productStockMapper.selectList(wrapper);
        if (stocks.isEmpty()) {
            return Collections.emptyList();
        }
        Map<Long, Product> products = byId(this.listByIds(ids(stocks, ProductStock::getProductId)), Product::getId);
        Map<Long, StorageLocation> locations = byId(storageLocationMapper.selectBatchIds(
                ids(stocks, ProductStock::getStorageLocationId)), StorageLocation::getId);
        Set<Long> warehouseIds = locations.values().stream().map(StorageLocation::getWarehouseId).collect(Collectors.toSet());
        Map<Long, Warehouse> warehouses = byId(warehouseMapper.selectBatchIds(warehouseIds), Warehouse::getId);

        return stocks.stream()
                .map(s -> {
                    StockLineDTO line = new StockLineDTO();
                    line.setStock(s);
                    Product p = products.get(s.getProductId());
                    if (p != null) {
                        line.setSku(p.getSku());
                        line.setProductName(p.getName());
                    }
                    StorageLocation l = locations.get(s.getStorageLocationId());
                    if (l != null) {
                        line.setLocationCode(l.getCode());
                        line.setWarehouseId(l.getWarehouseId());
                        Warehouse w = warehouses.get(l.getWarehouseId());
                        if (w != null) {
                            line.setWarehouseCode(w.getCode());
                            line.setWarehouseName(w.getName());
                        }
                    }
                    return line;
                })
                .sorted(Comparator.comparing((StockLineDTO l) -> StrUtil.nullToEmpty(l.getProductName()))
                        .thenComparing(l -> StrUtil.nullToEmpty(l.getLocationCode())))
                .collect(Collectors.toList());
    }

    private ProductSummaryDTO summarize(Product product, List<ProductStock> stocks) {
        long quantity = stocks.stream().mapToLong(ProductStock::getQuantity).sum();
        long reserved = stocks.stream().mapToLong(ProductStock::getReservedQty).sum();
        long available = stocks.stream().mapToLong(ProductStock::getAvailableQty).sum();
        int minStock = product.getMinStock() == null ? 0 : product.getMinStock();
        return new ProductSummaryDTO(product, quantity, reserved, available, available < minStock);
    }

    private void checkUnique(String sku, String barcode, Long excludeId) {
        if (sku != null && this.count(new LambdaQueryWrapper<Product>()
                .eq(Product::getSku, sku)
                .ne(excludeId != null, Product::getId, excludeId)) > 0) {
            throw BusinessException.badRequest("SKU 已存在: " + sku);
        }
        if (barcode != null && this.count(new LambdaQueryWrapper<Product>()
                .eq(Product::getBarcode, barcode)
                .ne(excludeId != null, Product::getId, excludeId)) > 0) {
            throw BusinessException.badRequest("条码已存在: " + barcode);
        }
    }

    private void checkNonNegative(Product product) {
        for (BigDecimal value : new BigDecimal[]{product.getUnitWeight(), product.getUnitVolume(),
                product.getUnitCost(), product.getUnitPrice()}) {
            if (value != null && value.signum() < 0) {
                throw BusinessException.badRequest("重量、体积、成本与售价不能为负");
            }
        }
        if (product.getMinStock() != null && product.getMinStock() < 0) {
            throw BusinessException.badRequest("安全库存不能为负");
        }
    }

    private static <T> Set<Long> ids(Collection<T> rows, Function<T, Long> key) {
        return rows.stream().map(key).collect(Collectors.toSet());
    }

    private static <T> Map<Long, T> byId(Collection<T> rows, Function<T, Long> key) {
        return rows.stream().collect(Collectors.toMap(key, Function.identity()));
    }
}
