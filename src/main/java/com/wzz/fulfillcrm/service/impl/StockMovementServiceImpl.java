package com.wzz.fulfillcrm.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.wzz.fulfillcrm.common.Constants;
import com.wzz.fulfillcrm.dto.CreatDTO.StockAdjustDTO;
import com.wzz.fulfillcrm.dto.CreatDTO.StockReceiveDTO;
import com.wzz.fulfillcrm.dto.CreatDTO.StockTransferDTO;
import com.wzz.fulfillcrm.dto.CreatDTO.StockWriteOffDTO;
import com.wzz.fulfillcrm.dto.CreatDTO.TransactionCreateDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.MovementStatsDTO;
import com.wzz.fulfillcrm.entity.Account;
import com.wzz.fulfillcrm.entity.Product;
import com.wzz.fulfillcrm.entity.ProductStock;
import com.wzz.fulfillcrm.entity.StockMovement;
import com.wzz.fulfillcrm.entity.StorageLocation;
import com.wzz.fulfillcrm.enums.LocationStatus;
import com.wzz.fulfillcrm.enums.MovementType;
import com.wzz.fulfillcrm.exception.BusinessException;
import com.wzz.fulfillcrm.mapper.ProductStockMapper;
import com.wzz.fulfillcrm.mapper.StockMovementMapper;
import com.wzz.fulfillcrm.service.AccountService;
import com.wzz.fulfillcrm.service.FinTransactionService;
import com.wzz.fulfillcrm.service.ProductService;
import com.wzz.fulfillcrm.service.StockMovementService;
import com.wzz.fulfillcrm.service.StorageLocationService;
import com.wzz.fulfillcrm.util.DateUtil;
import com.wzz.fulfillcrm.util.MoneyUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@Service
public class StockMovementServiceImpl extends ServiceImpl<StockMovementMapper, StockMovement>
        implements StockMovementService {

    private static final int MAX_LIST_LIMIT = 500;

    @Autowired
    private ProductService productService;

    @Autowired
    private StorageLocationService storageLocationService;

    @Autowired
    private ProductStockMapper productStockMapper;

    @Autowired
    private AccountService accountService;

    @Autowired
    private FinTransactionService finTransactionService;

    @Override
    @Transactional(rollbackFor = Exception.class)
    public StockMovement receive(StockReceiveDTO dto, Long operatorId) {
        MovementType type = dto.getMovementType() != null ? dto.getMovementType() : MovementType.INBOUND;
        if (type != MovementType.INBOUND && type != MovementType.RETURN) {
            throw BusinessException.badRequest("入库只支持 INBOUND 或 RETURN");
        }
        StockMovement movement = new StockMovement();
        movement.setProductId(dto.getProductId());
        movement.setToLocationId(dto.getToLocationId());
        movement.setQuantity(dto.getQuantity());
        movement.setMovementType(type);
        movement.setBatchNumber(dto.getBatchNumber());
        movement.setReason(dto.getReason());
        movement.setOrderId(dto.getOrderId());
        movement.setCreatedBy(operatorId);
        return apply(movement);
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public StockMovement transfer(StockTransferDTO dto, Long operatorId) {
        StockMovement movement = new StockMovement();
        movement.setProductId(dto.getProductId());
        movement.setFromLocationId(dto.getFromLocationId());
        movement.setToLocationId(dto.getToLocationId());
        movement.setQuantity(dto.getQuantity());
        movement.setMovementType(MovementType.TRANSFER);
        movement.setBatchNumber(dto.getBatchNumber());
        movement.setReason(dto.getReason());
        movement.setCreatedBy(operatorId);
        return apply(movement);
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public StockMovement writeOff(StockWriteOffDTO dto, Long operatorId) {
        StockMovement movement = new StockMovement();
        movement.setProductId(dto.getProductId());
        movement.setFromLocationId(dto.getLocationId());
        movement.setQuantity(dto.getQuantity());
        movement.setMovementType(MovementType.WRITE_OFF);
        movement.setBatchNumber(dto.getBatchNumber());
        movement.setReason(dto.getReason());
        movement.setCreatedBy(operatorId);
        StockMovement saved = apply(movement);
        postWriteOff(productService.getById(dto.getProductId()), dto.getQuantity(), dto.getReason(), operatorId);
        return saved;
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public StockMovement adjust(Long productId, StockAdjustDTO dto, Long operatorId) {
        productService.requireProduct(productId);
        storageLocationService.requireLocation(dto.getLocationId());
        if (dto.getQuantity() == null || dto.getQuantity() < 0) {
            throw BusinessException.badRequest("盘点数量不能为负");
        }
        String batch = normalizeBatch(dto.getBatchNumber());
        ProductStock stock = lockStock(productId, dto.getLocationId(), batch, true);
        int reserved = nz(stock.getReservedQty());
        if (dto.getQuantity() < reserved) {
            throw BusinessException.badRequest("盘点数量不能小于已预留数量 " + reserved);
        }
        int diff = dto.getQuantity() - nz(stock.getQuantity());
        writeStock(stock, dto.getQuantity(), reserved, dto.getQuantity() - reserved);

        StockMovement movement = new StockMovement();
        movement.setProductId(productId);
        movement.setToLocationId(dto.getLocationId());
        movement.setQuantity(diff);
        movement.setMovementType(MovementType.ADJUSTMENT);
        movement.setBatchNumber(batch.isEmpty() ? null : batch);
        movement.setReason(dto.getReason());
        movement.setCreatedBy(operatorId);
        this.save(movement);
        storageLocationService.refreshStatus(dto.getLocationId());

        log.info("商品 {} 库位 {} 盘点调整为 {}（差额 {}），操作人 {}",
                productId, dto.getLocationId(), dto.getQuantity(), diff, operatorId);
        return movement;
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public StockMovement apply(StockMovement movement) {
        if (movement.getMovementType() == null) {
            throw BusinessException.badRequest("移动类型不能为空");
        }
        if (movement.getQuantity() == null || movement.getQuantity() <= 0) {
            throw BusinessException.badRequest("数量必须大于0");
        }
        productService.requireProduct(movement.getProductId());
        Long productId = movement.getProductId();
        int quantity = movement.getQuantity();
        String batch = normalizeBatch(movement.getBatchNumber());

        switch (movement.getMovementType()) {
            case INBOUND:
            case RETURN:
                requireTarget(movement.getToLocationId());
                increase(lockStock(productId, movement.getToLocationId(), batch, true), quantity);
                movement.setFromLocationId(null);
                break;
            case OUTBOUND:
                storageLocationService.requireLocation(movement.getFromLocationId());
                decrease(lockStock(productId, movement.getFromLocationId(), batch, false), quantity);
                movement.setToLocationId(null);
                break;
            case WRITE_OFF:
                storageLocationService.requireLocation(movement.getFromLocationId());
                writeOffStock(lockStock(productId, movement.getFromLocationId(), batch, false), quantity);
                movement.setToLocationId(null);
                break;
            case TRANSFER:
                storageLocationService.requireLocation(movement.getFromLocationId());
                requireTarget(movement.getToLocationId());
                if (movement.getFromLocationId().equals(movement.getToLocationId())) {
                    throw BusinessException.badRequest("来源库位与目标库位不能相同");
                }
                transferStock(productId, movement.getFromLocationId(), movement.getToLocationId(), batch, quantity);
                break;
            default:
                throw BusinessException.badRequest("盘点调整请使用库存调整接口");
        }

        movement.setId(null);
        movement.setBatchNumber(batch.isEmpty() ? null : batch);
        this.save(movement);
        if (movement.getFromLocationId() != null) {
            storageLocationService.refreshStatus(movement.getFromLocationId());
        }
        if (movement.getToLocationId() != null) {
            storageLocationService.refreshStatus(movement.getToLocationId());
        }
        log.info("库存移动 {} {}: 商品 {} 数量 {}，{} → {}，操作人 {}",
                movement.getId(), movement.getMovementType(), productId, quantity,
                movement.getFromLocationId(), movement.getToLocationId(), movement.getCreatedBy());
        return movement;
    }

    @Override
    public List<StockMovement> listMovements(Long productId, MovementType movementType, Long warehouseId,
                                             LocalDate dateFrom, LocalDate dateTo, Integer limit) {
        LambdaQueryWrapper<StockMovement> wrapper = new LambdaQueryWrapper<StockMovement>()
                .eq(productId != null, StockMovement::getProductId, productId)
                .eq(movementType != null, StockMovement::getMovementType, movementType)
                .ge(dateFrom != null, StockMovement::getCreateTime, DateUtil.startOfDay(dateFrom))
                .lt(dateTo != null, StockMovement::getCreateTime, DateUtil.startOfNextDay(dateTo));
        if (warehouseId != null) {
            List<Long> locationIds = storageLocationService.list(new LambdaQueryWrapper<StorageLocation>()
                            .eq(StorageLocation::getWarehouseId, warehouseId))
                    .stream().map(StorageLocation::getId).collect(Collectors.toList());
            if (locationIds.isEmpty()) {
                return Collections.emptyList();
            }
            wrapper.and(w -> w.in(StockMovement::getFromLocationId, locationIds)
                    .or().in(StockMovement::getToLocationId, locationIds));
        }
        wrapper.orderByDesc(StockMovement::getCreateTime)
                .orderByDesc(StockMovement::getId)
                .last("LIMIT " + limitOrDefault(limit, Constants.MOVEMENT_LIST_LIMIT));
        return this.list(wrapper);
    }

    @Override
    public List<StockMovement> listByProduct(Long productId, Integer limit) {
        return this.list(new LambdaQueryWrapper<StockMovement>()
                .eq(StockMovement::getProductId, productId)
                .orderByDesc(StockMovement::getCreateTime)
                .orderByDesc(StockMovement::getId)
                .last("LIMIT " + limitOrDefault(limit, Constants.MOVEMENT_RECENT_LIMIT)));
    }

    @Override
    public List<StockMovement> listByLocation(Long locationId, Integer limit) {
        return this.list(new LambdaQueryWrapper<StockMovement>()
                .and(w -> w.eq(StockMovement::getFromLocationId, locationId)
                        .or().eq(StockMovement::getToLocationId, locationId))
                .orderByDesc(StockMovement::getCreateTime)
                .orderByDesc(StockMovement::getId)
                .last("LIMIT " + limitOrDefault(limit, Constants.MOVEMENT_RECENT_LIMIT)));
    }

    @Override
    public List<StockMovement> listByTask(Long taskId) {
        return this.list(new LambdaQueryWrapper<StockMovement>()
                .eq(StockMovement::getTaskId, taskId)
                .orderByDesc(StockMovement::getCreateTime)
                .orderByDesc(StockMovement::getId));
    }

    @Override
    public MovementStatsDTO stats(LocalDate dateFrom, LocalDate dateTo) {
        List<StockMovement> movements = this.list(new LambdaQueryWrapper<StockMovement>()
                .ge(dateFrom != null, StockMovement::getCreateTime, DateUtil.startOfDay(dateFrom))
                .lt(dateTo != null, StockMovement::getCreateTime, DateUtil.startOfNextDay(dateTo)));
        Map<MovementType, MovementStatsDTO.TypeCount> byType = new EnumMap<>(MovementType.class);
        for (StockMovement m : movements) {
            MovementStatsDTO.TypeCount row = byType.computeIfAbsent(m.getMovementType(),
                    t -> new MovementStatsDTO.TypeCount(t, 0, 0));
            row.setCount(row.getCount() + 1);
            row.setTotalQuantity(row.getTotalQuantity() + nz(m.getQuantity()));
        }
        long todayCount = this.count(new LambdaQueryWrapper<StockMovement>()
                .ge(StockMovement::getCreateTime, LocalDate.now().atStartOfDay()));
        return new MovementStatsDTO(new ArrayList<>(byType.values()), todayCount);
    }

    private void transferStock(Long productId, Long fromId, Long toId, String batch, int quantity) {
        // 按库位ID升序加锁，避免两笔方向相反的移库互相等待
        ProductStock source;
        ProductStock target;
        if (fromId < toId) {
            source = lockStock(productId, fromId, batch, false);
            target = lockStock(productId, toId, batch, true);
        } else {
            target = lockStock(productId, toId, batch, true);
            source = lockStock(productId, fromId, batch, false);
        }
        decrease(source, quantity);
        increase(target, quantity);
    }

    private void requireTarget(Long locationId) {
        StorageLocation location = storageLocationService.requireLocation(locationId);
        if (location.getStatus() == LocationStatus.BLOCKED) {
            throw BusinessException.badRequest("库位已封存，不能放入商品: " + location.getCode());
        }
    }

    private ProductStock lockStock(Long productId, Long locationId, String batch, boolean createIfMissing) {
        ProductStock stock = productStockMapper.selectForUpdate(productId, locationId, batch);
        if (stock == null && createIfMissing) {
            stock = new ProductStock();
            stock.setProductId(productId);
            stock.setStorageLocationId(locationId);
            stock.setBatchNumber(batch);
            stock.setQuantity(0);
            stock.setReservedQty(0);
            stock.setAvailableQty(0);
            stock.setLastMovementAt(LocalDateTime.now());
            productStockMapper.insert(stock);
        }
        return stock;
    }

    private void increase(ProductStock stock, int quantity) {
        writeStock(stock, nz(stock.getQuantity()) + quantity, nz(stock.getReservedQty()),
                nz(stock.getAvailableQty()) + quantity);
    }

    private void decrease(ProductStock stock, int quantity) {
        int available = stock == null ? 0 : nz(stock.getAvailableQty());
        if (stock == null || available < quantity) {
            throw BusinessException.badRequest("库存不足：可用 " + available + "，需要 " + quantity);
        }
        writeStock(stock, nz(stock.getQuantity()) - quantity, nz(stock.getReservedQty()), available - quantity);
    }

    /**
     * 报损可以动用预留数量：先扣可用，不足部分再扣预留
     */
    private void writeOffStock(ProductStock stock, int quantity) {
        int onHand = stock == null ? 0 : nz(stock.getQuantity());
        if (stock == null || onHand < quantity) {
            throw BusinessException.badRequest("库存不足：在库 " + onHand + "，报损 " + quantity);
        }
        int fromAvailable = Math.min(quantity, nz(stock.getAvailableQty()));
        int fromReserved = quantity - fromAvailable;
        writeStock(stock, onHand - quantity, nz(stock.getReservedQty()) - fromReserved,
                nz(stock.getAvailableQty()) - fromAvailable);
    }

    private void writeStock(ProductStock stock, int quantity, int reserved, int available) {
        LocalDateTime now = LocalDateTime.now();
        int rows = productStockMapper.update(null, new LambdaUpdateWrapper<ProductStock>()
                .set(ProductStock::getQuantity, quantity)
                .set(ProductStock::getReservedQty, reserved)
                .set(ProductStock::getAvailableQty, available)
                .set(ProductStock::getLastMovementAt, now)
                .set(ProductStock::getUpdateTime, now)
                .eq(ProductStock::getId, stock.getId()));
        if (rows != 1) {
            log.error("更新库存行 {} 失败", stock.getId());
            throw new IllegalStateException("更新库存失败: " + stock.getId());
        }
        stock.setQuantity(quantity);
        stock.setReservedQty(reserved);
        stock.setAvailableQty(available);
        stock.setLastMovementAt(now);
    }

    private void postWriteOff(Product product, int quantity, String reason, Long operatorId) {
        BigDecimal unitCost = MoneyUtil.nz(product.getUnitCost());
        if (unitCost.signum() <= 0) {
            return;
        }
        Account debit = accountService.getByCode(Constants.WRITE_OFF_DEBIT_ACCOUNT);
        Account credit = accountService.getByCode(Constants.WRITE_OFF_CREDIT_ACCOUNT);
        if (debit == null || credit == null) {
            log.warn("科目 {} 或 {} 不存在，跳过报损记账",
                    Constants.WRITE_OFF_DEBIT_ACCOUNT, Constants.WRITE_OFF_CREDIT_ACCOUNT);
            return;
        }
        TransactionCreateDTO dto = new TransactionCreateDTO();
        dto.setDebitAccountId(debit.getId());
        dto.setCreditAccountId(credit.getId());
        dto.setAmount(MoneyUtil.multiply(BigDecimal.valueOf(quantity), unitCost));
        dto.setDescription("报损: " + product.getName() + " x" + quantity + ". " + reason);
        finTransactionService.post(dto, operatorId);
    }

    private static String normalizeBatch(String batch) {
        return batch == null ? "" : batch.trim();
    }

    private static int limitOrDefault(Integer limit, int defaultLimit) {
        if (limit == null || limit < 1) {
            return defaultLimit;
        }
        return Math.min(limit, MAX_LIST_LIMIT);
    }

    private static int nz(Integer value) {
        return value == null ? 0 : value;
    }
}
