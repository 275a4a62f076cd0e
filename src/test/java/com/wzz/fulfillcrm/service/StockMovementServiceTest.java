package com.wzz.fulfillcrm.service;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.wzz.fulfillcrm.dto.CreatDTO.StockAdjustDTO;
import com.wzz.fulfillcrm.dto.CreatDTO.StockReceiveDTO;
import com.wzz.fulfillcrm.dto.CreatDTO.StockTransferDTO;
import com.wzz.fulfillcrm.dto.CreatDTO.StockWriteOffDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.MovementStatsDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.ProductSummaryDTO;
import com.wzz.fulfillcrm.entity.FinTransaction;
import com.wzz.fulfillcrm.entity.Product;
import com.wzz.fulfillcrm.entity.ProductStock;
import com.wzz.fulfillcrm.entity.StockMovement;
import com.wzz.fulfillcrm.entity.StorageLocation;
import com.wzz.fulfillcrm.entity.Warehouse;
import com.wzz.fulfillcrm.enums.LocationStatus;
import com.wzz.fulfillcrm.enums.MovementType;
import com.wzz.fulfillcrm.exception.BusinessException;
import com.wzz.fulfillcrm.mapper.ProductStockMapper;
import com.wzz.fulfillcrm.support.BaseIntegrationTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StockMovementServiceTest extends BaseIntegrationTest {

    @Autowired
    private StockMovementService stockMovementService;

    @Autowired
    private AccountService accountService;

    @Autowired
    private FinTransactionService finTransactionService;

    @Autowired
    private ProductStockMapper productStockMapper;

    private Warehouse warehouse;
    private StorageLocation shelfA;
    private StorageLocation shelfB;
    private Product product;

    @BeforeEach
    void setUp() {
        warehouse = newWarehouse("T-WH1");
        shelfA = newLocation(warehouse.getId(), "A-01");
        shelfB = newLocation(warehouse.getId(), "B-01");
        product = newProduct("T-SKU1", "10");
    }

    private StockMovement receive(StorageLocation location, int quantity) {
        StockReceiveDTO dto = new StockReceiveDTO();
        dto.setProductId(product.getId());
        dto.setToLocationId(location.getId());
        dto.setQuantity(quantity);
        return stockMovementService.receive(dto, adminId());
    }

    private StockTransferDTO transfer(StorageLocation from, StorageLocation to, int quantity) {
        StockTransferDTO dto = new StockTransferDTO();
        dto.setProductId(product.getId());
        dto.setFromLocationId(from.getId());
        dto.setToLocationId(to.getId());
        dto.setQuantity(quantity);
        return dto;
    }

    private ProductStock stockAt(StorageLocation location) {
        return productStockMapper.selectOne(new LambdaQueryWrapper<ProductStock>()
                .eq(ProductStock::getProductId, product.getId())
                .eq(ProductStock::getStorageLocationId, location.getId()));
    }

    private LocationStatus statusOf(StorageLocation location) {
        return storageLocationService.getById(location.getId()).getStatus();
    }

    @Test
    void receivingAddsStockAndOccupiesLocation() {
        StockMovement movement = receive(shelfA, 10);

        assertThat(movement.getMovementType()).isEqualTo(MovementType.INBOUND);
        assertThat(movement.getCreatedBy()).isEqualTo(adminId());
        assertThat(stockAt(shelfA).getQuantity()).isEqualTo(10);
        assertThat(stockAt(shelfA).getAvailableQty()).isEqualTo(10);
        assertThat(statusOf(shelfA)).isEqualTo(LocationStatus.OCCUPIED);
    }

    @Test
    void receivingIntoSameLocationAccumulatesOneRow() {
        receive(shelfA, 4);
        receive(shelfA, 6);

        assertThat(productStockMapper.selectCount(new LambdaQueryWrapper<ProductStock>()
                .eq(ProductStock::getProductId, product.getId()))).isEqualTo(1);
        assertThat(stockAt(shelfA).getQuantity()).isEqualTo(10);
    }

    @Test
    void blockedLocationRejectsInbound() {
        StorageLocation patch = new StorageLocation();
        patch.setStatus(LocationStatus.BLOCKED);
        storageLocationService.updateLocation(shelfA.getId(), patch);

        assertThatThrownBy(() -> receive(shelfA, 1))
                .isInstanceOf(BusinessException.class)
                .extracting("code").isEqualTo(400);
    }

    @Test
    void transferMovesStockAndFreesEmptiedLocation() {
        receive(shelfA, 5);

        stockMovementService.transfer(transfer(shelfA, shelfB, 5), adminId());

        assertThat(stockAt(shelfA).getQuantity()).isZero();
        assertThat(stockAt(shelfB).getQuantity()).isEqualTo(5);
        assertThat(statusOf(shelfA)).isEqualTo(LocationStatus.FREE);
        assertThat(statusOf(shelfB)).isEqualTo(LocationStatus.OCCUPIED);
    }

    @Test
    void transferBeyondAvailableChangesNothing() {
        receive(shelfA, 3);

        assertThatThrownBy(() -> stockMovementService.transfer(transfer(shelfA, shelfB, 4), adminId()))
                .isInstanceOf(BusinessException.class)
                .extracting("code").isEqualTo(400);
        assertThat(stockAt(shelfA).getQuantity()).isEqualTo(3);
        assertThat(stockAt(shelfB)).isNull();
        assertThat(stockMovementService.listByProduct(product.getId(), null)).hasSize(1);
    }

    @Test
    void transferToSameLocationIsRejected() {
        receive(shelfA, 3);

        assertThatThrownBy(() -> stockMovementService.transfer(transfer(shelfA, shelfA, 1), adminId()))
                .isInstanceOf(BusinessException.class)
                .extracting("code").isEqualTo(400);
    }

    @Test
    void writeOffReducesStockAndPostsLoss() {
        receive(shelfA, 5);
        BigDecimal lossBefore = accountService.getByCode("91.2").getBalance();
        BigDecimal goodsBefore = accountService.getByCode("41").getBalance();

        StockWriteOffDTO dto = new StockWriteOffDTO();
        dto.setProductId(product.getId());
        dto.setLocationId(shelfA.getId());
        dto.setQuantity(3);
        dto.setReason("破损");
        stockMovementService.writeOff(dto, adminId());

        assertThat(stockAt(shelfA).getQuantity()).isEqualTo(2);
        assertThat(accountService.getByCode("91.2").getBalance()).isEqualByComparingTo(lossBefore.add(new BigDecimal("30")));
        assertThat(accountService.getByCode("41").getBalance()).isEqualByComparingTo(goodsBefore.subtract(new BigDecimal("30")));
        List<FinTransaction> postings = finTransactionService.list(new LambdaQueryWrapper<FinTransaction>()
                .like(FinTransaction::getDescription, "T-SKU1"));
        assertThat(postings).singleElement()
                .satisfies(tx -> assertThat(tx.getDescription()).isEqualTo("报损: Product T-SKU1 x3. 破损"));
    }

    @Test
    void writeOffOfFreeProductPostsNothing() {
        Product free = newProduct("T-SKU2", "0");
        StockReceiveDTO in = new StockReceiveDTO();
        in.setProductId(free.getId());
        in.setToLocationId(shelfA.getId());
        in.setQuantity(2);
        stockMovementService.receive(in, adminId());
        long before = finTransactionService.count();

        StockWriteOffDTO dto = new StockWriteOffDTO();
        dto.setProductId(free.getId());
        dto.setLocationId(shelfA.getId());
        dto.setQuantity(2);
        dto.setReason("过期");
        stockMovementService.writeOff(dto, adminId());

        assertThat(finTransactionService.count()).isEqualTo(before);
    }

    @Test
    void adjustSetsAbsoluteCountAndRecordsDifference() {
        receive(shelfA, 10);

        StockAdjustDTO dto = new StockAdjustDTO();
        dto.setLocationId(shelfA.getId());
        dto.setQuantity(7);
        dto.setReason("盘点");
        StockMovement movement = stockMovementService.adjust(product.getId(), dto, adminId());

        assertThat(movement.getMovementType()).isEqualTo(MovementType.ADJUSTMENT);
        assertThat(movement.getQuantity()).isEqualTo(-3);
        assertThat(stockAt(shelfA).getQuantity()).isEqualTo(7);
        assertThat(stockAt(shelfA).getAvailableQty()).isEqualTo(7);
    }

    @Test
    void adjustToZeroFreesLocation() {
        receive(shelfA, 2);

        StockAdjustDTO dto = new StockAdjustDTO();
        dto.setLocationId(shelfA.getId());
        dto.setQuantity(0);
        dto.setReason("盘亏");
        stockMovementService.adjust(product.getId(), dto, adminId());

        assertThat(statusOf(shelfA)).isEqualTo(LocationStatus.FREE);
    }

    @Test
    void productTotalsAndLowStockFlag() {
        Product patch = new Product();
        patch.setMinStock(5);
        productService.updateProduct(product.getId(), patch);
        receive(shelfA, 2);
        receive(shelfB, 1);

        ProductSummaryDTO summary = productService.listProducts("T-SKU1", null, null).get(0);

        assertThat(summary.getTotalQuantity()).isEqualTo(3);
        assertThat(summary.getTotalAvailable()).isEqualTo(3);
        assertThat(summary.isLowStock()).isTrue();
    }

    @Test
    void productWithMovementsCannotBeDeleted() {
        receive(shelfA, 1);

        assertThatThrownBy(() -> productService.deleteProduct(product.getId()))
                .isInstanceOf(BusinessException.class)
                .extracting("code").isEqualTo(400);
    }

    @Test
    void movementListFiltersByWarehouseAndStatsCountByType() {
        receive(shelfA, 4);
        stockMovementService.transfer(transfer(shelfA, shelfB, 1), adminId());
        Warehouse other = newWarehouse("T-WH2");

        assertThat(stockMovementService.listMovements(null, null, warehouse.getId(), null, null, null)).hasSize(2);
        assertThat(stockMovementService.listMovements(null, null, other.getId(), null, null, null)).isEmpty();
        assertThat(stockMovementService.listByLocation(shelfB.getId(), null)).hasSize(1);

        MovementStatsDTO stats = stockMovementService.stats(null, null);
        assertThat(stats.getTodayCount()).isGreaterThanOrEqualTo(2);
        assertThat(stats.getByType()).anySatisfy(row -> {
            assertThat(row.getMovementType()).isEqualTo(MovementType.TRANSFER);
            assertThat(row.getCount()).isGreaterThanOrEqualTo(1);
        });
    }
}
