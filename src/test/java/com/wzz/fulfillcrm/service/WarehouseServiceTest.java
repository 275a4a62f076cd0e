package com.wzz.fulfillcrm.service;

import com.wzz.fulfillcrm.dto.CreatDTO.StockReceiveDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.LocationStockDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.WarehouseDetailDTO;
import com.wzz.fulfillcrm.entity.Product;
import com.wzz.fulfillcrm.entity.StorageLocation;
import com.wzz.fulfillcrm.entity.Warehouse;
import com.wzz.fulfillcrm.enums.LocationStatus;
import com.wzz.fulfillcrm.enums.LocationType;
import com.wzz.fulfillcrm.enums.WarehouseStatus;
import com.wzz.fulfillcrm.enums.WarehouseType;
import com.wzz.fulfillcrm.exception.BusinessException;
import com.wzz.fulfillcrm.support.BaseIntegrationTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WarehouseServiceTest extends BaseIntegrationTest {

    @Autowired
    private StockMovementService stockMovementService;

    private void receive(Product product, StorageLocation location, int quantity) {
        StockReceiveDTO dto = new StockReceiveDTO();
        dto.setProductId(product.getId());
        dto.setToLocationId(location.getId());
        dto.setQuantity(quantity);
        stockMovementService.receive(dto, adminId());
    }

    @Test
    void newWarehouseDefaultsToActiveMain() {
        Warehouse warehouse = newWarehouse("T-WH1");

        assertThat(warehouse.getType()).isEqualTo(WarehouseType.MAIN);
        assertThat(warehouse.getStatus()).isEqualTo(WarehouseStatus.ACTIVE);
    }

    @Test
    void duplicateWarehouseCodeIsRejected() {
        newWarehouse("T-WH1");

        assertThatThrownBy(() -> newWarehouse(" T-WH1 "))
                .isInstanceOf(BusinessException.class)
                .extracting("code").isEqualTo(400);
    }

    @Test
    void locationCodeIsUniquePerWarehouse() {
        Warehouse first = newWarehouse("T-WH1");
        Warehouse second = newWarehouse("T-WH2");
        StorageLocation location = newLocation(first.getId(), "A-01");
        newLocation(second.getId(), "A-01");

        assertThat(location.getType()).isEqualTo(LocationType.SHELF);
        assertThat(location.getStatus()).isEqualTo(LocationStatus.FREE);
        assertThatThrownBy(() -> newLocation(first.getId(), "A-01"))
                .isInstanceOf(BusinessException.class)
                .extracting("code").isEqualTo(400);
    }

    @Test
    void detailGroupsStockByLocation() {
        Warehouse warehouse = newWarehouse("T-WH1");
        StorageLocation shelf = newLocation(warehouse.getId(), "A-01");
        newLocation(warehouse.getId(), "A-02");
        receive(newProduct("T-SKU1", "10"), shelf, 7);

        WarehouseDetailDTO detail = warehouseService.getDetail(warehouse.getId());

        assertThat(detail.getLocations()).hasSize(2);
        LocationStockDTO first = detail.getLocations().stream()
                .filter(l -> l.getLocation().getId().equals(shelf.getId())).findFirst().orElseThrow();
        assertThat(first.getTotalQuantity()).isEqualTo(7);
        assertThat(first.getLocation().getStatus()).isEqualTo(LocationStatus.OCCUPIED);
        assertThat(warehouseService.listWarehouses(null, null))
                .anySatisfy(s -> {
                    assertThat(s.getWarehouse().getId()).isEqualTo(warehouse.getId());
                    assertThat(s.getLocationCount()).isEqualTo(2);
                });
    }

    @Test
    void locationWithStockCannotBeDeleted() {
        Warehouse warehouse = newWarehouse("T-WH1");
        StorageLocation shelf = newLocation(warehouse.getId(), "A-01");
        receive(newProduct("T-SKU1", "10"), shelf, 1);

        assertThatThrownBy(() -> storageLocationService.deleteLocation(shelf.getId()))
                .isInstanceOf(BusinessException.class)
                .extracting("code").isEqualTo(400);
        assertThatThrownBy(() -> warehouseService.deleteWarehouse(warehouse.getId()))
                .isInstanceOf(BusinessException.class)
                .extracting("code").isEqualTo(400);
        assertThat(storageLocationService.getById(shelf.getId())).isNotNull();
    }

    @Test
    void emptyWarehouseIsDeletedWithItsLocations() {
        Warehouse warehouse = newWarehouse("T-WH1");
        StorageLocation shelf = newLocation(warehouse.getId(), "A-01");

        warehouseService.deleteWarehouse(warehouse.getId());

        assertThat(warehouseService.getById(warehouse.getId())).isNull();
        assertThat(storageLocationService.getById(shelf.getId())).isNull();
    }
}
