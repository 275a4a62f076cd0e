package com.wzz.fulfillcrm.controller.warehouse;

import cn.dev33.satoken.annotation.SaCheckRole;
import cn.dev33.satoken.annotation.SaMode;
import com.wzz.fulfillcrm.common.Result;
import com.wzz.fulfillcrm.dto.ResultDTO.LocationStockDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.WarehouseDetailDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.WarehouseSummaryDTO;
import com.wzz.fulfillcrm.entity.StorageLocation;
import com.wzz.fulfillcrm.entity.Warehouse;
import com.wzz.fulfillcrm.enums.LocationStatus;
import com.wzz.fulfillcrm.enums.LocationType;
import com.wzz.fulfillcrm.enums.WarehouseStatus;
import com.wzz.fulfillcrm.enums.WarehouseType;
import com.wzz.fulfillcrm.service.StorageLocationService;
import com.wzz.fulfillcrm.service.WarehouseService;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 仓库与库位接口
 */
@RestController
@RequestMapping("/api/warehouses")
public class WarehouseController {

    private final WarehouseService warehouseService;
    private final StorageLocationService storageLocationService;

    public WarehouseController(WarehouseService warehouseService, StorageLocationService storageLocationService) {
        this.warehouseService = warehouseService;
        this.storageLocationService = storageLocationService;
    }

    @GetMapping
    public Result<List<WarehouseSummaryDTO>> list(@RequestParam(required = false) WarehouseStatus status,
                                                  @RequestParam(required = false) WarehouseType type) {
        return Result.success(warehouseService.listWarehouses(status, type));
    }

    @GetMapping("/{id}")
    public Result<WarehouseDetailDTO> get(@PathVariable("id") Long id) {
        return Result.success(warehouseService.getDetail(id));
    }

    @SaCheckRole(value = {"ADMIN", "MANAGER"}, mode = SaMode.OR)
    @PostMapping
    public Result<Warehouse> create(@RequestBody Warehouse warehouse) {
        return Result.success("创建成功", warehouseService.createWarehouse(warehouse));
    }

    @SaCheckRole(value = {"ADMIN", "MANAGER"}, mode = SaMode.OR)
    @PutMapping("/{id}")
    public Result<Warehouse> update(@PathVariable("id") Long id, @RequestBody Warehouse warehouse) {
        return Result.success("更新成功", warehouseService.updateWarehouse(id, warehouse));
    }

    @SaCheckRole("ADMIN")
    @DeleteMapping("/{id}")
    public Result<?> delete(@PathVariable("id") Long id) {
        warehouseService.deleteWarehouse(id);
        return Result.success("删除成功", null);
    }

    @GetMapping("/{warehouseId}/locations")
    public Result<List<LocationStockDTO>> locations(@PathVariable("warehouseId") Long warehouseId,
                                                    @RequestParam(required = false) LocationStatus status,
                                                    @RequestParam(required = false) LocationType type,
                                                    @RequestParam(required = false) String zone) {
        warehouseService.requireWarehouse(warehouseId);
        return Result.success(storageLocationService.listLocations(warehouseId, status, type, zone));
    }

    @SaCheckRole(value = {"ADMIN", "MANAGER"}, mode = SaMode.OR)
    @PostMapping("/{warehouseId}/locations")
    public Result<StorageLocation> createLocation(@PathVariable("warehouseId") Long warehouseId,
                                                  @RequestBody StorageLocation location) {
        return Result.success("创建成功", storageLocationService.createLocation(warehouseId, location));
    }

    @GetMapping("/locations/{id}")
    public Result<StorageLocation> getLocation(@PathVariable("id") Long id) {
        return Result.success(storageLocationService.requireLocation(id));
    }

    @SaCheckRole(value = {"ADMIN", "MANAGER"}, mode = SaMode.OR)
    @PutMapping("/locations/{id}")
    public Result<StorageLocation> updateLocation(@PathVariable("id") Long id,
                                                  @RequestBody StorageLocation location) {
        return Result.success("更新成功", storageLocationService.updateLocation(id, location));
    }

    @SaCheckRole("ADMIN")
    @DeleteMapping("/locations/{id}")
    public Result<?> deleteLocation(@PathVariable("id") Long id) {
        storageLocationService.deleteLocation(id);
        return Result.success("删除成功", null);
    }
}
