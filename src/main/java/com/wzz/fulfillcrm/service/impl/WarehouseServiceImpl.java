package com.wzz.fulfillcrm.service.impl;

import cn.hutool.core.util.StrUtil;
import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.wzz.fulfillcrm.dto.ResultDTO.LocationStockDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.WarehouseDetailDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.WarehouseSummaryDTO;
import com.wzz.fulfillcrm.entity.StorageLocation;
import com.wzz.fulfillcrm.entity.Warehouse;
import com.wzz.fulfillcrm.entity.WarehouseTask;
import com.wzz.fulfillcrm.enums.WarehouseStatus;
import com.wzz.fulfillcrm.enums.WarehouseType;
import com.wzz.fulfillcrm.exception.BusinessException;
import com.wzz.fulfillcrm.mapper.WarehouseMapper;
import com.wzz.fulfillcrm.mapper.WarehouseTaskMapper;
import com.wzz.fulfillcrm.service.StorageLocationService;
import com.wzz.fulfillcrm.service.WarehouseService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

@Slf4j
@Service
public class WarehouseServiceImpl extends ServiceImpl<WarehouseMapper, Warehouse> implements WarehouseService {

    @Autowired
    private StorageLocationService storageLocationService;

    @Autowired
    private WarehouseTaskMapper warehouseTaskMapper;

    @Override
    public List<WarehouseSummaryDTO> listWarehouses(WarehouseStatus status, WarehouseType type) {
        List<Warehouse> warehouses = this.list(new LambdaQueryWrapper<Warehouse>()
                .eq(status != null, Warehouse::getStatus, status)
                .eq(type != null, Warehouse::getType, type)
                .orderByAsc(Warehouse::getName));
        return warehouses.stream()
                .map(w -> new WarehouseSummaryDTO(w, countLocations(w.getId()), countTasks(w.getId())))
                .collect(Collectors.toList());
    }

    @Override
    public WarehouseDetailDTO getDetail(Long id) {
        Warehouse warehouse = requireWarehouse(id);
        List<LocationStockDTO> locations = storageLocationService.listLocations(id, null, null, null);
        return new WarehouseDetailDTO(warehouse, locations, countTasks(id));
    }

    @Override
    public Warehouse requireWarehouse(Long id) {
        Warehouse warehouse = id == null ? null : this.getById(id);
        if (warehouse == null) {
            throw BusinessException.notFound("仓库不存在: " + id);
        }
        return warehouse;
    }

    @Override
    public Warehouse createWarehouse(Warehouse warehouse) {
        if (StrUtil.isBlank(warehouse.getName())) {
            throw BusinessException.badRequest("仓库名称不能为空");
        }
        if (StrUtil.isBlank(warehouse.getCode())) {
            throw BusinessException.badRequest("仓库代码不能为空");
        }
        warehouse.setCode(warehouse.getCode().trim());
        if (codeTaken(warehouse.getCode(), null)) {
            throw BusinessException.badRequest("仓库代码已存在: " + warehouse.getCode());
        }
        warehouse.setId(null);
        if (warehouse.getType() == null) {
            warehouse.setType(WarehouseType.MAIN);
        }
        if (warehouse.getStatus() == null) {
            warehouse.setStatus(WarehouseStatus.ACTIVE);
        }
        this.save(warehouse);
        log.info("新增仓库 {}: {} ({})", warehouse.getId(), warehouse.getName(), warehouse.getCode());
        return warehouse;
    }

    @Override
    public Warehouse updateWarehouse(Long id, Warehouse patch) {
        requireWarehouse(id);
        if (patch.getName() != null && StrUtil.isBlank(patch.getName())) {
            throw BusinessException.badRequest("仓库名称不能为空");
        }
        if (patch.getCode() != null) {
            if (StrUtil.isBlank(patch.getCode())) {
                throw BusinessException.badRequest("仓库代码不能为空");
            }
            patch.setCode(patch.getCode().trim());
            if (codeTaken(patch.getCode(), id)) {
                throw BusinessException.badRequest("仓库代码已存在: " + patch.getCode());
            }
        }
        patch.setId(id);
        patch.setCreateTime(null);
        this.updateById(patch);
        return this.getById(id);
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public void deleteWarehouse(Long id) {
        requireWarehouse(id);
        if (countTasks(id) > 0) {
            throw BusinessException.badRequest("仓库已有作业记录，无法删除，请改为停用");
        }
        // 逐个删除库位，有库存的库位会拒绝并回滚
        List<StorageLocation> locations = storageLocationService.list(new LambdaQueryWrapper<StorageLocation>()
                .eq(StorageLocation::getWarehouseId, id));
        locations.forEach(l -> storageLocationService.deleteLocation(l.getId()));
        this.removeById(id);
        log.info("删除仓库 {}，连同库位 {} 个", id, locations.size());
    }

    private long countLocations(Long warehouseId) {
        return storageLocationService.count(new LambdaQueryWrapper<StorageLocation>()
                .eq(StorageLocation::getWarehouseId, warehouseId));
    }

    private long countTasks(Long warehouseId) {
        return warehouseTaskMapper.selectCount(new LambdaQueryWrapper<WarehouseTask>()
                .eq(WarehouseTask::getWarehouseId, warehouseId));
    }

    private boolean codeTaken(String code, Long excludeId) {
        return this.count(new LambdaQueryWrapper<Warehouse>()
                .eq(Warehouse::getCode, code)
                .ne(excludeId != null, Warehouse::getId, excludeId)) > 0;
    }
}
