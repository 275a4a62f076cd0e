package com.wzz.fulfillcrm.service.impl;

import cn.hutool.core.util.StrUtil;
import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.wzz.fulfillcrm.dto.ResultDTO.LocationStockDTO;
import com.wzz.fulfillcrm.entity.ProductStock;
import com.wzz.fulfillcrm.entity.StorageLocation;
import com.wzz.fulfillcrm.enums.LocationStatus;
import com.wzz.fulfillcrm.enums.LocationType;
import com.wzz.fulfillcrm.exception.BusinessException;
import com.wzz.fulfillcrm.mapper.ProductStockMapper;
import com.wzz.fulfillcrm.mapper.StorageLocationMapper;
import com.wzz.fulfillcrm.mapper.WarehouseMapper;
import com.wzz.fulfillcrm.service.StorageLocationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@Service
public class StorageLocationServiceImpl extends ServiceImpl<StorageLocationMapper, StorageLocation>
        implements StorageLocationService {

    @Autowired
    private WarehouseMapper warehouseMapper;

    @Autowired
    private ProductStockMapper productStockMapper;

    @Override
    public List<LocationStockDTO> listLocations(Long warehouseId, LocationStatus status, LocationType type, String zone) {
        if (warehouseMapper.selectById(warehouseId) == null) {
            throw BusinessException.notFound("仓库不存在: " + warehouseId);
        }
        List<StorageLocation> locations = this.list(new LambdaQueryWrapper<StorageLocation>()
                .eq(StorageLocation::getWarehouseId, warehouseId)
                .eq(status != null, StorageLocation::getStatus, status)
                .eq(type != null, StorageLocation::getType, type)
                .eq(StrUtil.isNotBlank(zone), StorageLocation::getZone, zone)
                .orderByAsc(StorageLocation::getCode));
        if (locations.isEmpty()) {
            return Collections.emptyList();
        }
        Map<Long, List<ProductStock>> stocks = productStockMapper.selectList(new LambdaQueryWrapper<ProductStock>()
                        .in(ProductStock::getStorageLocationId,
                                locations.stream().map(StorageLocation::getId).collect(Collectors.toList()))
                        .orderByAsc(ProductStock::getId))
                .stream()
                .collect(Collectors.groupingBy(ProductStock::getStorageLocationId));
        return locations.stream()
                .map(l -> {
                    List<ProductStock> lines = stocks.getOrDefault(l.getId(), Collections.emptyList());
                    long total = lines.stream().mapToLong(ProductStock::getQuantity).sum();
                    return new LocationStockDTO(l, lines, total);
                })
                .collect(Collectors.toList());
    }

    @Override
    public StorageLocation requireLocation(Long id) {
        StorageLocation location = id == null ? null : this.getById(id);
        if (location == null) {
            throw BusinessException.notFound("库位不存在: " + id);
        }
        return location;
    }

    @Override
    public StorageLocation createLocation(Long warehouseId, StorageLocation location) {
        if (warehouseMapper.selectById(warehouseId) == null) {
            throw BusinessException.notFound("仓库不存在: " + warehouseId);
        }
        if (StrUtil.isBlank(location.getCode())) {
            throw BusinessException.badRequest("库位代码不能为空");
        }
        String code = location.getCode().trim();
        if (codeTaken(warehouseId, code, null)) {
            throw BusinessException.badRequest("该仓库已存在库位代码: " + code);
        }
        location.setId(null);
        location.setWarehouseId(warehouseId);
        location.setCode(code);
        if (location.getType() == null) {
            location.setType(LocationType.SHELF);
        }
        // 新库位没有库存，只允许手工状态或空闲
        if (location.getStatus() == null || !location.getStatus().isManual()) {
            location.setStatus(LocationStatus.FREE);
        }
        this.save(location);
        log.info("仓库 {} 新增库位 {}: {}", warehouseId, location.getId(), code);
        return location;
    }

    @Override
    public StorageLocation updateLocation(Long id, StorageLocation patch) {
        StorageLocation existing = requireLocation(id);
        if (patch.getCode() != null) {
            if (StrUtil.isBlank(patch.getCode())) {
                throw BusinessException.badRequest("库位代码不能为空");
            }
            patch.setCode(patch.getCode().trim());
            if (codeTaken(existing.getWarehouseId(), patch.getCode(), id)) {
                throw BusinessException.badRequest("该仓库已存在库位代码: " + patch.getCode());
            }
        }
        patch.setId(id);
        // 库位不能换仓
        patch.setWarehouseId(null);
        patch.setCreateTime(null);
        this.updateById(patch);
        if (patch.getStatus() != null && !patch.getStatus().isManual()) {
            // 解除预留或封存后按实际库存重新判断
            refreshStatus(id);
        }
        return this.getById(id);
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public void deleteLocation(Long id) {
        requireLocation(id);
        if (productStockMapper.sumQuantityByLocation(id) > 0) {
            throw BusinessException.badRequest("库位上仍有库存，无法删除");
        }
        productStockMapper.delete(new LambdaQueryWrapper<ProductStock>().eq(ProductStock::getStorageLocationId, id));
        this.removeById(id);
        log.info("删除库位 {}", id);
    }

    @Override
    public void refreshStatus(Long locationId) {
        StorageLocation location = this.getById(locationId);
        if (location == null || (location.getStatus() != null && location.getStatus().isManual())) {
            return;
        }
        LocationStatus target = productStockMapper.sumQuantityByLocation(locationId) > 0
                ? LocationStatus.OCCUPIED : LocationStatus.FREE;
        if (target != location.getStatus()) {
            this.update(new LambdaUpdateWrapper<StorageLocation>()
                    .set(StorageLocation::getStatus, target)
                    .set(StorageLocation::getUpdateTime, LocalDateTime.now())
                    .eq(StorageLocation::getId, locationId));
        }
    }

    private boolean codeTaken(Long warehouseId, String code, Long excludeId) {
        return this.count(new LambdaQueryWrapper<StorageLocation>()
                .eq(StorageLocation::getWarehouseId, warehouseId)
                .eq(StorageLocation::getCode, code)
                .ne(excludeId != null, StorageLocation::getId, excludeId)) > 0;
    }
}
