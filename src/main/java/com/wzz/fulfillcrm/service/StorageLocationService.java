package com.wzz.fulfillcrm.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.wzz.fulfillcrm.dto.ResultDTO.LocationStockDTO;
import com.wzz.fulfillcrm.entity.StorageLocation;
import com.wzz.fulfillcrm.enums.LocationStatus;
import com.wzz.fulfillcrm.enums.LocationType;

import java.util.List;

public interface StorageLocationService extends IService<StorageLocation> {

    List<LocationStockDTO> listLocations(Long warehouseId, LocationStatus status, LocationType type, String zone);

    StorageLocation requireLocation(Long id);

    StorageLocation createLocation(Long warehouseId, StorageLocation location);

    StorageLocation updateLocation(Long id, StorageLocation patch);

    /**
     * 库位上仍有库存时拒绝删除
     */
    void deleteLocation(Long id);

    /**
     * 按在库总数切换 FREE / OCCUPIED，手工设置的 RESERVED、BLOCKED 保持不变
     */
    void refreshStatus(Long locationId);
}
