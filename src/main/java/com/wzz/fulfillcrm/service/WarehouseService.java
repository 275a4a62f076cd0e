package com.wzz.fulfillcrm.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.wzz.fulfillcrm.dto.ResultDTO.WarehouseDetailDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.WarehouseSummaryDTO;
import com.wzz.fulfillcrm.entity.Warehouse;
import com.wzz.fulfillcrm.enums.WarehouseStatus;
import com.wzz.fulfillcrm.enums.WarehouseType;

import java.util.List;

public interface WarehouseService extends IService<Warehouse> {

    /**
     * 按名称排序，附带库位数与作业数
     */
    List<WarehouseSummaryDTO> listWarehouses(WarehouseStatus status, WarehouseType type);

    WarehouseDetailDTO getDetail(Long id);

    Warehouse requireWarehouse(Long id);

    Warehouse createWarehouse(Warehouse warehouse);

    Warehouse updateWarehouse(Long id, Warehouse patch);

    /**
     * 删除仓库及其空库位；仍有库存或作业时拒绝
     */
    void deleteWarehouse(Long id);
}
