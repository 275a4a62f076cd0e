package com.wzz.fulfillcrm.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.wzz.fulfillcrm.dto.ResultDTO.VendorDetailDTO;
import com.wzz.fulfillcrm.entity.Vendor;
import com.wzz.fulfillcrm.enums.VendorStatus;

import java.util.List;

public interface VendorService extends IService<Vendor> {

    /**
     * 按名称、法定名称、税号模糊查询
     */
    List<Vendor> listVendors(String search, VendorStatus status);

    VendorDetailDTO getDetail(Long id);

    Vendor createVendor(Vendor vendor);

    Vendor updateVendor(Long id, Vendor patch);

    /**
     * 删除供应商及其服务，存在成本记录时拒绝
     */
    void deleteVendor(Long id);
}
