package com.wzz.fulfillcrm.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.wzz.fulfillcrm.dto.ResultDTO.VendorOfferDetailDTO;
import com.wzz.fulfillcrm.entity.VendorOffer;
import com.wzz.fulfillcrm.enums.ServiceType;

import java.util.List;

/**
 * 供应商服务（报价）管理
 */
public interface VendorOfferService extends IService<VendorOffer> {

    List<VendorOffer> listOffers(Long vendorId, ServiceType type, Boolean isActive);

    /**
     * 查询报价详情，附带供应商与最近的调价记录
     */
    VendorOfferDetailDTO getDetail(Long id);

    VendorOffer createOffer(VendorOffer offer);

    /**
     * 修改报价，价格变动时追加调价记录
     *
     * @param operatorId 操作人ID，记入调价记录
     */
    VendorOffer updateOffer(Long id, VendorOffer patch, Long operatorId);

    void deleteOffer(Long id);

    /**
     * 查询指定类型的启用报价
     */
    List<VendorOffer> listActiveByType(ServiceType type);
}
