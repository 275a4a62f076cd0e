package com.wzz.fulfillcrm.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.wzz.fulfillcrm.dto.CreatDTO.CostOperationCreateDTO;
import com.wzz.fulfillcrm.dto.update.CostOperationUpdateDTO;
import com.wzz.fulfillcrm.entity.CostOperation;
import com.wzz.fulfillcrm.entity.VendorOffer;

import java.math.BigDecimal;
import java.util.List;

/**
 * 订单成本操作（供应商实际计费）
 * <p>
 * 每次变更都会锁定所属订单并触发成本重算。
 */
public interface CostOperationService extends IService<CostOperation> {

    List<CostOperation> listByOrder(Long orderId);

    CostOperation createOperation(CostOperationCreateDTO dto);

    CostOperation updateOperation(Long id, CostOperationUpdateDTO dto);

    void deleteOperation(Long id);

    /**
     * 按报价快照构造一条计费操作，不落库
     */
    CostOperation buildCharge(Long orderId, VendorOffer offer, BigDecimal quantity, String description);
}
