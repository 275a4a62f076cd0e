package com.wzz.fulfillcrm.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.wzz.fulfillcrm.dto.CreatDTO.IncomeOperationCreateDTO;
import com.wzz.fulfillcrm.dto.CreatDTO.PaymentDTO;
import com.wzz.fulfillcrm.dto.update.IncomeOperationUpdateDTO;
import com.wzz.fulfillcrm.entity.IncomeOperation;

import java.util.List;

/**
 * 订单收入（开票与收款），不参与订单成本重算
 */
public interface IncomeOperationService extends IService<IncomeOperation> {

    List<IncomeOperation> listByOrder(Long orderId);

    IncomeOperation createInvoice(IncomeOperationCreateDTO dto);

    /**
     * 登记收款，累加到已收金额
     */
    IncomeOperation recordPayment(Long id, PaymentDTO dto);

    IncomeOperation updateOperation(Long id, IncomeOperationUpdateDTO dto);

    void deleteOperation(Long id);
}
