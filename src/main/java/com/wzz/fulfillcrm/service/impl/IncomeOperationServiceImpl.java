package com.wzz.fulfillcrm.service.impl;

import cn.hutool.core.util.StrUtil;
import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.wzz.fulfillcrm.common.Constants;
import com.wzz.fulfillcrm.dto.CreatDTO.IncomeOperationCreateDTO;
import com.wzz.fulfillcrm.dto.CreatDTO.PaymentDTO;
import com.wzz.fulfillcrm.dto.update.IncomeOperationUpdateDTO;
import com.wzz.fulfillcrm.entity.IncomeOperation;
import com.wzz.fulfillcrm.entity.Order;
import com.wzz.fulfillcrm.exception.BusinessException;
import com.wzz.fulfillcrm.mapper.IncomeOperationMapper;
import com.wzz.fulfillcrm.mapper.OrderMapper;
import com.wzz.fulfillcrm.service.IncomeOperationService;
import com.wzz.fulfillcrm.util.MoneyUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

@Slf4j
@Service
public class IncomeOperationServiceImpl extends ServiceImpl<IncomeOperationMapper, IncomeOperation> implements IncomeOperationService {

    @Autowired
    private OrderMapper orderMapper;

    @Override
    public List<IncomeOperation> listByOrder(Long orderId) {
        return this.list(new LambdaQueryWrapper<IncomeOperation>()
                .eq(IncomeOperation::getOrderId, orderId)
                .orderByDesc(IncomeOperation::getCreateTime)
                .orderByDesc(IncomeOperation::getId));
    }

    @Override
    public IncomeOperation createInvoice(IncomeOperationCreateDTO dto) {
        Order order = orderMapper.selectById(dto.getOrderId());
        if (order == null) {
            throw BusinessException.notFound("订单不存在: " + dto.getOrderId());
        }
        IncomeOperation operation = new IncomeOperation();
        operation.setOrderId(order.getId());
        operation.setClientId(order.getClientId());
        operation.setInvoiceAmount(MoneyUtil.money(dto.getInvoiceAmount()));
        operation.setPaidAmount(MoneyUtil.money(null));
        operation.setPaymentMethod(StrUtil.blankToDefault(dto.getPaymentMethod(), Constants.DEFAULT_PAYMENT_METHOD));
        operation.setDescription(dto.getDescription());
        this.save(operation);
        log.info("订单 {} 开票 {}: {}", order.getId(), operation.getId(), operation.getInvoiceAmount());
        return operation;
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public IncomeOperation recordPayment(Long id, PaymentDTO dto) {
        IncomeOperation existing = this.getById(id);
        if (existing == null) {
            throw BusinessException.notFound("收入记录不存在: " + id);
        }
        IncomeOperation patch = new IncomeOperation();
        patch.setId(id);
        patch.setPaidAmount(MoneyUtil.money(MoneyUtil.nz(existing.getPaidAmount()).add(dto.getAmount())));
        patch.setPaymentDate(LocalDateTime.now());
        if (StrUtil.isNotBlank(dto.getPaymentMethod())) {
            patch.setPaymentMethod(dto.getPaymentMethod());
        }
        this.updateById(patch);
        log.info("收入记录 {} 收款 {}，累计 {}", id, dto.getAmount(), patch.getPaidAmount());
        return this.getById(id);
    }

    @Override
    public IncomeOperation updateOperation(Long id, IncomeOperationUpdateDTO dto) {
        if (this.getById(id) == null) {
            throw BusinessException.notFound("收入记录不存在: " + id);
        }
        IncomeOperation patch = new IncomeOperation();
        patch.setId(id);
        if (dto.getInvoiceAmount() != null) {
            patch.setInvoiceAmount(MoneyUtil.money(dto.getInvoiceAmount()));
        }
        if (dto.getPaidAmount() != null) {
            patch.setPaidAmount(MoneyUtil.money(dto.getPaidAmount()));
        }
        patch.setPaymentMethod(dto.getPaymentMethod());
        patch.setDescription(dto.getDescription());
        this.updateById(patch);
        log.info("修改收入记录 {}", id);
        return this.getById(id);
    }

    @Override
    public void deleteOperation(Long id) {
        if (this.getById(id) == null) {
            throw BusinessException.notFound("收入记录不存在: " + id);
        }
        this.removeById(id);
        log.info("删除收入记录 {}", id);
    }
}
