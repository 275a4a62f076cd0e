package com.wzz.fulfillcrm.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.wzz.fulfillcrm.dto.CreatDTO.CostOperationCreateDTO;
import com.wzz.fulfillcrm.dto.update.CostOperationUpdateDTO;
import com.wzz.fulfillcrm.entity.CostOperation;
import com.wzz.fulfillcrm.entity.VendorOffer;
import com.wzz.fulfillcrm.enums.CostOperationType;
import com.wzz.fulfillcrm.exception.BusinessException;
import com.wzz.fulfillcrm.mapper.CostOperationMapper;
import com.wzz.fulfillcrm.service.CostOperationService;
import com.wzz.fulfillcrm.service.OrderCostService;
import com.wzz.fulfillcrm.service.VendorOfferService;
import com.wzz.fulfillcrm.util.MoneyUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

@Slf4j
@Service
public class CostOperationServiceImpl extends ServiceImpl<CostOperationMapper, CostOperation> implements CostOperationService {

    @Autowired
    private OrderCostService orderCostService;

    @Autowired
    private VendorOfferService vendorOfferService;

    @Override
    public List<CostOperation> listByOrder(Long orderId) {
        return this.list(new LambdaQueryWrapper<CostOperation>()
                .eq(CostOperation::getOrderId, orderId)
                .orderByDesc(CostOperation::getOperationDate)
                .orderByDesc(CostOperation::getId));
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public CostOperation createOperation(CostOperationCreateDTO dto) {
        orderCostService.lockOrder(dto.getOrderId());

        VendorOffer offer = vendorOfferService.getById(dto.getVendorServiceId());
        if (offer == null) {
            throw BusinessException.notFound("供应商服务不存在: " + dto.getVendorServiceId());
        }

        CostOperation operation = buildCharge(dto.getOrderId(), offer, dto.getQuantity(), dto.getDescription());
        if (dto.getOperationType() != null) {
            operation.setOperationType(dto.getOperationType());
        }
        if (dto.getActualAmount() != null) {
            operation.setActualAmount(MoneyUtil.money(dto.getActualAmount()));
        }
        if (dto.getOperationDate() != null) {
            operation.setOperationDate(dto.getOperationDate());
        }
        this.save(operation);

        orderCostService.recalculate(dto.getOrderId());
        log.info("订单 {} 新增成本操作 {}: 服务 {} × {} = {}", dto.getOrderId(), operation.getId(),
                offer.getId(), operation.getQuantity(), operation.getActualAmount());
        return operation;
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public CostOperation updateOperation(Long id, CostOperationUpdateDTO dto) {
        CostOperation existing = this.getById(id);
        if (existing == null) {
            throw BusinessException.notFound("成本操作不存在: " + id);
        }
        orderCostService.lockOrder(existing.getOrderId());

        CostOperation patch = new CostOperation();
        patch.setId(id);
        patch.setOperationType(dto.getOperationType());
        patch.setDescription(dto.getDescription());
        if (dto.getQuantity() != null) {
            // 数量变化时按快照单价重算
            patch.setQuantity(MoneyUtil.quantity(dto.getQuantity()));
            patch.setCalculatedAmount(MoneyUtil.multiply(dto.getQuantity(), existing.getUnitPrice()));
        }
        if (dto.getActualAmount() != null) {
            patch.setActualAmount(MoneyUtil.money(dto.getActualAmount()));
        }
        this.updateById(patch);

        orderCostService.recalculate(existing.getOrderId());
        log.info("修改成本操作 {}，订单 {}", id, existing.getOrderId());
        return this.getById(id);
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public void deleteOperation(Long id) {
        CostOperation existing = this.getById(id);
        if (existing == null) {
            throw BusinessException.notFound("成本操作不存在: " + id);
        }
        orderCostService.lockOrder(existing.getOrderId());
        this.removeById(id);
        orderCostService.recalculate(existing.getOrderId());
        log.info("删除成本操作 {}，订单 {}", id, existing.getOrderId());
    }

    @Override
    public CostOperation buildCharge(Long orderId, VendorOffer offer, BigDecimal quantity, String description) {
        BigDecimal amount = MoneyUtil.multiply(quantity, offer.getPrice());
        CostOperation operation = new CostOperation();
        operation.setOrderId(orderId);
        operation.setVendorId(offer.getVendorId());
        operation.setVendorServiceId(offer.getId());
        operation.setOperationType(CostOperationType.CHARGE);
        operation.setQuantity(MoneyUtil.quantity(quantity));
        operation.setUnitPrice(MoneyUtil.money(offer.getPrice()));
        operation.setCalculatedAmount(amount);
        operation.setActualAmount(amount);
        operation.setDescription(description != null ? description : offer.getName());
        operation.setOperationDate(LocalDateTime.now());
        return operation;
    }
}
