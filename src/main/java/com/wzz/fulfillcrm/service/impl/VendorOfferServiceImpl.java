package com.wzz.fulfillcrm.service.impl;

import cn.hutool.core.util.StrUtil;
import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.wzz.fulfillcrm.common.Constants;
import com.wzz.fulfillcrm.dto.ResultDTO.VendorOfferDetailDTO;
import com.wzz.fulfillcrm.entity.CostOperation;
import com.wzz.fulfillcrm.entity.PriceHistory;
import com.wzz.fulfillcrm.entity.Vendor;
import com.wzz.fulfillcrm.entity.VendorOffer;
import com.wzz.fulfillcrm.enums.ServiceType;
import com.wzz.fulfillcrm.exception.BusinessException;
import com.wzz.fulfillcrm.mapper.CostOperationMapper;
import com.wzz.fulfillcrm.mapper.PriceHistoryMapper;
import com.wzz.fulfillcrm.mapper.VendorMapper;
import com.wzz.fulfillcrm.mapper.VendorOfferMapper;
import com.wzz.fulfillcrm.service.VendorOfferService;
import com.wzz.fulfillcrm.util.MoneyUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

@Slf4j
@Service
public class VendorOfferServiceImpl extends ServiceImpl<VendorOfferMapper, VendorOffer> implements VendorOfferService {

    @Autowired
    private VendorMapper vendorMapper;

    @Autowired
    private PriceHistoryMapper priceHistoryMapper;

    @Autowired
    private CostOperationMapper costOperationMapper;

    @Override
    public List<VendorOffer> listOffers(Long vendorId, ServiceType type, Boolean isActive) {
        return this.list(new LambdaQueryWrapper<VendorOffer>()
                .eq(vendorId != null, VendorOffer::getVendorId, vendorId)
                .eq(type != null, VendorOffer::getType, type)
                .eq(isActive != null, VendorOffer::getIsActive, isActive)
                .orderByAsc(VendorOffer::getVendorId)
                .orderByAsc(VendorOffer::getType));
    }

    @Override
    public VendorOfferDetailDTO getDetail(Long id) {
        VendorOffer offer = this.getById(id);
        if (offer == null) {
            throw BusinessException.notFound("供应商服务不存在: " + id);
        }
        Vendor vendor = vendorMapper.selectById(offer.getVendorId());
        List<PriceHistory> history = priceHistoryMapper.selectList(new LambdaQueryWrapper<PriceHistory>()
                .eq(PriceHistory::getVendorServiceId, id)
                .orderByDesc(PriceHistory::getChangedAt)
                .orderByDesc(PriceHistory::getId)
                .last("LIMIT " + Constants.PRICE_HISTORY_LIMIT));
        return new VendorOfferDetailDTO(offer, vendor, history);
    }

    @Transactional(rollbackFor = Exception.class)
    @Override
    public VendorOffer createOffer(VendorOffer offer) {
        if (offer.getVendorId() == null || vendorMapper.selectById(offer.getVendorId()) == null) {
            throw BusinessException.badRequest("供应商不存在");
        }
        if (StrUtil.isBlank(offer.getName()) || offer.getType() == null || offer.getUnit() == null) {
            throw BusinessException.badRequest("服务名称、类型、计量单位不能为空");
        }
        if (offer.getPrice() == null || offer.getPrice().signum() < 0) {
            throw BusinessException.badRequest("单价不能为空或为负");
        }
        offer.setId(null);
        offer.setPrice(MoneyUtil.money(offer.getPrice()));
        offer.setCurrency(StrUtil.blankToDefault(offer.getCurrency(), Constants.DEFAULT_CURRENCY));
        if (offer.getIsActive() == null) {
            offer.setIsActive(true);
        }
        this.save(offer);
        log.info("供应商 {} 新增服务 {}: {} {}", offer.getVendorId(), offer.getId(), offer.getName(), offer.getPrice());
        return offer;
    }

    @Transactional(rollbackFor = Exception.class)
    @Override
    public VendorOffer updateOffer(Long id, VendorOffer patch, Long operatorId) {
        VendorOffer existing = this.getById(id);
        if (existing == null) {
            throw BusinessException.notFound("供应商服务不存在: " + id);
        }
        if (patch.getPrice() != null && patch.getPrice().signum() < 0) {
            throw BusinessException.badRequest("单价不能为负");
        }

        // 价格变动时写入调价记录
        if (patch.getPrice() != null && patch.getPrice().compareTo(existing.getPrice()) != 0) {
            PriceHistory history = new PriceHistory();
            history.setVendorServiceId(id);
            history.setOldPrice(existing.getPrice());
            history.setNewPrice(MoneyUtil.money(patch.getPrice()));
            history.setChangedAt(LocalDateTime.now());
            history.setChangedBy(operatorId);
            priceHistoryMapper.insert(history);
            log.info("供应商服务 {} 调价: {} -> {}，操作人 {}", id, existing.getPrice(), history.getNewPrice(), operatorId);
        }

        patch.setId(id);
        // 所属供应商不允许通过修改接口变更
        patch.setVendorId(null);
        if (patch.getPrice() != null) {
            patch.setPrice(MoneyUtil.money(patch.getPrice()));
        }
        patch.setCreateTime(null);
        this.updateById(patch);
        return this.getById(id);
    }

    @Transactional(rollbackFor = Exception.class)
    @Override
    public void deleteOffer(Long id) {
        if (this.getById(id) == null) {
            throw BusinessException.notFound("供应商服务不存在: " + id);
        }
        Long used = costOperationMapper.selectCount(new LambdaQueryWrapper<CostOperation>()
                .eq(CostOperation::getVendorServiceId, id));
        if (used > 0) {
            throw BusinessException.badRequest("该服务已有成本记录，无法删除，请改为停用");
        }
        priceHistoryMapper.delete(new LambdaQueryWrapper<PriceHistory>().eq(PriceHistory::getVendorServiceId, id));
        this.removeById(id);
        log.info("删除供应商服务 {}", id);
    }

    @Override
    public List<VendorOffer> listActiveByType(ServiceType type) {
        return this.list(new LambdaQueryWrapper<VendorOffer>()
                .eq(VendorOffer::getType, type)
                .eq(VendorOffer::getIsActive, true)
                .orderByAsc(VendorOffer::getId));
    }
}
