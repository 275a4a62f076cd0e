package com.wzz.fulfillcrm.service.impl;

import cn.hutool.core.util.StrUtil;
import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.wzz.fulfillcrm.dto.ResultDTO.VendorDetailDTO;
import com.wzz.fulfillcrm.entity.CostOperation;
import com.wzz.fulfillcrm.entity.Vendor;
import com.wzz.fulfillcrm.entity.VendorOffer;
import com.wzz.fulfillcrm.enums.VendorStatus;
import com.wzz.fulfillcrm.exception.BusinessException;
import com.wzz.fulfillcrm.mapper.CostOperationMapper;
import com.wzz.fulfillcrm.mapper.VendorMapper;
import com.wzz.fulfillcrm.service.VendorOfferService;
import com.wzz.fulfillcrm.service.VendorService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Slf4j
@Service
public class VendorServiceImpl extends ServiceImpl<VendorMapper, Vendor> implements VendorService {

    @Autowired
    private VendorOfferService vendorOfferService;

    @Autowired
    private CostOperationMapper costOperationMapper;

    @Override
    public List<Vendor> listVendors(String search, VendorStatus status) {
        LambdaQueryWrapper<Vendor> wrapper = new LambdaQueryWrapper<Vendor>()
                .eq(status != null, Vendor::getStatus, status);
        if (StrUtil.isNotBlank(search)) {
            wrapper.and(w -> w.like(Vendor::getName, search)
                    .or().like(Vendor::getLegalName, search)
                    .or().like(Vendor::getInn, search));
        }
        wrapper.orderByDesc(Vendor::getCreateTime).orderByDesc(Vendor::getId);
        return this.list(wrapper);
    }

    @Override
    public VendorDetailDTO getDetail(Long id) {
        Vendor vendor = this.getById(id);
        if (vendor == null) {
            throw BusinessException.notFound("供应商不存在: " + id);
        }
        List<VendorOffer> services = vendorOfferService.listOffers(id, null, null);
        return new VendorDetailDTO(vendor, services);
    }

    @Override
    public Vendor createVendor(Vendor vendor) {
        if (StrUtil.isBlank(vendor.getName())) {
            throw BusinessException.badRequest("供应商名称不能为空");
        }
        vendor.setId(null);
        if (vendor.getStatus() == null) {
            vendor.setStatus(VendorStatus.ACTIVE);
        }
        this.save(vendor);
        log.info("新增供应商 {}: {}", vendor.getId(), vendor.getName());
        return vendor;
    }

    @Override
    public Vendor updateVendor(Long id, Vendor patch) {
        if (this.getById(id) == null) {
            throw BusinessException.notFound("供应商不存在: " + id);
        }
        if (patch.getName() != null && StrUtil.isBlank(patch.getName())) {
            throw BusinessException.badRequest("供应商名称不能为空");
        }
        patch.setId(id);
        patch.setCreateTime(null);
        this.updateById(patch);
        return this.getById(id);
    }

    @Transactional(rollbackFor = Exception.class)
    @Override
    public void deleteVendor(Long id) {
        if (this.getById(id) == null) {
            throw BusinessException.notFound("供应商不存在: " + id);
        }
        Long operations = costOperationMapper.selectCount(new LambdaQueryWrapper<CostOperation>()
                .eq(CostOperation::getVendorId, id));
        if (operations > 0) {
            throw BusinessException.badRequest("供应商已有成本记录，无法删除，请改为停用");
        }
        vendorOfferService.listOffers(id, null, null).forEach(o -> vendorOfferService.deleteOffer(o.getId()));
        this.removeById(id);
        log.info("删除供应商 {}", id);
    }
}
