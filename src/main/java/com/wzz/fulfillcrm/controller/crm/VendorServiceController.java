package com.wzz.fulfillcrm.controller.crm;

import cn.dev33.satoken.annotation.SaCheckRole;
import cn.dev33.satoken.annotation.SaMode;
import cn.dev33.satoken.stp.StpUtil;
import com.wzz.fulfillcrm.common.Result;
import com.wzz.fulfillcrm.dto.ResultDTO.VendorOfferDetailDTO;
import com.wzz.fulfillcrm.entity.VendorOffer;
import com.wzz.fulfillcrm.enums.ServiceType;
import com.wzz.fulfillcrm.service.VendorOfferService;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 供应商服务（报价）接口
 */
@RestController
@RequestMapping("/api/vendor-services")
public class VendorServiceController {

    private final VendorOfferService vendorOfferService;

    public VendorServiceController(VendorOfferService vendorOfferService) {
        this.vendorOfferService = vendorOfferService;
    }

    @GetMapping
    public Result<List<VendorOffer>> list(@RequestParam(required = false) Long vendorId,
                                          @RequestParam(required = false) ServiceType type,
                                          @RequestParam(required = false) Boolean isActive) {
        return Result.success(vendorOfferService.listOffers(vendorId, type, isActive));
    }

    /**
     * 详情附带最近 20 条调价记录
     */
    @GetMapping("/{id}")
    public Result<VendorOfferDetailDTO> get(@PathVariable("id") Long id) {
        return Result.success(vendorOfferService.getDetail(id));
    }

    @SaCheckRole(value = {"ADMIN", "MANAGER"}, mode = SaMode.OR)
    @PostMapping
    public Result<VendorOffer> create(@RequestBody VendorOffer offer) {
        return Result.success("创建成功", vendorOfferService.createOffer(offer));
    }

    @SaCheckRole(value = {"ADMIN", "MANAGER"}, mode = SaMode.OR)
    @PutMapping("/{id}")
    public Result<VendorOffer> update(@PathVariable("id") Long id, @RequestBody VendorOffer offer) {
        return Result.success("更新成功", vendorOfferService.updateOffer(id, offer, StpUtil.getLoginIdAsLong()));
    }

    @SaCheckRole("ADMIN")
    @DeleteMapping("/{id}")
    public Result<?> delete(@PathVariable("id") Long id) {
        vendorOfferService.deleteOffer(id);
        return Result.success("删除成功", null);
    }
}
