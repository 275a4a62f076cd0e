package com.wzz.fulfillcrm.controller.crm;

import cn.dev33.satoken.annotation.SaCheckRole;
import cn.dev33.satoken.annotation.SaMode;
import com.wzz.fulfillcrm.common.Result;
import com.wzz.fulfillcrm.dto.ResultDTO.VendorDetailDTO;
import com.wzz.fulfillcrm.entity.Vendor;
import com.wzz.fulfillcrm.enums.VendorStatus;
import com.wzz.fulfillcrm.service.VendorService;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 供应商接口
 */
@RestController
@RequestMapping("/api/vendors")
public class VendorController {

    private final VendorService vendorService;

    public VendorController(VendorService vendorService) {
        this.vendorService = vendorService;
    }

    @GetMapping
    public Result<List<Vendor>> list(@RequestParam(required = false) String search,
                                     @RequestParam(required = false) VendorStatus status) {
        return Result.success(vendorService.listVendors(search, status));
    }

    @GetMapping("/{id}")
    public Result<VendorDetailDTO> get(@PathVariable("id") Long id) {
        return Result.success(vendorService.getDetail(id));
    }

    @SaCheckRole(value = {"ADMIN", "MANAGER"}, mode = SaMode.OR)
    @PostMapping
    public Result<Vendor> create(@RequestBody Vendor vendor) {
        return Result.success("创建成功", vendorService.createVendor(vendor));
    }

    @SaCheckRole(value = {"ADMIN", "MANAGER"}, mode = SaMode.OR)
    @PutMapping("/{id}")
    public Result<Vendor> update(@PathVariable("id") Long id, @RequestBody Vendor vendor) {
        return Result.success("更新成功", vendorService.updateVendor(id, vendor));
    }

    @SaCheckRole("ADMIN")
    @DeleteMapping("/{id}")
    public Result<?> delete(@PathVariable("id") Long id) {
        vendorService.deleteVendor(id);
        return Result.success("删除成功", null);
    }
}
