package com.wzz.fulfillcrm.entity;

import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableName;
import com.wzz.fulfillcrm.common.BaseEntity;
import com.wzz.fulfillcrm.enums.MeasureUnit;
import com.wzz.fulfillcrm.enums.ServiceType;
import lombok.Data;
import lombok.EqualsAndHashCode;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * 供应商服务（报价）：供应商按某计量单位提供的一项有价服务
 */
@Data
@EqualsAndHashCode(callSuper = true)
@TableName("vendor_service")
public class VendorOffer extends BaseEntity {

    /**
     * 所属供应商ID
     */
    @TableField("vendor_id")
    private Long vendorId;

    /**
     * 服务名称
     */
    @TableField("name")
    private String name;

    /**
     * 服务类型
     */
    @TableField("type")
    private ServiceType type;

    /**
     * 计量单位
     */
    @TableField("unit")
    private MeasureUnit unit;

    /**
     * 当前单价，变动时写入调价记录
     */
    @TableField("price")
    private BigDecimal price;

    @TableField("currency")
    private String currency;

    /**
     * 适用数量下限；按单计价的配送服务用作重量区间下限
     */
    @TableField("min_quantity")
    private BigDecimal minQuantity;

    /**
     * 适用数量上限；按单计价的配送服务用作重量区间上限
     */
    @TableField("max_quantity")
    private BigDecimal maxQuantity;

    @TableField("valid_from")
    private LocalDate validFrom;

    @TableField("valid_to")
    private LocalDate validTo;

    @TableField("is_active")
    private Boolean isActive;

    @TableField("notes")
    private String notes;
}
