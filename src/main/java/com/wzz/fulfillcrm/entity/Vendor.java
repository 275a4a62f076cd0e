package com.wzz.fulfillcrm.entity;

import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableName;
import com.wzz.fulfillcrm.common.BaseEntity;
import com.wzz.fulfillcrm.enums.VendorStatus;
import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * 供应商
 */
@Data
@EqualsAndHashCode(callSuper = true)
@TableName("vendor")
public class Vendor extends BaseEntity {

    @TableField("name")
    private String name;

    /**
     * 法定名称
     */
    @TableField("legal_name")
    private String legalName;

    @TableField("inn")
    private String inn;

    @TableField("address")
    private String address;

    @TableField("contact_name")
    private String contactName;

    @TableField("contact_phone")
    private String contactPhone;

    @TableField("contact_email")
    private String contactEmail;

    @TableField("status")
    private VendorStatus status;

    @TableField("notes")
    private String notes;
}
