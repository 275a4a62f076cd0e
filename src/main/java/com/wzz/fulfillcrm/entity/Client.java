package com.wzz.fulfillcrm.entity;

import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableName;
import com.wzz.fulfillcrm.common.BaseEntity;
import lombok.Data;
import lombok.EqualsAndHashCode;

import java.math.BigDecimal;

/**
 * 客户
 */
@Data
@EqualsAndHashCode(callSuper = true)
@TableName("client")
public class Client extends BaseEntity {

    @TableField("name")
    private String name;

    @TableField("company_name")
    private String companyName;

    /**
     * 纳税人识别号
     */
    @TableField("inn")
    private String inn;

    @TableField("email")
    private String email;

    @TableField("phone")
    private String phone;

    @TableField("address")
    private String address;

    /**
     * 费率系数，新建订单未给出收入时按 预估成本 × 费率 计算
     */
    @TableField("tariff_rate")
    private BigDecimal tariffRate;

    @TableField("notes")
    private String notes;

    @TableField("is_active")
    private Boolean isActive;
}
