package com.wzz.fulfillcrm.entity;

import com.baomidou.mybatisplus.annotation.FieldStrategy;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableName;
import com.wzz.fulfillcrm.common.BaseEntity;
import com.wzz.fulfillcrm.enums.AccountType;
import lombok.Data;
import lombok.EqualsAndHashCode;

import java.math.BigDecimal;

/**
 * 会计科目
 */
@Data
@EqualsAndHashCode(callSuper = true)
@TableName("account")
public class Account extends BaseEntity {

    /**
     * 科目代码，唯一
     */
    @TableField("code")
    private String code;

    @TableField("name")
    private String name;

    @TableField("type")
    private AccountType type;

    /**
     * 当前余额，只能由记账分录修改
     */
    @TableField(value = "balance", updateStrategy = FieldStrategy.NEVER)
    private BigDecimal balance;

    @TableField("currency")
    private String currency;

    @TableField("description")
    private String description;

    @TableField("is_active")
    private Boolean isActive;
}
