package com.wzz.fulfillcrm.entity;

import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableName;
import com.wzz.fulfillcrm.common.BaseEntity;
import com.wzz.fulfillcrm.enums.WarehouseStatus;
import com.wzz.fulfillcrm.enums.WarehouseType;
import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * 仓库
 */
@Data
@EqualsAndHashCode(callSuper = true)
@TableName("warehouse")
public class Warehouse extends BaseEntity {

    @TableField("name")
    private String name;

    /**
     * 仓库代码，唯一
     */
    @TableField("code")
    private String code;

    @TableField("address")
    private String address;

    @TableField("type")
    private WarehouseType type;

    @TableField("status")
    private WarehouseStatus status;

    @TableField("description")
    private String description;
}
