package com.wzz.fulfillcrm.entity;

import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableName;
import com.wzz.fulfillcrm.common.BaseEntity;
import com.wzz.fulfillcrm.enums.LocationStatus;
import com.wzz.fulfillcrm.enums.LocationType;
import lombok.Data;
import lombok.EqualsAndHashCode;

import java.math.BigDecimal;

/**
 * 库位，代码在同一仓库内唯一
 */
@Data
@EqualsAndHashCode(callSuper = true)
@TableName("storage_location")
public class StorageLocation extends BaseEntity {

    @TableField("warehouse_id")
    private Long warehouseId;

    @TableField("code")
    private String code;

    @TableField("name")
    private String name;

    @TableField("type")
    private LocationType type;

    @TableField("status")
    private LocationStatus status;

    /**
     * 尺寸，单位 cm
     */
    @TableField("length")
    private BigDecimal length;

    @TableField("width")
    private BigDecimal width;

    @TableField("height")
    private BigDecimal height;

    @TableField("max_volume")
    private BigDecimal maxVolume;

    @TableField("max_weight")
    private BigDecimal maxWeight;

    @TableField("zone")
    private String zone;

    @TableField("row_no")
    private Integer rowNo;

    @TableField("level_no")
    private Integer levelNo;
}
