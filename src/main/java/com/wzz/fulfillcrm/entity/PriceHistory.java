package com.wzz.fulfillcrm.entity;

import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableName;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.wzz.fulfillcrm.common.BaseEntity;
import lombok.Data;
import lombok.EqualsAndHashCode;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 供应商服务调价记录
 */
@Data
@EqualsAndHashCode(callSuper = true)
@TableName("price_history")
public class PriceHistory extends BaseEntity {

    @TableField("vendor_service_id")
    private Long vendorServiceId;

    @TableField("old_price")
    private BigDecimal oldPrice;

    @TableField("new_price")
    private BigDecimal newPrice;

    @TableField("changed_at")
    @JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss")
    private LocalDateTime changedAt;

    /**
     * 操作人用户ID
     */
    @TableField("changed_by")
    private Long changedBy;
}
