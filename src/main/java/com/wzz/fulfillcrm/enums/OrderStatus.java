package com.wzz.fulfillcrm.enums;

import lombok.Getter;

/**
 * 订单状态
 */
@Getter
public enum OrderStatus {
    NEW("新建"),
    PROCESSING("处理中"),
    PICKING("拣货中"),
    PACKED("已打包"),
    SHIPPED("已发货"),
    DELIVERED("已送达"),
    COMPLETED("已完成"),
    CANCELLED("已取消"),
    RETURNED("已退回");

    private final String description;

    OrderStatus(String description) {
        this.description = description;
    }

    /**
     * 取消和退回的订单不计入客户收益统计
     */
    public boolean isClosedWithoutRevenue() {
        return this == CANCELLED || this == RETURNED;
    }
}
