package com.wzz.fulfillcrm.enums;

import lombok.Getter;

/**
 * 供应商服务类型
 */
@Getter
public enum ServiceType {
    STORAGE("仓储"),
    PICKING("拣货"),
    PACKING("打包"),
    SHIPPING("配送"),
    RECEIVING("收货"),
    LABELING("贴标"),
    RETURNS("退货处理"),
    OTHER("其他");

    private final String description;

    ServiceType(String description) {
        this.description = description;
    }
}
