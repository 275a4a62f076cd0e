package com.wzz.fulfillcrm.enums;

import lombok.Getter;

/**
 * 库位状态，FREE 与 OCCUPIED 随库存自动切换，RESERVED 与 BLOCKED 只能手工设置
 */
@Getter
public enum LocationStatus {
    FREE("空闲"),
    OCCUPIED("占用"),
    RESERVED("预留"),
    BLOCKED("封存");

    private final String description;

    LocationStatus(String description) {
        this.description = description;
    }

    public boolean isManual() {
        return this == RESERVED || this == BLOCKED;
    }
}
