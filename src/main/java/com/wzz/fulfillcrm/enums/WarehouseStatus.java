package com.wzz.fulfillcrm.enums;

import lombok.Getter;

@Getter
public enum WarehouseStatus {
    ACTIVE("启用"),
    INACTIVE("停用");

    private final String description;

    WarehouseStatus(String description) {
        this.description = description;
    }
}
