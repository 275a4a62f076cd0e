package com.wzz.fulfillcrm.enums;

import lombok.Getter;

@Getter
public enum WarehouseType {
    MAIN("主仓"),
    RETURNS("退货仓"),
    QUARANTINE("隔离仓");

    private final String description;

    WarehouseType(String description) {
        this.description = description;
    }
}
