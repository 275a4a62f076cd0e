package com.wzz.fulfillcrm.enums;

import lombok.Getter;

/**
 * 库位类型
 */
@Getter
public enum LocationType {
    SHELF("货架格"),
    PALLET("托盘位"),
    BOX("箱位"),
    FLOOR("地堆"),
    RACK("货架");

    private final String description;

    LocationType(String description) {
        this.description = description;
    }
}
