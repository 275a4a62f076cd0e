package com.wzz.fulfillcrm.enums;

import lombok.Getter;

/**
 * 计量单位
 */
@Getter
public enum MeasureUnit {
    PIECE("件"),
    KG("千克"),
    CUBIC_METER("立方米"),
    ORDER("单"),
    PALLET("托盘"),
    DAY("天"),
    MONTH("月");

    private final String description;

    MeasureUnit(String description) {
        this.description = description;
    }
}
