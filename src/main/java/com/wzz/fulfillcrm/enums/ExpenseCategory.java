package com.wzz.fulfillcrm.enums;

import lombok.Getter;

/**
 * 订单费用类别
 */
@Getter
public enum ExpenseCategory {
    PACKAGING("Packaging", "包装"),
    LABOR("Labor", "人工"),
    RENT("Rent", "租金"),
    LOGISTICS("Logistics", "物流"),
    MATERIALS("Materials", "物料"),
    OTHER("Other", "其他");

    private final String displayName;
    private final String description;

    ExpenseCategory(String displayName, String description) {
        this.displayName = displayName;
        this.description = description;
    }
}
