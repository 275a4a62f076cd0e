package com.wzz.fulfillcrm.enums;

import lombok.Getter;

/**
 * 费用状态
 */
@Getter
public enum ExpenseStatus {
    PLANNED("计划"),
    CONFIRMED("已确认"),
    PAID("已支付"),
    CANCELLED("已取消");

    private final String description;

    ExpenseStatus(String description) {
        this.description = description;
    }
}
