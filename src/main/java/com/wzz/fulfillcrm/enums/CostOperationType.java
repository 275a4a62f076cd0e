package com.wzz.fulfillcrm.enums;

import lombok.Getter;

/**
 * 成本操作类型
 */
@Getter
public enum CostOperationType {
    /**
     * 供应商计费
     */
    CHARGE("计费"),
    /**
     * 供应商退款
     */
    REFUND("退款"),
    /**
     * 调整
     */
    ADJUSTMENT("调整");

    private final String description;

    CostOperationType(String description) {
        this.description = description;
    }
}
