package com.wzz.fulfillcrm.enums;

import lombok.Getter;

/**
 * 库存移动类型
 */
@Getter
public enum MovementType {
    INBOUND("入库"),
    OUTBOUND("出库"),
    TRANSFER("移库"),
    ADJUSTMENT("盘点调整"),
    WRITE_OFF("报损"),
    RETURN("退货入库");

    private final String description;

    MovementType(String description) {
        this.description = description;
    }
}
