package com.wzz.fulfillcrm.enums;

import lombok.Getter;

/**
 * 仓库作业类型
 */
@Getter
public enum TaskType {
    RECEIVING("收货"),
    PLACEMENT("上架"),
    PICKING("拣货"),
    PACKING("打包"),
    SHIPPING("发货"),
    INVENTORY("盘点"),
    TRANSFER("移库");

    private final String description;

    TaskType(String description) {
        this.description = description;
    }

    /**
     * 完成作业明细时生成的库存移动类型
     */
    public MovementType movementType() {
        switch (this) {
            case RECEIVING:
                return MovementType.INBOUND;
            case SHIPPING:
                return MovementType.OUTBOUND;
            case INVENTORY:
                return MovementType.ADJUSTMENT;
            default:
                return MovementType.TRANSFER;
        }
    }
}
