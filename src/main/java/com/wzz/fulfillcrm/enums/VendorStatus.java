package com.wzz.fulfillcrm.enums;

import lombok.Getter;

@Getter
public enum VendorStatus {
    ACTIVE("合作中"),
    INACTIVE("停用"),
    SUSPENDED("暂停");

    private final String description;

    VendorStatus(String description) {
        this.description = description;
    }
}
