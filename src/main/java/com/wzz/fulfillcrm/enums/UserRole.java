package com.wzz.fulfillcrm.enums;

import lombok.Getter;

/**
 * 用户角色，名称同时作为 Sa-Token 的角色标识
 */
@Getter
public enum UserRole {
    ADMIN("管理员"),
    MANAGER("经理"),
    ANALYST("分析师");

    private final String description;

    UserRole(String description) {
        this.description = description;
    }
}
