package com.wzz.fulfillcrm.enums;

import lombok.Getter;

/**
 * 作业优先级，声明顺序即由低到高
 */
@Getter
public enum TaskPriority {
    LOW("低"),
    NORMAL("普通"),
    HIGH("高"),
    URGENT("紧急");

    private final String description;

    TaskPriority(String description) {
        this.description = description;
    }
}
