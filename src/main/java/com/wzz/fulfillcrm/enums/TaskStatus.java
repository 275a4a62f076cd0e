package com.wzz.fulfillcrm.enums;

import lombok.Getter;

/**
 * 仓库作业状态：NEW → IN_PROGRESS → COMPLETED，未完成前可取消
 */
@Getter
public enum TaskStatus {
    NEW("新建"),
    IN_PROGRESS("进行中"),
    COMPLETED("已完成"),
    CANCELLED("已取消");

    private final String description;

    TaskStatus(String description) {
        this.description = description;
    }

    public boolean isFinished() {
        return this == COMPLETED || this == CANCELLED;
    }

    public boolean canTransitionTo(TaskStatus target) {
        if (target == null || target == this) {
            return target != null;
        }
        switch (this) {
            case NEW:
                return target == IN_PROGRESS || target == CANCELLED;
            case IN_PROGRESS:
                return target == COMPLETED || target == CANCELLED;
            default:
                return false;
        }
    }
}
