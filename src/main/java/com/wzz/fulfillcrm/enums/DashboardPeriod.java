package com.wzz.fulfillcrm.enums;

import java.time.LocalDateTime;
import java.util.Locale;

/**
 * 看板统计周期，起点由当前时间向前推算
 */
public enum DashboardPeriod {
    DAY,
    WEEK,
    MONTH,
    QUARTER,
    YEAR;

    public LocalDateTime startFrom(LocalDateTime now) {
        switch (this) {
            case DAY:
                return now.toLocalDate().atStartOfDay();
            case WEEK:
                return now.minusDays(7);
            case QUARTER:
                return now.minusMonths(3);
            case YEAR:
                return now.minusYears(1);
            default:
                return now.minusMonths(1);
        }
    }

    /**
     * 不区分大小写解析，空值或无法识别时取 MONTH
     */
    public static DashboardPeriod parse(String value) {
        if (value == null || value.isBlank()) {
            return MONTH;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return MONTH;
        }
    }
}
