package com.wzz.fulfillcrm.util;

import com.wzz.fulfillcrm.common.Constants;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * 金额计算工具类，统一保留两位小数、四舍五入
 */
public final class MoneyUtil {

    private MoneyUtil() {
        // 防止实例化
    }

    /**
     * null 视为 0
     */
    public static BigDecimal nz(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }

    public static BigDecimal money(BigDecimal value) {
        return nz(value).setScale(Constants.MONEY_SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal quantity(BigDecimal value) {
        return nz(value).setScale(Constants.QUANTITY_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * 数量 × 单价，保留两位小数
     */
    public static BigDecimal multiply(BigDecimal quantity, BigDecimal unitPrice) {
        return money(nz(quantity).multiply(nz(unitPrice)));
    }

    /**
     * part / whole × 100，whole 不大于 0 时返回 0
     */
    public static BigDecimal percent(BigDecimal part, BigDecimal whole) {
        if (whole == null || whole.signum() <= 0) {
            return BigDecimal.ZERO.setScale(Constants.MONEY_SCALE);
        }
        return nz(part).multiply(Constants.HUNDRED)
                .divide(whole, Constants.MONEY_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * 按件均摊，件数为 0 时返回 0
     */
    public static BigDecimal perUnit(BigDecimal total, long units) {
        if (units <= 0) {
            return BigDecimal.ZERO.setScale(Constants.MONEY_SCALE);
        }
        return nz(total).divide(BigDecimal.valueOf(units), Constants.MONEY_SCALE, RoundingMode.HALF_UP);
    }
}
