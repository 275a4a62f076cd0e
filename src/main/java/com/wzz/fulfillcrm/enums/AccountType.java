package com.wzz.fulfillcrm.enums;

import lombok.Getter;

import java.math.BigDecimal;

/**
 * 会计科目类型
 * <p>
 * 资产、费用类科目为借方余额：借增贷减；负债、收入、权益类科目为贷方余额：贷增借减。
 */
@Getter
public enum AccountType {
    ASSET("资产", NormalBalance.DEBIT),
    LIABILITY("负债", NormalBalance.CREDIT),
    EQUITY("权益", NormalBalance.CREDIT),
    REVENUE("收入", NormalBalance.CREDIT),
    EXPENSE("费用", NormalBalance.DEBIT);

    private final String description;
    private final NormalBalance normalBalance;

    AccountType(String description, NormalBalance normalBalance) {
        this.description = description;
        this.normalBalance = normalBalance;
    }

    /**
     * 该科目记入借方 amount 时的余额变动
     */
    public BigDecimal debitDelta(BigDecimal amount) {
        return normalBalance == NormalBalance.DEBIT ? amount : amount.negate();
    }

    /**
     * 该科目记入贷方 amount 时的余额变动
     */
    public BigDecimal creditDelta(BigDecimal amount) {
        return normalBalance == NormalBalance.CREDIT ? amount : amount.negate();
    }

    public enum NormalBalance {
        DEBIT,
        CREDIT
    }
}
