package com.wzz.fulfillcrm.enums;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class AccountTypeTest {

    private static final BigDecimal AMOUNT = new BigDecimal("500");

    @Test
    void debitIncreasesAssetAndExpense() {
        assertThat(AccountType.ASSET.debitDelta(AMOUNT)).isEqualByComparingTo("500");
        assertThat(AccountType.EXPENSE.debitDelta(AMOUNT)).isEqualByComparingTo("500");
        assertThat(AccountType.LIABILITY.debitDelta(AMOUNT)).isEqualByComparingTo("-500");
        assertThat(AccountType.REVENUE.debitDelta(AMOUNT)).isEqualByComparingTo("-500");
        assertThat(AccountType.EQUITY.debitDelta(AMOUNT)).isEqualByComparingTo("-500");
    }

    @Test
    void creditIncreasesLiabilityRevenueAndEquity() {
        assertThat(AccountType.LIABILITY.creditDelta(AMOUNT)).isEqualByComparingTo("500");
        assertThat(AccountType.REVENUE.creditDelta(AMOUNT)).isEqualByComparingTo("500");
        assertThat(AccountType.EQUITY.creditDelta(AMOUNT)).isEqualByComparingTo("500");
        assertThat(AccountType.ASSET.creditDelta(AMOUNT)).isEqualByComparingTo("-500");
        assertThat(AccountType.EXPENSE.creditDelta(AMOUNT)).isEqualByComparingTo("-500");
    }

    /**
     * 借方视角：借方科目按借方余额方向计正，贷方科目按贷方余额方向计负，两者相加为 0
     */
    @Test
    void debitSideViewOfEveryPostingSumsToZero() {
        for (AccountType debit : AccountType.values()) {
            for (AccountType credit : AccountType.values()) {
                BigDecimal debitView = debit.getNormalBalance() == AccountType.NormalBalance.DEBIT
                        ? debit.debitDelta(AMOUNT) : debit.debitDelta(AMOUNT).negate();
                BigDecimal creditView = credit.getNormalBalance() == AccountType.NormalBalance.DEBIT
                        ? credit.creditDelta(AMOUNT) : credit.creditDelta(AMOUNT).negate();
                assertThat(debitView.add(creditView)).isEqualByComparingTo("0");
            }
        }
    }
}
