package com.wzz.fulfillcrm.service;

import com.wzz.fulfillcrm.dto.CreatDTO.AccountCreateDTO;
import com.wzz.fulfillcrm.dto.CreatDTO.TransactionCreateDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.BalanceSheetDTO;
import com.wzz.fulfillcrm.entity.Account;
import com.wzz.fulfillcrm.entity.FinTransaction;
import com.wzz.fulfillcrm.enums.AccountType;
import com.wzz.fulfillcrm.exception.BusinessException;
import com.wzz.fulfillcrm.support.BaseIntegrationTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FinTransactionServiceTest extends BaseIntegrationTest {

    @Autowired
    private AccountService accountService;

    @Autowired
    private FinTransactionService finTransactionService;

    private Account cash;
    private Account revenue;

    @BeforeEach
    void setUp() {
        cash = account("T-A1", "Test cash", AccountType.ASSET);
        revenue = account("T-R1", "Test revenue", AccountType.REVENUE);
    }

    private Account account(String code, String name, AccountType type) {
        AccountCreateDTO dto = new AccountCreateDTO();
        dto.setCode(code);
        dto.setName(name);
        dto.setType(type);
        return accountService.createAccount(dto);
    }

    private TransactionCreateDTO posting(Long debitId, Long creditId, String amount) {
        TransactionCreateDTO dto = new TransactionCreateDTO();
        dto.setDebitAccountId(debitId);
        dto.setCreditAccountId(creditId);
        dto.setAmount(new BigDecimal(amount));
        dto.setDescription("Sale");
        return dto;
    }

    private BigDecimal balanceOf(Account account) {
        return accountService.getById(account.getId()).getBalance();
    }

    @Test
    void postingIncreasesBothNormalBalances() {
        FinTransaction tx = finTransactionService.post(posting(cash.getId(), revenue.getId(), "500"), adminId());

        assertThat(tx.getId()).isNotNull();
        assertThat(tx.getAmount()).isEqualByComparingTo("500.00");
        assertThat(balanceOf(cash)).isEqualByComparingTo("500");
        assertThat(balanceOf(revenue)).isEqualByComparingTo("500");
    }

    @Test
    void reversalRestoresBalancesAndLinksOriginal() {
        FinTransaction tx = finTransactionService.post(posting(cash.getId(), revenue.getId(), "500"), adminId());

        FinTransaction reversal = finTransactionService.reverse(tx.getId(), null, adminId());

        assertThat(reversal.getDebitAccountId()).isEqualTo(revenue.getId());
        assertThat(reversal.getCreditAccountId()).isEqualTo(cash.getId());
        assertThat(reversal.getDescription()).isEqualTo("Reversal of transaction #" + tx.getId());
        assertThat(finTransactionService.getById(reversal.getId()).getReversedTransactionId()).isEqualTo(tx.getId());
        assertThat(balanceOf(cash)).isEqualByComparingTo("0");
        assertThat(balanceOf(revenue)).isEqualByComparingTo("0");
    }

    @Test
    void reversingTwiceAppliesTwoOppositePostings() {
        FinTransaction tx = finTransactionService.post(posting(cash.getId(), revenue.getId(), "500"), adminId());

        finTransactionService.reverse(tx.getId(), "first", adminId());
        finTransactionService.reverse(tx.getId(), "second", adminId());

        assertThat(balanceOf(cash)).isEqualByComparingTo("-500");
        assertThat(balanceOf(revenue)).isEqualByComparingTo("-500");
    }

    @Test
    void reversingTheReversalRestoresPostedBalances() {
        FinTransaction tx = finTransactionService.post(posting(cash.getId(), revenue.getId(), "500"), adminId());
        FinTransaction reversal = finTransactionService.reverse(tx.getId(), null, adminId());

        finTransactionService.reverse(reversal.getId(), null, adminId());

        assertThat(balanceOf(cash)).isEqualByComparingTo("500");
        assertThat(balanceOf(revenue)).isEqualByComparingTo("500");
    }

    @Test
    void nonPositiveAmountIsRejected() {
        assertThatThrownBy(() -> finTransactionService.post(posting(cash.getId(), revenue.getId(), "0"), adminId()))
                .isInstanceOf(BusinessException.class)
                .extracting("code").isEqualTo(400);
        assertThat(balanceOf(cash)).isEqualByComparingTo("0");
    }

    @Test
    void subCentAmountIsRejected() {
        assertThatThrownBy(() -> finTransactionService.post(posting(cash.getId(), revenue.getId(), "0.004"), adminId()))
                .isInstanceOf(BusinessException.class)
                .extracting("code").isEqualTo(400);
        assertThat(balanceOf(cash)).isEqualByComparingTo("0");
        assertThat(balanceOf(revenue)).isEqualByComparingTo("0");
    }

    @Test
    void sameAccountOnBothSidesIsRejected() {
        assertThatThrownBy(() -> finTransactionService.post(posting(cash.getId(), cash.getId(), "10"), adminId()))
                .isInstanceOf(BusinessException.class)
                .extracting("code").isEqualTo(400);
    }

    @Test
    void unknownAccountIsNotFound() {
        assertThatThrownBy(() -> finTransactionService.post(posting(cash.getId(), -1L, "10"), adminId()))
                .isInstanceOf(BusinessException.class)
                .extracting("code").isEqualTo(404);
    }

    @Test
    void balanceSheetSplitsOpeningTurnoverAndClosing() {
        LocalDate today = LocalDate.now();
        TransactionCreateDTO earlier = posting(cash.getId(), revenue.getId(), "300");
        earlier.setTransactionDate(today.minusDays(10).atTime(12, 0));
        finTransactionService.post(earlier, adminId());

        TransactionCreateDTO inPeriod = posting(cash.getId(), revenue.getId(), "200");
        inPeriod.setTransactionDate(today.minusDays(2).atTime(12, 0));
        finTransactionService.post(inPeriod, adminId());

        TransactionCreateDTO refund = posting(revenue.getId(), cash.getId(), "50");
        refund.setTransactionDate(today.minusDays(1).atTime(9, 0));
        finTransactionService.post(refund, adminId());

        TransactionCreateDTO later = posting(cash.getId(), revenue.getId(), "1000");
        later.setTransactionDate(LocalDateTime.now().plusDays(5));
        finTransactionService.post(later, adminId());

        BalanceSheetDTO sheet = accountService.balanceSheet(cash.getId(), today.minusDays(5), today);

        assertThat(sheet.getOpeningBalance()).isEqualByComparingTo("300");
        assertThat(sheet.getDebitTurnover()).isEqualByComparingTo("200");
        assertThat(sheet.getCreditTurnover()).isEqualByComparingTo("50");
        assertThat(sheet.getClosingBalance()).isEqualByComparingTo("450");
        assertThat(balanceOf(cash)).isEqualByComparingTo("1450");
    }

    @Test
    void balanceSheetRejectsReversedPeriod() {
        LocalDate today = LocalDate.now();
        assertThatThrownBy(() -> accountService.balanceSheet(cash.getId(), today, today.minusDays(1)))
                .isInstanceOf(BusinessException.class)
                .extracting("code").isEqualTo(400);
    }
}
