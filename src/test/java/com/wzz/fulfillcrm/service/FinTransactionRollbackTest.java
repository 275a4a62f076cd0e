package com.wzz.fulfillcrm.service;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.wzz.fulfillcrm.dto.CreatDTO.AccountCreateDTO;
import com.wzz.fulfillcrm.dto.CreatDTO.TransactionCreateDTO;
import com.wzz.fulfillcrm.entity.Account;
import com.wzz.fulfillcrm.entity.FinTransaction;
import com.wzz.fulfillcrm.enums.AccountType;
import com.wzz.fulfillcrm.mapper.AccountMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mybatis.spring.SqlSessionTemplate;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.SpyBean;

import java.math.BigDecimal;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;

/**
 * 记账中途失败时整笔回滚；不继承集成测试基类，每一步都真实提交
 */
@SpringBootTest
class FinTransactionRollbackTest {

    @SpyBean
    private AccountMapper accountMapper;

    @Autowired
    private SqlSessionTemplate sqlSessionTemplate;

    @Autowired
    private AccountService accountService;

    @Autowired
    private FinTransactionService finTransactionService;

    private Account cash;
    private Account revenue;

    @BeforeEach
    void setUp() {
        cash = account("T-RB1", "Rollback cash", AccountType.ASSET);
        revenue = account("T-RB2", "Rollback revenue", AccountType.REVENUE);
    }

    @AfterEach
    void tearDown() {
        finTransactionService.remove(forAccounts());
        accountService.removeById(cash.getId());
        accountService.removeById(revenue.getId());
    }

    private Account account(String code, String name, AccountType type) {
        AccountCreateDTO dto = new AccountCreateDTO();
        dto.setCode(code);
        dto.setName(name);
        dto.setType(type);
        return accountService.createAccount(dto);
    }

    private LambdaQueryWrapper<FinTransaction> forAccounts() {
        return new LambdaQueryWrapper<FinTransaction>()
                .in(FinTransaction::getDebitAccountId, cash.getId(), revenue.getId())
                .or().in(FinTransaction::getCreditAccountId, cash.getId(), revenue.getId());
    }

    @Test
    void failedSecondBalanceWriteRollsBackWholePosting() {
        // 真实 mapper 与 Spring 事务绑定，第一次余额写入照常执行，第二次抛错
        AccountMapper realMapper = sqlSessionTemplate.getMapper(AccountMapper.class);
        AtomicInteger updates = new AtomicInteger();
        doAnswer(invocation -> {
            if (updates.incrementAndGet() == 2) {
                throw new IllegalStateException("贷方余额写入失败");
            }
            return realMapper.update(invocation.getArgument(0), invocation.getArgument(1));
        }).when(accountMapper).update(any(), any());

        TransactionCreateDTO dto = new TransactionCreateDTO();
        dto.setDebitAccountId(cash.getId());
        dto.setCreditAccountId(revenue.getId());
        dto.setAmount(new BigDecimal("250"));
        dto.setDescription("Should not persist");

        assertThatThrownBy(() -> finTransactionService.post(dto, null))
                .isInstanceOf(IllegalStateException.class);

        assertThat(updates.get()).isEqualTo(2);
        assertThat(finTransactionService.count(forAccounts())).isZero();
        assertThat(accountService.getById(cash.getId()).getBalance()).isEqualByComparingTo("0");
        assertThat(accountService.getById(revenue.getId()).getBalance()).isEqualByComparingTo("0");
    }
}
