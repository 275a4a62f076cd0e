package com.wzz.fulfillcrm.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import com.baomidou.mybatisplus.core.metadata.IPage;
import com.baomidou.mybatisplus.extension.plugins.pagination.Page;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.wzz.fulfillcrm.dto.CreatDTO.TransactionCreateDTO;
import com.wzz.fulfillcrm.dto.page.PageQuery;
import com.wzz.fulfillcrm.entity.Account;
import com.wzz.fulfillcrm.entity.FinTransaction;
import com.wzz.fulfillcrm.exception.BusinessException;
import com.wzz.fulfillcrm.mapper.AccountMapper;
import com.wzz.fulfillcrm.mapper.FinTransactionMapper;
import com.wzz.fulfillcrm.service.FinTransactionService;
import com.wzz.fulfillcrm.util.DateUtil;
import com.wzz.fulfillcrm.util.MoneyUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

@Slf4j
@Service
public class FinTransactionServiceImpl extends ServiceImpl<FinTransactionMapper, FinTransaction> implements FinTransactionService {

    @Autowired
    private AccountMapper accountMapper;

    @Override
    @Transactional(rollbackFor = Exception.class)
    public FinTransaction post(TransactionCreateDTO dto, Long operatorId) {
        return record(dto, operatorId, null);
    }

    /**
     * 写入分录并更新两侧科目余额，reversedTransactionId 仅冲销时传入
     */
    private FinTransaction record(TransactionCreateDTO dto, Long operatorId, Long reversedTransactionId) {
        if (dto.getAmount() == null) {
            throw BusinessException.badRequest("金额不能为空");
        }
        // 按入库精度判断，避免不足一分的金额被存成 0
        BigDecimal scaled = MoneyUtil.money(dto.getAmount());
        if (scaled.signum() <= 0) {
            throw BusinessException.badRequest("金额必须大于0");
        }
        if (dto.getDebitAccountId() == null || dto.getCreditAccountId() == null) {
            throw BusinessException.badRequest("借方与贷方科目不能为空");
        }
        if (dto.getDebitAccountId().equals(dto.getCreditAccountId())) {
            throw BusinessException.badRequest("借方与贷方科目不能相同");
        }

        // 按ID升序加锁，避免两笔方向相反的分录互相等待
        Long firstId = Math.min(dto.getDebitAccountId(), dto.getCreditAccountId());
        Long secondId = Math.max(dto.getDebitAccountId(), dto.getCreditAccountId());
        Account first = lockAccount(firstId);
        Account second = lockAccount(secondId);
        Account debit = first.getId().equals(dto.getDebitAccountId()) ? first : second;
        Account credit = debit == first ? second : first;

        FinTransaction transaction = new FinTransaction();
        transaction.setDebitAccountId(debit.getId());
        transaction.setCreditAccountId(credit.getId());
        transaction.setAmount(scaled);
        transaction.setDescription(dto.getDescription());
        transaction.setTransactionDate(dto.getTransactionDate() != null ? dto.getTransactionDate() : LocalDateTime.now());
        transaction.setCostOperationId(dto.getCostOperationId());
        transaction.setIncomeOperationId(dto.getIncomeOperationId());
        transaction.setReversedTransactionId(reversedTransactionId);
        transaction.setCreatedBy(operatorId);
        this.save(transaction);

        writeBalance(debit, MoneyUtil.nz(debit.getBalance()).add(debit.getType().debitDelta(scaled)));
        writeBalance(credit, MoneyUtil.nz(credit.getBalance()).add(credit.getType().creditDelta(scaled)));

        log.info("记账 {}: 借 {} 贷 {} 金额 {}，操作人 {}",
                transaction.getId(), debit.getCode(), credit.getCode(), scaled, operatorId);
        return transaction;
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public FinTransaction reverse(Long id, String description, Long operatorId) {
        FinTransaction original = this.getById(id);
        if (original == null) {
            throw BusinessException.notFound("分录不存在: " + id);
        }
        TransactionCreateDTO dto = new TransactionCreateDTO();
        dto.setDebitAccountId(original.getCreditAccountId());
        dto.setCreditAccountId(original.getDebitAccountId());
        dto.setAmount(original.getAmount());
        dto.setDescription(description != null && !description.isBlank()
                ? description : "Reversal of transaction #" + id);
        dto.setCostOperationId(original.getCostOperationId());
        dto.setIncomeOperationId(original.getIncomeOperationId());
        FinTransaction reversal = record(dto, operatorId, id);
        log.info("分录 {} 已冲销，冲销分录 {}", id, reversal.getId());
        return reversal;
    }

    @Override
    public IPage<FinTransaction> listTransactions(Long accountId, LocalDate dateFrom, LocalDate dateTo, PageQuery pageQuery) {
        LambdaQueryWrapper<FinTransaction> wrapper = new LambdaQueryWrapper<FinTransaction>()
                .ge(dateFrom != null, FinTransaction::getTransactionDate, DateUtil.startOfDay(dateFrom))
                .lt(dateTo != null, FinTransaction::getTransactionDate, DateUtil.startOfNextDay(dateTo));
        if (accountId != null) {
            wrapper.and(w -> w.eq(FinTransaction::getDebitAccountId, accountId)
                    .or().eq(FinTransaction::getCreditAccountId, accountId));
        }
        wrapper.orderByDesc(FinTransaction::getTransactionDate).orderByDesc(FinTransaction::getId);
        Page<FinTransaction> page = pageQuery.toPage();
        return this.page(page, wrapper);
    }

    private Account lockAccount(Long id) {
        Account account = accountMapper.selectByIdForUpdate(id);
        if (account == null) {
            throw BusinessException.notFound("科目不存在: " + id);
        }
        return account;
    }

    private void writeBalance(Account account, BigDecimal balance) {
        int rows = accountMapper.update(null, new LambdaUpdateWrapper<Account>()
                .set(Account::getBalance, MoneyUtil.money(balance))
                .set(Account::getUpdateTime, LocalDateTime.now())
                .eq(Account::getId, account.getId()));
        if (rows != 1) {
            log.error("更新科目 {} 余额失败", account.getId());
            throw new IllegalStateException("更新科目余额失败: " + account.getId());
        }
        account.setBalance(MoneyUtil.money(balance));
    }
}
