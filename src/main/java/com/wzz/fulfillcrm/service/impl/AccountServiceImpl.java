package com.wzz.fulfillcrm.service.impl;

import cn.hutool.core.util.StrUtil;
import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.wzz.fulfillcrm.common.Constants;
import com.wzz.fulfillcrm.dto.CreatDTO.AccountCreateDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.AccountDetailDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.BalanceSheetDTO;
import com.wzz.fulfillcrm.dto.update.AccountUpdateDTO;
import com.wzz.fulfillcrm.entity.Account;
import com.wzz.fulfillcrm.entity.FinTransaction;
import com.wzz.fulfillcrm.enums.AccountType;
import com.wzz.fulfillcrm.exception.BusinessException;
import com.wzz.fulfillcrm.mapper.AccountMapper;
import com.wzz.fulfillcrm.mapper.FinTransactionMapper;
import com.wzz.fulfillcrm.service.AccountService;
import com.wzz.fulfillcrm.util.DateUtil;
import com.wzz.fulfillcrm.util.MoneyUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

@Slf4j
@Service
public class AccountServiceImpl extends ServiceImpl<AccountMapper, Account> implements AccountService {

    @Autowired
    private FinTransactionMapper finTransactionMapper;

    @Override
    public List<Account> listAccounts(AccountType type, Boolean isActive) {
        return this.list(new LambdaQueryWrapper<Account>()
                .eq(type != null, Account::getType, type)
                .eq(isActive != null, Account::getIsActive, isActive)
                .orderByAsc(Account::getCode));
    }

    @Override
    public AccountDetailDTO getDetail(Long id) {
        Account account = requireAccount(id);
        List<FinTransaction> debit = finTransactionMapper.selectList(new LambdaQueryWrapper<FinTransaction>()
                .eq(FinTransaction::getDebitAccountId, id)
                .orderByDesc(FinTransaction::getTransactionDate)
                .orderByDesc(FinTransaction::getId)
                .last("LIMIT " + Constants.ACCOUNT_RECENT_POSTINGS));
        List<FinTransaction> credit = finTransactionMapper.selectList(new LambdaQueryWrapper<FinTransaction>()
                .eq(FinTransaction::getCreditAccountId, id)
                .orderByDesc(FinTransaction::getTransactionDate)
                .orderByDesc(FinTransaction::getId)
                .last("LIMIT " + Constants.ACCOUNT_RECENT_POSTINGS));
        return new AccountDetailDTO(account, debit, credit);
    }

    @Override
    public Account createAccount(AccountCreateDTO dto) {
        String code = dto.getCode().trim();
        if (getByCode(code) != null) {
            throw BusinessException.badRequest("科目代码已存在: " + code);
        }
        Account account = new Account();
        account.setCode(code);
        account.setName(dto.getName());
        account.setType(dto.getType());
        account.setBalance(MoneyUtil.money(null));
        account.setCurrency(StrUtil.blankToDefault(dto.getCurrency(), Constants.DEFAULT_CURRENCY));
        account.setDescription(dto.getDescription());
        account.setIsActive(true);
        this.save(account);
        log.info("新增科目 {}: {} {} ({})", account.getId(), account.getCode(), account.getName(), account.getType());
        return account;
    }

    @Override
    public Account updateAccount(Long id, AccountUpdateDTO dto) {
        requireAccount(id);
        Account patch = new Account();
        patch.setId(id);
        patch.setName(dto.getName());
        patch.setDescription(dto.getDescription());
        patch.setIsActive(dto.getIsActive());
        this.updateById(patch);
        log.info("修改科目 {}", id);
        return this.getById(id);
    }

    @Override
    public BalanceSheetDTO balanceSheet(Long id, LocalDate dateFrom, LocalDate dateTo) {
        Account account = requireAccount(id);
        LocalDate to = dateTo != null ? dateTo : LocalDate.now();
        LocalDate from = dateFrom != null ? dateFrom : to.withDayOfMonth(1);
        if (from.isAfter(to)) {
            throw BusinessException.badRequest("开始日期不能晚于结束日期");
        }
        LocalDateTime periodStart = DateUtil.startOfDay(from);
        LocalDateTime periodEnd = DateUtil.startOfNextDay(to);

        // 期末 = 当前余额 - 期末之后分录的净变动
        BigDecimal afterNet = signedNet(account.getType(),
                finTransactionMapper.sumDebitSince(id, periodEnd),
                finTransactionMapper.sumCreditSince(id, periodEnd));
        BigDecimal closing = MoneyUtil.nz(account.getBalance()).subtract(afterNet);

        BigDecimal debitTurnover = MoneyUtil.nz(finTransactionMapper.sumDebit(id, periodStart, periodEnd));
        BigDecimal creditTurnover = MoneyUtil.nz(finTransactionMapper.sumCredit(id, periodStart, periodEnd));
        BigDecimal opening = closing.subtract(signedNet(account.getType(), debitTurnover, creditTurnover));

        BalanceSheetDTO dto = new BalanceSheetDTO();
        dto.setAccount(account);
        dto.setDateFrom(from);
        dto.setDateTo(to);
        dto.setOpeningBalance(MoneyUtil.money(opening));
        dto.setDebitTurnover(MoneyUtil.money(debitTurnover));
        dto.setCreditTurnover(MoneyUtil.money(creditTurnover));
        dto.setClosingBalance(MoneyUtil.money(closing));
        return dto;
    }

    @Override
    public Account getByCode(String code) {
        return this.getOne(new LambdaQueryWrapper<Account>().eq(Account::getCode, code));
    }

    private Account requireAccount(Long id) {
        Account account = this.getById(id);
        if (account == null) {
            throw BusinessException.notFound("科目不存在: " + id);
        }
        return account;
    }

    private BigDecimal signedNet(AccountType type, BigDecimal debit, BigDecimal credit) {
        return type.debitDelta(MoneyUtil.nz(debit)).add(type.creditDelta(MoneyUtil.nz(credit)));
    }
}
