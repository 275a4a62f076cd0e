package com.wzz.fulfillcrm.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.wzz.fulfillcrm.dto.CreatDTO.AccountCreateDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.AccountDetailDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.BalanceSheetDTO;
import com.wzz.fulfillcrm.dto.update.AccountUpdateDTO;
import com.wzz.fulfillcrm.entity.Account;
import com.wzz.fulfillcrm.enums.AccountType;

import java.time.LocalDate;
import java.util.List;

/**
 * 会计科目服务，余额只能由记账分录改变
 */
public interface AccountService extends IService<Account> {

    List<Account> listAccounts(AccountType type, Boolean isActive);

    /**
     * 科目详情，附带借贷两个方向最近的分录
     */
    AccountDetailDTO getDetail(Long id);

    Account createAccount(AccountCreateDTO dto);

    /**
     * 只允许修改名称、说明与启用状态
     */
    Account updateAccount(Long id, AccountUpdateDTO dto);

    /**
     * 期间余额表：期初余额、借贷发生额、期末余额
     *
     * @param dateFrom 为空时取当月第一天
     * @param dateTo   为空时取当天，含当天
     */
    BalanceSheetDTO balanceSheet(Long id, LocalDate dateFrom, LocalDate dateTo);

    Account getByCode(String code);
}
