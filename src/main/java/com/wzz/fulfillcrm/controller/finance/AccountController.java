package com.wzz.fulfillcrm.controller.finance;

import cn.dev33.satoken.annotation.SaCheckRole;
import cn.dev33.satoken.annotation.SaMode;
import com.wzz.fulfillcrm.common.Result;
import com.wzz.fulfillcrm.dto.CreatDTO.AccountCreateDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.AccountDetailDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.BalanceSheetDTO;
import com.wzz.fulfillcrm.dto.update.AccountUpdateDTO;
import com.wzz.fulfillcrm.entity.Account;
import com.wzz.fulfillcrm.enums.AccountType;
import com.wzz.fulfillcrm.service.AccountService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

/**
 * 会计科目接口
 */
@RestController
@RequestMapping("/api/accounts")
public class AccountController {

    private final AccountService accountService;

    public AccountController(AccountService accountService) {
        this.accountService = accountService;
    }

    @GetMapping
    public Result<List<Account>> list(@RequestParam(required = false) AccountType type,
                                      @RequestParam(required = false) Boolean isActive) {
        return Result.success(accountService.listAccounts(type, isActive));
    }

    @GetMapping("/{id}")
    public Result<AccountDetailDTO> get(@PathVariable("id") Long id) {
        return Result.success(accountService.getDetail(id));
    }

    @SaCheckRole(value = {"ADMIN", "ANALYST"}, mode = SaMode.OR)
    @GetMapping("/{id}/balance-sheet")
    public Result<BalanceSheetDTO> balanceSheet(@PathVariable("id") Long id,
                                                @RequestParam(required = false) LocalDate dateFrom,
                                                @RequestParam(required = false) LocalDate dateTo) {
        return Result.success(accountService.balanceSheet(id, dateFrom, dateTo));
    }

    @SaCheckRole("ADMIN")
    @PostMapping
    public Result<Account> create(@Valid @RequestBody AccountCreateDTO dto) {
        return Result.success("科目已创建", accountService.createAccount(dto));
    }

    @SaCheckRole("ADMIN")
    @PutMapping("/{id}")
    public Result<Account> update(@PathVariable("id") Long id, @RequestBody AccountUpdateDTO dto) {
        return Result.success("科目已更新", accountService.updateAccount(id, dto));
    }
}
