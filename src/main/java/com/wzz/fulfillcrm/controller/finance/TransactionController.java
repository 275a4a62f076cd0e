package com.wzz.fulfillcrm.controller.finance;

import cn.dev33.satoken.annotation.SaCheckRole;
import cn.dev33.satoken.annotation.SaMode;
import cn.dev33.satoken.stp.StpUtil;
import com.baomidou.mybatisplus.core.metadata.IPage;
import com.wzz.fulfillcrm.common.Result;
import com.wzz.fulfillcrm.dto.CreatDTO.ReverseTransactionDTO;
import com.wzz.fulfillcrm.dto.CreatDTO.TransactionCreateDTO;
import com.wzz.fulfillcrm.dto.page.PageQuery;
import com.wzz.fulfillcrm.entity.FinTransaction;
import com.wzz.fulfillcrm.service.FinTransactionService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;

/**
 * 记账分录接口
 */
@RestController
@RequestMapping("/api/transactions")
public class TransactionController {

    private final FinTransactionService finTransactionService;

    public TransactionController(FinTransactionService finTransactionService) {
        this.finTransactionService = finTransactionService;
    }

    @SaCheckRole(value = {"ADMIN", "ANALYST"}, mode = SaMode.OR)
    @GetMapping
    public Result<IPage<FinTransaction>> list(@RequestParam(required = false) Long accountId,
                                              @RequestParam(required = false) LocalDate dateFrom,
                                              @RequestParam(required = false) LocalDate dateTo,
                                              @Valid PageQuery pageQuery) {
        return Result.success(finTransactionService.listTransactions(accountId, dateFrom, dateTo, pageQuery));
    }

    @SaCheckRole("ADMIN")
    @PostMapping
    public Result<FinTransaction> post(@Valid @RequestBody TransactionCreateDTO dto) {
        return Result.success("记账成功", finTransactionService.post(dto, StpUtil.getLoginIdAsLong()));
    }

    @SaCheckRole("ADMIN")
    @PostMapping("/{id}/reverse")
    public Result<FinTransaction> reverse(@PathVariable("id") Long id,
                                          @RequestBody(required = false) ReverseTransactionDTO dto) {
        String description = dto != null ? dto.getDescription() : null;
        return Result.success("冲销成功", finTransactionService.reverse(id, description, StpUtil.getLoginIdAsLong()));
    }
}
