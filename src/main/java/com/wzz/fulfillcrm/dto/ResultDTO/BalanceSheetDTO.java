package com.wzz.fulfillcrm.dto.ResultDTO;

import com.wzz.fulfillcrm.entity.Account;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * 科目期间余额表
 */
@Data
public class BalanceSheetDTO {

    private Account account;

    private LocalDate dateFrom;

    private LocalDate dateTo;

    private BigDecimal openingBalance;

    /**
     * 期间借方发生额
     */
    private BigDecimal debitTurnover;

    /**
     * 期间贷方发生额
     */
    private BigDecimal creditTurnover;

    private BigDecimal closingBalance;
}
