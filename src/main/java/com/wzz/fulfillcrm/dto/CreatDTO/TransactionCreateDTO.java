package com.wzz.fulfillcrm.dto.CreatDTO;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 记账请求，金额与科目的业务校验在服务层完成
 */
@Data
public class TransactionCreateDTO {

    @NotNull(message = "借方科目不能为空")
    private Long debitAccountId;

    @NotNull(message = "贷方科目不能为空")
    private Long creditAccountId;

    @NotNull(message = "金额不能为空")
    private BigDecimal amount;

    private String description;

    @JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss")
    private LocalDateTime transactionDate;

    private Long costOperationId;

    private Long incomeOperationId;
}
