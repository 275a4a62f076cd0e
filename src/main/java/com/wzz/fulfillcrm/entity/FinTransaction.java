package com.wzz.fulfillcrm.entity;

import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableName;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.wzz.fulfillcrm.common.BaseEntity;
import lombok.Data;
import lombok.EqualsAndHashCode;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 记账分录，写入后不可修改或删除，冲销通过追加反向分录完成
 */
@Data
@EqualsAndHashCode(callSuper = true)
@TableName("fin_transaction")
public class FinTransaction extends BaseEntity {

    /**
     * 借方科目ID
     */
    @TableField("debit_account_id")
    private Long debitAccountId;

    /**
     * 贷方科目ID
     */
    @TableField("credit_account_id")
    private Long creditAccountId;

    /**
     * 金额，必须为正
     */
    @TableField("amount")
    private BigDecimal amount;

    @TableField("cost_operation_id")
    private Long costOperationId;

    @TableField("income_operation_id")
    private Long incomeOperationId;

    /**
     * 被冲销的原分录ID，仅冲销分录有值
     */
    @TableField("reversed_transaction_id")
    private Long reversedTransactionId;

    @TableField("description")
    private String description;

    @TableField("transaction_date")
    @JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss")
    private LocalDateTime transactionDate;

    /**
     * 记账人用户ID
     */
    @TableField("created_by")
    private Long createdBy;
}
