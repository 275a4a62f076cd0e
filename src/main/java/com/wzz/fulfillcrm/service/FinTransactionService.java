package com.wzz.fulfillcrm.service;

import com.baomidou.mybatisplus.core.metadata.IPage;
import com.baomidou.mybatisplus.extension.service.IService;
import com.wzz.fulfillcrm.dto.CreatDTO.TransactionCreateDTO;
import com.wzz.fulfillcrm.dto.page.PageQuery;
import com.wzz.fulfillcrm.entity.FinTransaction;

import java.time.LocalDate;

/**
 * 复式记账
 * <p>
 * 每笔分录在同一事务内写入分录并更新借贷两个科目的余额。
 */
public interface FinTransactionService extends IService<FinTransaction> {

    /**
     * 记账
     *
     * @param operatorId 操作人ID，可为空
     * @throws com.wzz.fulfillcrm.exception.BusinessException 金额不为正或借贷科目相同时 400，科目不存在时 404
     */
    FinTransaction post(TransactionCreateDTO dto, Long operatorId);

    /**
     * 冲销：借贷互换、金额相同的新分录，原分录保持不变
     *
     * @param description 为空时使用默认说明
     */
    FinTransaction reverse(Long id, String description, Long operatorId);

    /**
     * 分页查询分录，按记账时间倒序；科目条件匹配借方或贷方
     */
    IPage<FinTransaction> listTransactions(Long accountId, LocalDate dateFrom, LocalDate dateTo, PageQuery pageQuery);
}
