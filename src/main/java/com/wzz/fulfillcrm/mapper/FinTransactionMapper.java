package com.wzz.fulfillcrm.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.wzz.fulfillcrm.entity.FinTransaction;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Mapper
public interface FinTransactionMapper extends BaseMapper<FinTransaction> {

    /**
     * 统计科目在 [from, to) 区间的借方发生额
     */
    @Select("SELECT COALESCE(SUM(amount), 0) FROM fin_transaction " +
            "WHERE debit_account_id = #{accountId} AND transaction_date >= #{from} AND transaction_date < #{to}")
    BigDecimal sumDebit(@Param("accountId") Long accountId,
                        @Param("from") LocalDateTime from,
                        @Param("to") LocalDateTime to);

    /**
     * 统计科目在 [from, to) 区间的贷方发生额
     */
    @Select("SELECT COALESCE(SUM(amount), 0) FROM fin_transaction " +
            "WHERE credit_account_id = #{accountId} AND transaction_date >= #{from} AND transaction_date < #{to}")
    BigDecimal sumCredit(@Param("accountId") Long accountId,
                         @Param("from") LocalDateTime from,
                         @Param("to") LocalDateTime to);

    /**
     * 统计科目在 from 之后（含）的借方发生额
     */
    @Select("SELECT COALESCE(SUM(amount), 0) FROM fin_transaction " +
            "WHERE debit_account_id = #{accountId} AND transaction_date >= #{from}")
    BigDecimal sumDebitSince(@Param("accountId") Long accountId, @Param("from") LocalDateTime from);

    /**
     * 统计科目在 from 之后（含）的贷方发生额
     */
    @Select("SELECT COALESCE(SUM(amount), 0) FROM fin_transaction " +
            "WHERE credit_account_id = #{accountId} AND transaction_date >= #{from}")
    BigDecimal sumCreditSince(@Param("accountId") Long accountId, @Param("from") LocalDateTime from);
}
