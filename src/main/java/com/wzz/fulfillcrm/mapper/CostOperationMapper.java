package com.wzz.fulfillcrm.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.wzz.fulfillcrm.dto.ResultDTO.VendorSpendDTO;
import com.wzz.fulfillcrm.entity.CostOperation;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.time.LocalDateTime;
import java.util.List;

@Mapper
public interface CostOperationMapper extends BaseMapper<CostOperation> {

    /**
     * 按供应商汇总成本操作次数与实际金额
     * @param from 操作时间下限（含），可为空
     * @param to   操作时间上限（不含），可为空
     */
    @Select({"<script>",
            "SELECT vendor_id, COUNT(*) AS operation_count, COALESCE(SUM(actual_amount), 0) AS total_spent",
            "FROM cost_operation",
            "<where>",
            "<if test='from != null'>AND operation_date &gt;= #{from}</if>",
            "<if test='to != null'>AND operation_date &lt; #{to}</if>",
            "</where>",
            "GROUP BY vendor_id",
            "</script>"})
    List<VendorSpendDTO> sumByVendor(@Param("from") LocalDateTime from, @Param("to") LocalDateTime to);
}
