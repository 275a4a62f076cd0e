package com.wzz.fulfillcrm.service;

import com.wzz.fulfillcrm.dto.ResultDTO.CostShareDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.DashboardKpiDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.RevenuePointDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.StatusCountDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.TopClientDTO;
import com.wzz.fulfillcrm.enums.DashboardPeriod;

import java.util.List;

/**
 * 看板统计，只读；已取消和已退回的订单不计入收入与利润
 */
public interface DashboardService {

    DashboardKpiDTO kpi(DashboardPeriod period);

    /**
     * @param groupBy day、week 或 month
     */
    List<RevenuePointDTO> revenueChart(DashboardPeriod period, String groupBy);

    /**
     * 周期内成本操作按服务类型汇总
     */
    List<CostShareDTO> costBreakdown(DashboardPeriod period);

    List<TopClientDTO> topClients(DashboardPeriod period, int limit);

    List<StatusCountDTO> ordersByStatus();
}
