package com.wzz.fulfillcrm.controller.report;

import com.wzz.fulfillcrm.common.Result;
import com.wzz.fulfillcrm.dto.ResultDTO.CostShareDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.DashboardKpiDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.RevenuePointDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.StatusCountDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.TopClientDTO;
import com.wzz.fulfillcrm.enums.DashboardPeriod;
import com.wzz.fulfillcrm.service.DashboardService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 首页看板，period 取 day/week/month/quarter/year，默认 month
 */
@RestController
@RequestMapping("/api/dashboard")
public class DashboardController {

    private final DashboardService dashboardService;

    public DashboardController(DashboardService dashboardService) {
        this.dashboardService = dashboardService;
    }

    @GetMapping("/kpi")
    public Result<DashboardKpiDTO> kpi(@RequestParam(required = false) String period) {
        return Result.success(dashboardService.kpi(DashboardPeriod.parse(period)));
    }

    @GetMapping("/chart/revenue")
    public Result<List<RevenuePointDTO>> revenue(@RequestParam(required = false) String period,
                                                 @RequestParam(defaultValue = "day") String groupBy) {
        return Result.success(dashboardService.revenueChart(DashboardPeriod.parse(period), groupBy));
    }

    @GetMapping("/chart/costs")
    public Result<List<CostShareDTO>> costs(@RequestParam(required = false) String period) {
        return Result.success(dashboardService.costBreakdown(DashboardPeriod.parse(period)));
    }

    @GetMapping("/top-clients")
    public Result<List<TopClientDTO>> topClients(@RequestParam(required = false) String period,
                                                 @RequestParam(defaultValue = "5") int limit) {
        return Result.success(dashboardService.topClients(DashboardPeriod.parse(period), limit));
    }

    @GetMapping("/orders-by-status")
    public Result<List<StatusCountDTO>> ordersByStatus() {
        return Result.success(dashboardService.ordersByStatus());
    }
}
