package com.wzz.fulfillcrm.service;

import com.wzz.fulfillcrm.dto.ResultDTO.ClientsReportDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.OrderPnlDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.OrdersReportDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.VendorsReportDTO;
import com.wzz.fulfillcrm.enums.OrderStatus;

import java.time.LocalDate;

/**
 * 损益报表，只读，不回写订单汇总字段
 */
public interface ReportService {

    /**
     * 单个订单损益：收入按已收金额，成本按成本操作实际金额
     */
    OrderPnlDTO getOrderPnl(String idOrNumber);

    OrdersReportDTO getOrdersReport(LocalDate dateFrom, LocalDate dateTo, Long clientId, OrderStatus status);

    /**
     * 客户报表，不含已取消和已退回的订单，按利润倒序
     */
    ClientsReportDTO getClientsReport(LocalDate dateFrom, LocalDate dateTo);

    /**
     * 供应商报表，按成本倒序
     */
    VendorsReportDTO getVendorsReport(LocalDate dateFrom, LocalDate dateTo);
}
