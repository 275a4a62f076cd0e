package com.wzz.fulfillcrm.service;

import com.wzz.fulfillcrm.dto.ResultDTO.ClientReportRowDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.OrderReportRowDTO;
import com.wzz.fulfillcrm.enums.OrderStatus;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;

class ReportExportServiceTest {

    private final ReportExportService exportService = new ReportExportService();

    @Test
    void ordersCsvHasHeaderAndOneLinePerRow() {
        OrderReportRowDTO row = new OrderReportRowDTO();
        row.setOrderNumber("ORD-250101-ABC123");
        row.setOrderDate("2025-01-01");
        row.setStatus(OrderStatus.NEW);
        row.setClientName("Acme, Inc.");
        row.setClientCompany("");
        row.setManager("Ivan Petrov");
        row.setItemsCount(3);
        row.setTotalWeight(new BigDecimal("1.500"));
        row.setRevenue(new BigDecimal("1000.00"));
        row.setTotalCost(new BigDecimal("300.00"));
        row.setProfit(new BigDecimal("700.00"));
        row.setMarginPercent(new BigDecimal("70.00"));

        String csv = exportService.ordersCsv(Collections.singletonList(row));
        String[] lines = csv.split("\r\n");

        assertThat(lines).hasSize(2);
        assertThat(lines[0]).startsWith("orderNumber,orderDate,status,clientName");
        // 含逗号的字段需要加引号
        assertThat(lines[1]).startsWith("ORD-250101-ABC123,2025-01-01,NEW,\"Acme, Inc.\",,Ivan Petrov,3,1.500,1000.00");
        assertThat(lines[1]).endsWith("300.00,700.00,70.00");
    }

    @Test
    void clientsCsvWithoutRowsHasOnlyHeader() {
        String csv = exportService.clientsCsv(Collections.<ClientReportRowDTO>emptyList());

        assertThat(csv.trim()).isEqualTo("id,name,companyName,email,phone,isActive,ordersCount,revenue,cost,profit,marginPercent");
    }
}
