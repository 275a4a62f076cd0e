package com.wzz.fulfillcrm.controller.report;

import cn.dev33.satoken.annotation.SaCheckRole;
import cn.dev33.satoken.annotation.SaMode;
import com.wzz.fulfillcrm.common.Result;
import com.wzz.fulfillcrm.dto.ResultDTO.ClientsReportDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.OrderPnlDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.OrdersReportDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.VendorsReportDTO;
import com.wzz.fulfillcrm.enums.OrderStatus;
import com.wzz.fulfillcrm.service.ReportExportService;
import com.wzz.fulfillcrm.service.ReportService;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.time.LocalDate;

/**
 * 报表接口，format=csv 时以附件形式下载
 */
@RestController
@RequestMapping("/api/reports")
public class ReportController {

    private static final String CSV = "csv";
    private static final MediaType TEXT_CSV = new MediaType("text", "csv", StandardCharsets.UTF_8);

    private final ReportService reportService;
    private final ReportExportService reportExportService;

    public ReportController(ReportService reportService, ReportExportService reportExportService) {
        this.reportService = reportService;
        this.reportExportService = reportExportService;
    }

    @GetMapping("/order/{id}/pnl")
    public Result<OrderPnlDTO> orderPnl(@PathVariable("id") String idOrNumber) {
        return Result.success(reportService.getOrderPnl(idOrNumber));
    }

    @SaCheckRole(value = {"ADMIN", "ANALYST", "MANAGER"}, mode = SaMode.OR)
    @GetMapping("/orders")
    public ResponseEntity<?> orders(@RequestParam(required = false) LocalDate dateFrom,
                                    @RequestParam(required = false) LocalDate dateTo,
                                    @RequestParam(required = false) Long clientId,
                                    @RequestParam(required = false) OrderStatus status,
                                    @RequestParam(required = false) String format) {
        OrdersReportDTO report = reportService.getOrdersReport(dateFrom, dateTo, clientId, status);
        if (CSV.equalsIgnoreCase(format)) {
            return csv("orders-report.csv", reportExportService.ordersCsv(report.getOrders()));
        }
        return ResponseEntity.ok(Result.success(report));
    }

    @SaCheckRole(value = {"ADMIN", "ANALYST", "MANAGER"}, mode = SaMode.OR)
    @GetMapping("/clients")
    public ResponseEntity<?> clients(@RequestParam(required = false) LocalDate dateFrom,
                                     @RequestParam(required = false) LocalDate dateTo,
                                     @RequestParam(required = false) String format) {
        ClientsReportDTO report = reportService.getClientsReport(dateFrom, dateTo);
        if (CSV.equalsIgnoreCase(format)) {
            return csv("clients-report.csv", reportExportService.clientsCsv(report.getClients()));
        }
        return ResponseEntity.ok(Result.success(report));
    }

    @SaCheckRole(value = {"ADMIN", "ANALYST"}, mode = SaMode.OR)
    @GetMapping("/vendors")
    public Result<VendorsReportDTO> vendors(@RequestParam(required = false) LocalDate dateFrom,
                                            @RequestParam(required = false) LocalDate dateTo) {
        return Result.success(reportService.getVendorsReport(dateFrom, dateTo));
    }

    private ResponseEntity<byte[]> csv(String filename, String body) {
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=" + filename)
                .contentType(TEXT_CSV)
                .body(body.getBytes(StandardCharsets.UTF_8));
    }
}
