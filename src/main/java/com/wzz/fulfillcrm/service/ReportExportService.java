package com.wzz.fulfillcrm.service;

import com.wzz.fulfillcrm.dto.ResultDTO.ClientReportRowDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.OrderReportRowDTO;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * 报表 CSV 导出
 */
@Service
public class ReportExportService {

    private static final String[] ORDER_HEADERS = {
            "orderNumber", "orderDate", "status", "clientName", "clientCompany", "manager",
            "itemsCount", "totalWeight", "revenue", "storageCost", "pickingCost", "packingCost",
            "shippingCost", "otherCost", "totalCost", "profit", "marginPercent"
    };

    private static final String[] CLIENT_HEADERS = {
            "id", "name", "companyName", "email", "phone", "isActive",
            "ordersCount", "revenue", "cost", "profit", "marginPercent"
    };

    public String ordersCsv(List<OrderReportRowDTO> rows) {
        StringWriter out = new StringWriter();
        try (CSVPrinter printer = new CSVPrinter(out, CSVFormat.DEFAULT.builder().setHeader(ORDER_HEADERS).build())) {
            for (OrderReportRowDTO r : rows) {
                printer.printRecord(
                        r.getOrderNumber(), r.getOrderDate(), r.getStatus(), r.getClientName(), r.getClientCompany(),
                        r.getManager(), r.getItemsCount(), r.getTotalWeight(), r.getRevenue(), r.getStorageCost(),
                        r.getPickingCost(), r.getPackingCost(), r.getShippingCost(), r.getOtherCost(),
                        r.getTotalCost(), r.getProfit(), r.getMarginPercent());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("订单报表导出失败", e);
        }
        return out.toString();
    }

    public String clientsCsv(List<ClientReportRowDTO> rows) {
        StringWriter out = new StringWriter();
        try (CSVPrinter printer = new CSVPrinter(out, CSVFormat.DEFAULT.builder().setHeader(CLIENT_HEADERS).build())) {
            for (ClientReportRowDTO r : rows) {
                printer.printRecord(
                        r.getId(), r.getName(), r.getCompanyName(), r.getEmail(), r.getPhone(), r.getIsActive(),
                        r.getOrdersCount(), r.getRevenue(), r.getCost(), r.getProfit(), r.getMarginPercent());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("客户报表导出失败", e);
        }
        return out.toString();
    }
}
