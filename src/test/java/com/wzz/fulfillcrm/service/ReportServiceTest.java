package com.wzz.fulfillcrm.service;

import com.wzz.fulfillcrm.dto.CreatDTO.CostOperationCreateDTO;
import com.wzz.fulfillcrm.dto.CreatDTO.PaymentDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.ClientReportRowDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.ClientsReportDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.OrderPnlDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.OrdersReportDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.VendorReportRowDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.VendorsReportDTO;
import com.wzz.fulfillcrm.entity.Client;
import com.wzz.fulfillcrm.entity.IncomeOperation;
import com.wzz.fulfillcrm.entity.Order;
import com.wzz.fulfillcrm.entity.Vendor;
import com.wzz.fulfillcrm.entity.VendorOffer;
import com.wzz.fulfillcrm.enums.MeasureUnit;
import com.wzz.fulfillcrm.enums.OrderStatus;
import com.wzz.fulfillcrm.enums.ServiceType;
import com.wzz.fulfillcrm.exception.BusinessException;
import com.wzz.fulfillcrm.support.BaseIntegrationTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReportServiceTest extends BaseIntegrationTest {

    @Autowired
    private ReportService reportService;

    @Autowired
    private CostOperationService costOperationService;

    @Autowired
    private IncomeOperationService incomeOperationService;

    private Client client;
    private Vendor vendor;
    private Order order;

    @BeforeEach
    void setUp() {
        client = newClient("Report Client");
        vendor = newVendor("Report Vendor");
        VendorOffer picking = newOffer(vendor.getId(), "Picking per piece", ServiceType.PICKING, MeasureUnit.PIECE, "50");
        order = newOrder(client.getId(), "1000", 4, "0", "0");

        CostOperationCreateDTO charge = new CostOperationCreateDTO();
        charge.setOrderId(order.getId());
        charge.setVendorServiceId(picking.getId());
        charge.setQuantity(new BigDecimal("4"));
        costOperationService.createOperation(charge);

        IncomeOperation invoice = incomeOperationService.listByOrder(order.getId()).get(0);
        PaymentDTO payment = new PaymentDTO();
        payment.setAmount(new BigDecimal("600"));
        incomeOperationService.recordPayment(invoice.getId(), payment);
    }

    @Test
    void orderPnlUsesPaidIncomeAndCostOperations() {
        OrderPnlDTO pnl = reportService.getOrderPnl(order.getOrderNumber());

        assertThat(pnl.getOrder().getClient()).isEqualTo("Report Client");
        assertThat(pnl.getIncome().getTotal()).isEqualByComparingTo("600");
        assertThat(pnl.getIncome().getInvoiced()).isEqualByComparingTo("1000");
        assertThat(pnl.getCosts().getTotal()).isEqualByComparingTo("200");
        assertThat(pnl.getCosts().getByType()).containsOnlyKeys(ServiceType.PICKING);
        assertThat(pnl.getCosts().getByType().get(ServiceType.PICKING).getAmount()).isEqualByComparingTo("200");
        assertThat(pnl.getPnl().getProfit()).isEqualByComparingTo("400");
        assertThat(pnl.getPnl().getMarginPercent()).isEqualByComparingTo("66.67");
        assertThat(pnl.getUnitEconomics().getTotalItems()).isEqualTo(4);
        assertThat(pnl.getUnitEconomics().getRevenuePerItem()).isEqualByComparingTo("150");
        assertThat(pnl.getUnitEconomics().getCostPerItem()).isEqualByComparingTo("50");
        assertThat(pnl.getUnitEconomics().getProfitPerItem()).isEqualByComparingTo("100");
    }

    @Test
    void orderPnlAcceptsNumericId() {
        OrderPnlDTO pnl = reportService.getOrderPnl(String.valueOf(order.getId()));

        assertThat(pnl.getOrder().getOrderNumber()).isEqualTo(order.getOrderNumber());
    }

    @Test
    void orderPnlForUnknownOrderIsNotFound() {
        assertThatThrownBy(() -> reportService.getOrderPnl("ORD-000000-NOPE00"))
                .isInstanceOf(BusinessException.class)
                .extracting("code").isEqualTo(404);
    }

    @Test
    void ordersReportBreaksCostsDownByServiceType() {
        OrdersReportDTO report = reportService.getOrdersReport(null, null, client.getId(), null);

        assertThat(report.getOrders()).hasSize(1);
        assertThat(report.getOrders().get(0).getPickingCost()).isEqualByComparingTo("200");
        assertThat(report.getOrders().get(0).getPackingCost()).isEqualByComparingTo("0");
        assertThat(report.getOrders().get(0).getItemsCount()).isEqualTo(4);
        assertThat(report.getSummary().getTotalOrders()).isEqualTo(1);
        assertThat(report.getSummary().getTotalRevenue()).isEqualByComparingTo("1000");
    }

    @Test
    void emptyOrdersReportHasZeroSummary() {
        OrdersReportDTO report = reportService.getOrdersReport(null, null, client.getId(), OrderStatus.RETURNED);

        assertThat(report.getOrders()).isEmpty();
        assertThat(report.getSummary().getTotalOrders()).isZero();
        assertThat(report.getSummary().getAverageMargin()).isEqualByComparingTo("0");
    }

    @Test
    void clientsReportSkipsCancelledOrders() {
        Client other = newClient("Cancelled Client");
        Order cancelled = newOrder(other.getId(), "300", 1, "0", "0");
        orderService.updateStatus(cancelled.getId(), OrderStatus.CANCELLED);

        ClientsReportDTO report = reportService.getClientsReport(null, null);

        List<ClientReportRowDTO> rows = report.getClients();
        ClientReportRowDTO first = rows.get(0);
        assertThat(first.getId()).isEqualTo(client.getId());
        assertThat(first.getOrdersCount()).isEqualTo(1);
        assertThat(first.getRevenue()).isEqualByComparingTo("1000");
        ClientReportRowDTO otherRow = rows.stream().filter(r -> r.getId().equals(other.getId())).findFirst().orElseThrow();
        assertThat(otherRow.getOrdersCount()).isZero();
        assertThat(otherRow.getRevenue()).isEqualByComparingTo("0");
    }

    @Test
    void vendorsReportSumsCostOperations() {
        VendorsReportDTO report = reportService.getVendorsReport(null, null);

        VendorReportRowDTO row = report.getVendors().stream()
                .filter(r -> r.getId().equals(vendor.getId())).findFirst().orElseThrow();
        assertThat(row.getServicesCount()).isEqualTo(1);
        assertThat(row.getOperationsCount()).isEqualTo(1);
        assertThat(row.getTotalSpent()).isEqualByComparingTo("200");
    }
}
