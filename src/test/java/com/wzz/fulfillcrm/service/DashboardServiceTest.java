package com.wzz.fulfillcrm.service;

import com.wzz.fulfillcrm.dto.ResultDTO.DashboardKpiDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.RevenuePointDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.StatusCountDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.TopClientDTO;
import com.wzz.fulfillcrm.entity.Client;
import com.wzz.fulfillcrm.entity.Order;
import com.wzz.fulfillcrm.enums.DashboardPeriod;
import com.wzz.fulfillcrm.enums.OrderStatus;
import com.wzz.fulfillcrm.support.BaseIntegrationTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DashboardServiceTest extends BaseIntegrationTest {

    @Autowired
    private DashboardService dashboardService;

    private static long countOf(List<StatusCountDTO> counts, OrderStatus status) {
        return counts.stream().filter(c -> c.getStatus() == status).mapToLong(StatusCountDTO::getCount).sum();
    }

    @Test
    void kpiLeavesOutCancelledOrders() {
        DashboardKpiDTO before = dashboardService.kpi(DashboardPeriod.MONTH);
        Client client = newClient("Dash Client");
        newOrder(client.getId(), "1000", 2, "0", "0");
        Order shipped = newOrder(client.getId(), "500", 3, "0", "0");
        orderService.updateStatus(shipped.getId(), OrderStatus.SHIPPED);
        Order cancelled = newOrder(client.getId(), "700", 1, "0", "0");
        orderService.updateStatus(cancelled.getId(), OrderStatus.CANCELLED);

        DashboardKpiDTO after = dashboardService.kpi(DashboardPeriod.MONTH);

        assertThat(after.getRevenue().getValue().subtract(before.getRevenue().getValue()))
                .isEqualByComparingTo("1500");
        assertThat(after.getOrders().getValue().subtract(before.getOrders().getValue()))
                .isEqualByComparingTo("2");
        assertThat(after.getShippedItems().getValue().subtract(before.getShippedItems().getValue()))
                .isEqualByComparingTo("3");
        assertThat(after.getPeriodFrom()).isBefore(after.getPeriodTo());
    }

    @Test
    void averageOrderValueIsRevenuePerOrder() {
        newOrder(newClient("Avg Client").getId(), "300", 1, "0", "0");

        DashboardKpiDTO kpi = dashboardService.kpi(DashboardPeriod.DAY);

        BigDecimal expected = kpi.getRevenue().getValue()
                .divide(kpi.getOrders().getValue(), 2, RoundingMode.HALF_UP);
        assertThat(kpi.getAverageOrderValue()).isEqualByComparingTo(expected);
    }

    @Test
    void revenueChartBucketsTodayByDay() {
        String today = LocalDate.now().toString();
        long ordersBefore = dashboardService.revenueChart(DashboardPeriod.WEEK, "day").stream()
                .filter(p -> p.getDate().equals(today)).mapToLong(RevenuePointDTO::getOrders).sum();
        newOrder(newClient("Chart Client").getId(), "250", 1, "0", "0");

        List<RevenuePointDTO> points = dashboardService.revenueChart(DashboardPeriod.WEEK, "day");

        assertThat(points).anySatisfy(p -> {
            assertThat(p.getDate()).isEqualTo(today);
            assertThat(p.getOrders()).isEqualTo(ordersBefore + 1);
        });
        assertThat(dashboardService.revenueChart(DashboardPeriod.YEAR, "month"))
                .anySatisfy(p -> assertThat(p.getDate()).isEqualTo(today.substring(0, 7)));
    }

    @Test
    void topClientsSumRevenuePerClient() {
        Client client = newClient("Top Client");
        newOrder(client.getId(), "400", 1, "0", "0");
        newOrder(client.getId(), "600", 1, "0", "0");

        List<TopClientDTO> top = dashboardService.topClients(DashboardPeriod.MONTH, 100);

        assertThat(top).anySatisfy(row -> {
            assertThat(row.getId()).isEqualTo(client.getId());
            assertThat(row.getName()).isEqualTo("Top Client");
            assertThat(row.getOrdersCount()).isEqualTo(2);
            assertThat(row.getRevenue()).isEqualByComparingTo("1000");
        });
        for (int i = 1; i < top.size(); i++) {
            assertThat(top.get(i - 1).getProfit()).isGreaterThanOrEqualTo(top.get(i).getProfit());
        }
    }

    @Test
    void ordersByStatusCountsEveryStatus() {
        long cancelledBefore = countOf(dashboardService.ordersByStatus(), OrderStatus.CANCELLED);
        Order order = newOrder(newClient("Status Client").getId(), "100", 1, "0", "0");
        orderService.updateStatus(order.getId(), OrderStatus.CANCELLED);

        List<StatusCountDTO> counts = dashboardService.ordersByStatus();

        assertThat(countOf(counts, OrderStatus.CANCELLED)).isEqualTo(cancelledBefore + 1);
        assertThat(counts).filteredOn(c -> c.getStatus() == OrderStatus.CANCELLED)
                .singleElement()
                .satisfies(c -> assertThat(c.getLabel()).isEqualTo("已取消"));
    }
}
