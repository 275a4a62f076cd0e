package com.wzz.fulfillcrm.service;

import com.wzz.fulfillcrm.dto.CreatDTO.ExpenseCreateDTO;
import com.wzz.fulfillcrm.dto.update.ExpenseUpdateDTO;
import com.wzz.fulfillcrm.entity.Client;
import com.wzz.fulfillcrm.entity.Order;
import com.wzz.fulfillcrm.entity.OrderExpense;
import com.wzz.fulfillcrm.enums.ExpenseCategory;
import com.wzz.fulfillcrm.enums.OrderStatus;
import com.wzz.fulfillcrm.exception.BusinessException;
import com.wzz.fulfillcrm.support.BaseIntegrationTest;
import com.wzz.fulfillcrm.util.OrderCostCalculator.CostSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OrderCostServiceTest extends BaseIntegrationTest {

    @Autowired
    private OrderCostService orderCostService;

    @Autowired
    private OrderExpenseService orderExpenseService;

    private Client client;

    @BeforeEach
    void setUp() {
        client = newClient("Cost Client");
    }

    private ExpenseCreateDTO expense(String quantity, String unitPrice) {
        ExpenseCreateDTO dto = new ExpenseCreateDTO();
        dto.setCategory(ExpenseCategory.PACKAGING);
        dto.setDescription("Box");
        dto.setQuantity(new BigDecimal(quantity));
        dto.setUnitPrice(new BigDecimal(unitPrice));
        return dto;
    }

    @Test
    void expensesAndItemCostDriveOrderProfit() {
        Order order = newOrder(client.getId(), "1000", 1, "200", "0");
        orderExpenseService.createExpense(order.getId(), expense("2", "50"));

        Order saved = orderService.getById(order.getId());
        assertThat(saved.getEstimatedCost()).isEqualByComparingTo("100");
        assertThat(saved.getActualCost()).isEqualByComparingTo("300");
        assertThat(saved.getTotalIncome()).isEqualByComparingTo("1000");
        assertThat(saved.getProfit()).isEqualByComparingTo("700");
        assertThat(saved.getMarginPercent()).isEqualByComparingTo("70.00");
    }

    @Test
    void orderWithoutIncomeHasZeroMargin() {
        Order order = newOrder(client.getId(), null, 1, "0", "0");
        orderExpenseService.createExpense(order.getId(), expense("1", "40"));

        Order saved = orderService.getById(order.getId());
        assertThat(saved.getTotalIncome()).isEqualByComparingTo("0");
        assertThat(saved.getProfit()).isEqualByComparingTo("-40");
        assertThat(saved.getMarginPercent()).isEqualByComparingTo("0");
    }

    @Test
    void actualAmountOverridesPlannedTotalAndDeleteRestoresCost() {
        Order order = newOrder(client.getId(), "1000", 1, "200", "0");
        BigDecimal before = orderService.getById(order.getId()).getActualCost();

        OrderExpense created = orderExpenseService.createExpense(order.getId(), expense("2", "50"));
        ExpenseUpdateDTO update = new ExpenseUpdateDTO();
        update.setActualAmount(new BigDecimal("80"));
        orderExpenseService.updateExpense(created.getId(), update);
        assertThat(orderService.getById(order.getId()).getActualCost()).isEqualByComparingTo("280");

        orderExpenseService.deleteExpense(created.getId());
        assertThat(orderService.getById(order.getId()).getActualCost()).isEqualByComparingTo(before);
    }

    @Test
    void quantityChangeRecomputesTotalAmount() {
        Order order = newOrder(client.getId(), "1000", 1, "0", "0");
        OrderExpense created = orderExpenseService.createExpense(order.getId(), expense("2", "50"));

        ExpenseUpdateDTO update = new ExpenseUpdateDTO();
        update.setQuantity(new BigDecimal("5"));
        OrderExpense updated = orderExpenseService.updateExpense(created.getId(), update);

        assertThat(updated.getTotalAmount()).isEqualByComparingTo("250");
        assertThat(orderService.getById(order.getId()).getActualCost()).isEqualByComparingTo("250");
    }

    @Test
    void itemsRevenueReplacesStoredIncome() {
        Order order = newOrder(client.getId(), "1000", 4, "10", "100");

        CostSnapshot snapshot = orderCostService.recalculate(order.getId());

        assertThat(snapshot.getTotalIncome()).isEqualByComparingTo("400");
        assertThat(snapshot.getActualCost()).isEqualByComparingTo("40");
        assertThat(snapshot.getProfit()).isEqualByComparingTo("360");
    }

    @Test
    void recalculateUnknownOrderIsNotFound() {
        assertThatThrownBy(() -> orderCostService.recalculate(-1L))
                .isInstanceOf(BusinessException.class)
                .extracting("code").isEqualTo(404);
    }

    @Test
    void nonNewOrderCannotBeDeletedByManager() {
        Order order = newOrder(client.getId(), "500", 1, "0", "0");
        orderService.updateStatus(order.getId(), OrderStatus.SHIPPED);

        assertThatThrownBy(() -> orderService.deleteOrder(order.getId(), false))
                .isInstanceOf(BusinessException.class)
                .extracting("code").isEqualTo(403);

        orderService.deleteOrder(order.getId(), true);
        assertThat(orderService.getById(order.getId())).isNull();
    }

    @Test
    void shippedStatusStampsShippedDate() {
        Order order = newOrder(client.getId(), "500", 1, "0", "0");

        Order shipped = orderService.updateStatus(order.getId(), OrderStatus.SHIPPED);

        assertThat(shipped.getShippedDate()).isNotNull();
        assertThat(shipped.getDeliveredDate()).isNull();
    }
}
