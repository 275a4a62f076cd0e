package com.wzz.fulfillcrm.service;

import com.wzz.fulfillcrm.dto.CreatDTO.ExpenseCreateDTO;
import com.wzz.fulfillcrm.dto.CreatDTO.ExpenseTemplateCreateDTO;
import com.wzz.fulfillcrm.dto.CreatDTO.ExpenseTemplateItemDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.ExpenseListDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.PriceChangesDTO;
import com.wzz.fulfillcrm.dto.update.ExpenseUpdateDTO;
import com.wzz.fulfillcrm.entity.ExpenseTemplate;
import com.wzz.fulfillcrm.entity.Order;
import com.wzz.fulfillcrm.entity.OrderExpense;
import com.wzz.fulfillcrm.entity.Vendor;
import com.wzz.fulfillcrm.entity.VendorOffer;
import com.wzz.fulfillcrm.enums.ExpenseCategory;
import com.wzz.fulfillcrm.enums.ExpenseStatus;
import com.wzz.fulfillcrm.enums.MeasureUnit;
import com.wzz.fulfillcrm.enums.ServiceType;
import com.wzz.fulfillcrm.exception.BusinessException;
import com.wzz.fulfillcrm.support.BaseIntegrationTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.mock.mockito.SpyBean;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class OrderExpenseServiceTest extends BaseIntegrationTest {

    @SpyBean
    private OrderCostService orderCostService;

    @Autowired
    private OrderExpenseService orderExpenseService;

    @Autowired
    private ExpenseTemplateService expenseTemplateService;

    private Order order;
    private VendorOffer packing;

    @BeforeEach
    void setUp() {
        Long clientId = newClient("Expense Client").getId();
        // 4 件 × 0.5 kg，总重 2 kg
        order = newOrder(clientId, "1000", 4, "0", "0");
        Vendor vendor = newVendor("Pack Vendor");
        packing = newOffer(vendor.getId(), "Packing per order", ServiceType.PACKING, MeasureUnit.ORDER, "30");
    }

    private ExpenseTemplateItemDTO templateItem(String description, Long offerId, String formula,
                                                String defaultQuantity, String defaultPrice) {
        ExpenseTemplateItemDTO dto = new ExpenseTemplateItemDTO();
        dto.setCategory(ExpenseCategory.PACKAGING);
        dto.setDescription(description);
        dto.setVendorServiceId(offerId);
        dto.setQuantityFormula(formula);
        dto.setDefaultQuantity(defaultQuantity == null ? null : new BigDecimal(defaultQuantity));
        dto.setDefaultPrice(defaultPrice == null ? null : new BigDecimal(defaultPrice));
        return dto;
    }

    private ExpenseTemplate standardTemplate() {
        ExpenseTemplateCreateDTO dto = new ExpenseTemplateCreateDTO();
        dto.setName("Standard parcel");
        dto.setItems(Arrays.asList(
                templateItem("Packing", packing.getId(), null, "1", null),
                templateItem("Filler", null, "totalWeight * 2", "1", "10"),
                templateItem("Tape", null, "unknownVar + 1", "3", "5")));
        return expenseTemplateService.createTemplate(dto);
    }

    private ExpenseCreateDTO offerExpense(String quantity) {
        ExpenseCreateDTO dto = new ExpenseCreateDTO();
        dto.setCategory(ExpenseCategory.PACKAGING);
        dto.setVendorServiceId(packing.getId());
        dto.setQuantity(new BigDecimal(quantity));
        return dto;
    }

    @Test
    void applyTemplateCreatesPlannedExpensesAndRecalculatesOnce() {
        ExpenseTemplate template = standardTemplate();
        clearInvocations(orderCostService);

        List<OrderExpense> created = orderExpenseService.applyTemplate(order.getId(), template.getId());

        assertThat(created).hasSize(3).allMatch(e -> e.getStatus() == ExpenseStatus.PLANNED);
        Map<String, OrderExpense> byDescription = created.stream()
                .collect(Collectors.toMap(OrderExpense::getDescription, e -> e));
        assertThat(byDescription.get("Packing").getTotalAmount()).isEqualByComparingTo("30");
        assertThat(byDescription.get("Packing").getOriginalPrice()).isEqualByComparingTo("30");
        assertThat(byDescription.get("Filler").getQuantity()).isEqualByComparingTo("4");
        assertThat(byDescription.get("Filler").getTotalAmount()).isEqualByComparingTo("40");
        // 公式无法计算时回退到默认数量
        assertThat(byDescription.get("Tape").getTotalAmount()).isEqualByComparingTo("15");

        verify(orderCostService, times(1)).recalculate(order.getId());
        assertThat(orderService.getById(order.getId()).getActualCost()).isEqualByComparingTo("85");
    }

    @Test
    void offerExpenseDefaultsToOfferPriceAndReportsPriceChange() {
        OrderExpense expense = orderExpenseService.createExpense(order.getId(), offerExpense("2"));
        assertThat(expense.getUnitPrice()).isEqualByComparingTo("30");

        VendorOffer patch = new VendorOffer();
        patch.setPrice(new BigDecimal("45"));
        vendorOfferService.updateOffer(packing.getId(), patch, adminId());

        PriceChangesDTO changes = orderExpenseService.priceChanges(order.getId());
        assertThat(changes.getTotalChanges()).isEqualTo(1);
        PriceChangesDTO.PriceChange change = changes.getChanges().get(0);
        assertThat(change.getOriginalPrice()).isEqualByComparingTo("30");
        assertThat(change.getCurrentPrice()).isEqualByComparingTo("45");
        assertThat(change.getDifferencePercent()).isEqualByComparingTo("50.0");
        assertThat(changes.getTotalImpact()).isEqualByComparingTo("30");
    }

    @Test
    void bulkCreateRejectsEmptyList() {
        assertThatThrownBy(() -> orderExpenseService.bulkCreate(order.getId(), Collections.emptyList()))
                .isInstanceOf(BusinessException.class)
                .extracting("code").isEqualTo(400);
    }

    @Test
    void bulkCreateRecalculatesOnce() {
        clearInvocations(orderCostService);

        orderExpenseService.bulkCreate(order.getId(), Arrays.asList(offerExpense("1"), offerExpense("3")));

        verify(orderCostService, times(1)).recalculate(anyLong());
        assertThat(orderService.getById(order.getId()).getActualCost()).isEqualByComparingTo("120");
    }

    @Test
    void cloneCopiesExpensesAtCurrentOfferPrice() {
        orderExpenseService.createExpense(order.getId(), offerExpense("2"));
        Order target = newOrder(order.getClientId(), "500", 1, "0", "0");

        VendorOffer patch = new VendorOffer();
        patch.setPrice(new BigDecimal("35"));
        vendorOfferService.updateOffer(packing.getId(), patch, adminId());

        List<OrderExpense> cloned = orderExpenseService.cloneFromOrder(target.getId(), order.getId());

        assertThat(cloned).hasSize(1);
        assertThat(cloned.get(0).getOrderId()).isEqualTo(target.getId());
        assertThat(cloned.get(0).getTotalAmount()).isEqualByComparingTo("70");
        assertThat(orderService.getById(target.getId()).getActualCost()).isEqualByComparingTo("70");
    }

    @Test
    void cloneFromOrderWithoutExpensesIsNotFound() {
        Order empty = newOrder(order.getClientId(), "500", 1, "0", "0");

        assertThatThrownBy(() -> orderExpenseService.cloneFromOrder(order.getId(), empty.getId()))
                .isInstanceOf(BusinessException.class)
                .extracting("code").isEqualTo(404);
    }

    @Test
    void listGroupsByCategoryWithTotals() {
        orderExpenseService.createExpense(order.getId(), offerExpense("2"));
        ExpenseCreateDTO labor = new ExpenseCreateDTO();
        labor.setCategory(ExpenseCategory.LABOR);
        labor.setQuantity(new BigDecimal("1"));
        labor.setUnitPrice(new BigDecimal("25"));
        orderExpenseService.createExpense(order.getId(), labor);

        ExpenseListDTO list = orderExpenseService.listByOrder(order.getId());

        assertThat(list.getSummary().getTotalItems()).isEqualTo(2);
        assertThat(list.getSummary().getTotalActual()).isEqualByComparingTo("85");
        assertThat(list.getSummary().getByCategory()).hasSize(2);
    }

    @Test
    void lockedExpenseIsLeftOutOfPriceChanges() {
        ExpenseCreateDTO locked = offerExpense("2");
        locked.setIsPriceLocked(true);
        orderExpenseService.createExpense(order.getId(), locked);
        orderExpenseService.createExpense(order.getId(), offerExpense("1"));

        VendorOffer patch = new VendorOffer();
        patch.setPrice(new BigDecimal("45"));
        vendorOfferService.updateOffer(packing.getId(), patch, adminId());

        PriceChangesDTO changes = orderExpenseService.priceChanges(order.getId());
        assertThat(changes.getTotalChanges()).isEqualTo(1);
        assertThat(changes.getChanges().get(0).getQuantity()).isEqualByComparingTo("1");
        assertThat(changes.getTotalImpact()).isEqualByComparingTo("15");
    }

    @Test
    void priceLockTimeIsStampedOnlyWhenLockIsFirstSet() {
        OrderExpense expense = orderExpenseService.createExpense(order.getId(), offerExpense("2"));
        assertThat(expense.getPriceLockedAt()).isNull();

        ExpenseUpdateDTO lock = new ExpenseUpdateDTO();
        lock.setIsPriceLocked(true);
        OrderExpense lockedExpense = orderExpenseService.updateExpense(expense.getId(), lock);
        LocalDateTime lockedAt = lockedExpense.getPriceLockedAt();
        assertThat(lockedExpense.getIsPriceLocked()).isTrue();
        assertThat(lockedAt).isNotNull();

        // 已锁定时再次提交锁定，不刷新锁价时间
        ExpenseUpdateDTO relock = new ExpenseUpdateDTO();
        relock.setIsPriceLocked(true);
        relock.setQuantity(new BigDecimal("3"));
        assertThat(orderExpenseService.updateExpense(expense.getId(), relock).getPriceLockedAt()).isEqualTo(lockedAt);

        // 解锁时保留原锁价时间
        ExpenseUpdateDTO unlock = new ExpenseUpdateDTO();
        unlock.setIsPriceLocked(false);
        OrderExpense unlocked = orderExpenseService.updateExpense(expense.getId(), unlock);
        assertThat(unlocked.getIsPriceLocked()).isFalse();
        assertThat(unlocked.getPriceLockedAt()).isEqualTo(lockedAt);
    }

    @Test
    void updateNeverChangesOriginalPrice() {
        OrderExpense expense = orderExpenseService.createExpense(order.getId(), offerExpense("2"));
        assertThat(expense.getOriginalPrice()).isEqualByComparingTo("30");

        ExpenseUpdateDTO dto = new ExpenseUpdateDTO();
        dto.setUnitPrice(new BigDecimal("55"));
        OrderExpense updated = orderExpenseService.updateExpense(expense.getId(), dto);

        assertThat(updated.getUnitPrice()).isEqualByComparingTo("55");
        assertThat(updated.getTotalAmount()).isEqualByComparingTo("110");
        assertThat(updated.getOriginalPrice()).isEqualByComparingTo("30");
    }
}
