package com.wzz.fulfillcrm.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.wzz.fulfillcrm.dto.CreatDTO.ExpenseCreateDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.ExpenseCategoryDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.ExpenseListDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.PriceChangesDTO;
import com.wzz.fulfillcrm.dto.update.ExpenseUpdateDTO;
import com.wzz.fulfillcrm.entity.ExpenseTemplate;
import com.wzz.fulfillcrm.entity.ExpenseTemplateItem;
import com.wzz.fulfillcrm.entity.OrderExpense;
import com.wzz.fulfillcrm.entity.OrderItem;
import com.wzz.fulfillcrm.entity.VendorOffer;
import com.wzz.fulfillcrm.enums.ExpenseCategory;
import com.wzz.fulfillcrm.enums.ExpenseStatus;
import com.wzz.fulfillcrm.enums.MeasureUnit;
import com.wzz.fulfillcrm.exception.BusinessException;
import com.wzz.fulfillcrm.mapper.OrderExpenseMapper;
import com.wzz.fulfillcrm.mapper.OrderItemMapper;
import com.wzz.fulfillcrm.service.ExpenseTemplateService;
import com.wzz.fulfillcrm.service.OrderCostService;
import com.wzz.fulfillcrm.service.OrderExpenseService;
import com.wzz.fulfillcrm.service.VendorOfferService;
import com.wzz.fulfillcrm.util.MoneyUtil;
import com.wzz.fulfillcrm.util.QuantityFormulaEvaluator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Service
public class OrderExpenseServiceImpl extends ServiceImpl<OrderExpenseMapper, OrderExpense> implements OrderExpenseService {

    private static final String DEFAULT_DESCRIPTION = "费用";

    @Autowired
    private OrderCostService orderCostService;

    @Autowired
    private VendorOfferService vendorOfferService;

    @Autowired
    private ExpenseTemplateService expenseTemplateService;

    @Autowired
    private OrderItemMapper orderItemMapper;

    @Override
    public ExpenseListDTO listByOrder(Long orderId) {
        List<OrderExpense> expenses = this.list(new LambdaQueryWrapper<OrderExpense>()
                .eq(OrderExpense::getOrderId, orderId)
                .orderByAsc(OrderExpense::getCategory)
                .orderByAsc(OrderExpense::getCreateTime)
                .orderByAsc(OrderExpense::getId));

        // 按类别分组，保持排序后的出现顺序
        Map<ExpenseCategory, ExpenseListDTO.CategoryGroup> groups = new LinkedHashMap<>();
        BigDecimal totalPlanned = BigDecimal.ZERO;
        BigDecimal totalActual = BigDecimal.ZERO;
        for (OrderExpense expense : expenses) {
            ExpenseListDTO.CategoryGroup group = groups.computeIfAbsent(expense.getCategory(), c -> {
                ExpenseListDTO.CategoryGroup g = new ExpenseListDTO.CategoryGroup();
                g.setCategory(c);
                g.setCategoryName(c.getDisplayName());
                return g;
            });
            BigDecimal planned = MoneyUtil.nz(expense.getPlannedAmount());
            BigDecimal effective = expense.effectiveAmount();
            group.getItems().add(expense);
            group.setTotalPlanned(group.getTotalPlanned().add(planned));
            group.setTotalActual(group.getTotalActual().add(effective));
            totalPlanned = totalPlanned.add(planned);
            totalActual = totalActual.add(effective);
        }

        ExpenseListDTO.Summary summary = new ExpenseListDTO.Summary(
                MoneyUtil.money(totalPlanned), MoneyUtil.money(totalActual), expenses.size(), new ArrayList<>(groups.values()));
        return new ExpenseListDTO(expenses, summary);
    }

    @Override
    public List<ExpenseCategoryDTO> categories() {
        return Arrays.stream(ExpenseCategory.values())
                .map(c -> new ExpenseCategoryDTO(c.name(), c.getDisplayName(), c.getDescription()))
                .collect(Collectors.toList());
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public OrderExpense createExpense(Long orderId, ExpenseCreateDTO dto) {
        orderCostService.lockOrder(orderId);

        OrderExpense expense = buildExpense(orderId, dto);
        if (dto.getPlannedAmount() != null) {
            expense.setPlannedAmount(MoneyUtil.money(dto.getPlannedAmount()));
        }
        if (Boolean.TRUE.equals(dto.getIsPriceLocked())) {
            expense.setIsPriceLocked(true);
            expense.setPriceLockedAt(LocalDateTime.now());
        }
        this.save(expense);

        orderCostService.recalculate(orderId);
        log.info("订单 {} 新增费用 {}: {} × {} = {}", orderId, expense.getId(),
                expense.getQuantity(), expense.getUnitPrice(), expense.getTotalAmount());
        return expense;
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public OrderExpense updateExpense(Long id, ExpenseUpdateDTO dto) {
        OrderExpense existing = this.getById(id);
        if (existing == null) {
            throw BusinessException.notFound("费用不存在: " + id);
        }
        orderCostService.lockOrder(existing.getOrderId());
        // 锁定后重新读取，避免使用加锁前的旧值
        existing = this.getById(id);
        if (existing == null) {
            throw BusinessException.notFound("费用不存在: " + id);
        }

        BigDecimal newQuantity = dto.getQuantity() != null ? dto.getQuantity() : existing.getQuantity();
        BigDecimal newUnitPrice = dto.getUnitPrice() != null ? dto.getUnitPrice() : existing.getUnitPrice();
        BigDecimal newTotalAmount = MoneyUtil.multiply(newQuantity, newUnitPrice);

        OrderExpense patch = new OrderExpense();
        patch.setId(id);
        patch.setCategory(dto.getCategory());
        patch.setSubcategory(dto.getSubcategory());
        patch.setVendorId(dto.getVendorId());
        patch.setVendorServiceId(dto.getVendorServiceId());
        patch.setDescription(dto.getDescription());
        patch.setUnit(dto.getUnit());
        patch.setQuantity(MoneyUtil.quantity(newQuantity));
        patch.setUnitPrice(MoneyUtil.money(newUnitPrice));
        patch.setTotalAmount(newTotalAmount);
        patch.setPlannedAmount(dto.getPlannedAmount() != null ? MoneyUtil.money(dto.getPlannedAmount()) : newTotalAmount);
        if (dto.getActualAmount() != null) {
            patch.setActualAmount(MoneyUtil.money(dto.getActualAmount()));
        }
        patch.setIsPriceLocked(dto.getIsPriceLocked());
        // 仅在由未锁定变为锁定时记录锁价时间，其余情况保留原值
        if (Boolean.TRUE.equals(dto.getIsPriceLocked()) && !Boolean.TRUE.equals(existing.getIsPriceLocked())) {
            patch.setPriceLockedAt(LocalDateTime.now());
        }
        patch.setStatus(dto.getStatus());
        patch.setNotes(dto.getNotes());
        this.updateById(patch);

        orderCostService.recalculate(existing.getOrderId());
        log.info("订单 {} 修改费用 {}", existing.getOrderId(), id);
        return this.getById(id);
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public void deleteExpense(Long id) {
        OrderExpense existing = this.getById(id);
        if (existing == null) {
            throw BusinessException.notFound("费用不存在: " + id);
        }
        orderCostService.lockOrder(existing.getOrderId());
        this.removeById(id);

        orderCostService.recalculate(existing.getOrderId());
        log.info("订单 {} 删除费用 {}", existing.getOrderId(), id);
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public List<OrderExpense> bulkCreate(Long orderId, List<ExpenseCreateDTO> expenses) {
        if (CollectionUtils.isEmpty(expenses)) {
            throw BusinessException.badRequest("费用列表不能为空");
        }
        orderCostService.lockOrder(orderId);

        List<OrderExpense> created = expenses.stream()
                .map(dto -> buildExpense(orderId, dto))
                .collect(Collectors.toList());
        this.saveBatch(created);

        orderCostService.recalculate(orderId);
        log.info("订单 {} 批量新增费用 {} 条", orderId, created.size());
        return created;
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public List<OrderExpense> cloneFromOrder(Long orderId, Long sourceOrderId) {
        orderCostService.lockOrder(orderId);

        List<OrderExpense> sourceExpenses = this.list(new LambdaQueryWrapper<OrderExpense>()
                .eq(OrderExpense::getOrderId, sourceOrderId)
                .orderByAsc(OrderExpense::getId));
        if (sourceExpenses.isEmpty()) {
            throw BusinessException.notFound("源订单没有费用: " + sourceOrderId);
        }

        Map<Long, VendorOffer> offers = loadOffers(sourceExpenses.stream()
                .map(OrderExpense::getVendorServiceId)
                .collect(Collectors.toList()));

        List<OrderExpense> created = new ArrayList<>();
        for (OrderExpense src : sourceExpenses) {
            BigDecimal unitPrice = src.getUnitPrice();
            BigDecimal originalPrice = src.getOriginalPrice();
            VendorOffer offer = src.getVendorServiceId() == null ? null : offers.get(src.getVendorServiceId());
            if (offer != null) {
                unitPrice = offer.getPrice();
                originalPrice = offer.getPrice();
            }
            BigDecimal totalAmount = MoneyUtil.multiply(src.getQuantity(), unitPrice);

            OrderExpense copy = new OrderExpense();
            copy.setOrderId(orderId);
            copy.setCategory(src.getCategory());
            copy.setSubcategory(src.getSubcategory());
            copy.setVendorId(src.getVendorId());
            copy.setVendorServiceId(src.getVendorServiceId());
            copy.setDescription(src.getDescription());
            copy.setUnit(src.getUnit());
            copy.setQuantity(src.getQuantity());
            copy.setUnitPrice(MoneyUtil.money(unitPrice));
            copy.setTotalAmount(totalAmount);
            copy.setPlannedAmount(totalAmount);
            copy.setActualAmount(BigDecimal.ZERO);
            copy.setIsPriceLocked(false);
            copy.setOriginalPrice(originalPrice);
            copy.setStatus(ExpenseStatus.PLANNED);
            copy.setNotes(src.getNotes());
            created.add(copy);
        }
        this.saveBatch(created);

        orderCostService.recalculate(orderId);
        log.info("从订单 {} 复制 {} 条费用到订单 {}", sourceOrderId, created.size(), orderId);
        return created;
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public List<OrderExpense> applyTemplate(Long orderId, Long templateId) {
        orderCostService.lockOrder(orderId);
        ExpenseTemplate template = expenseTemplateService.getTemplate(templateId);

        // 公式变量：商品行数、总重量、总体积
        List<OrderItem> items = orderItemMapper.selectList(new LambdaQueryWrapper<OrderItem>()
                .eq(OrderItem::getOrderId, orderId));
        Map<String, BigDecimal> variables = formulaVariables(items);

        List<ExpenseTemplateItem> templateItems = template.getItems() == null ? Collections.emptyList() : template.getItems();
        Map<Long, VendorOffer> offers = loadOffers(templateItems.stream()
                .map(ExpenseTemplateItem::getVendorServiceId)
                .collect(Collectors.toList()));

        List<OrderExpense> created = new ArrayList<>();
        for (ExpenseTemplateItem item : templateItems) {
            BigDecimal quantity = resolveQuantity(item, variables);

            BigDecimal unitPrice = MoneyUtil.nz(item.getDefaultPrice());
            BigDecimal originalPrice = null;
            Long vendorId = null;
            VendorOffer offer = item.getVendorServiceId() == null ? null : offers.get(item.getVendorServiceId());
            if (offer != null) {
                unitPrice = offer.getPrice();
                originalPrice = offer.getPrice();
                vendorId = offer.getVendorId();
            }
            BigDecimal totalAmount = MoneyUtil.multiply(quantity, unitPrice);

            OrderExpense expense = new OrderExpense();
            expense.setOrderId(orderId);
            expense.setCategory(item.getCategory());
            expense.setSubcategory(item.getSubcategory());
            expense.setVendorServiceId(item.getVendorServiceId());
            expense.setVendorId(vendorId);
            expense.setDescription(item.getDescription());
            expense.setUnit(item.getUnit());
            expense.setQuantity(MoneyUtil.quantity(quantity));
            expense.setUnitPrice(MoneyUtil.money(unitPrice));
            expense.setTotalAmount(totalAmount);
            expense.setPlannedAmount(totalAmount);
            expense.setActualAmount(BigDecimal.ZERO);
            expense.setIsPriceLocked(false);
            expense.setOriginalPrice(originalPrice);
            expense.setStatus(ExpenseStatus.PLANNED);
            created.add(expense);
        }
        if (!created.isEmpty()) {
            this.saveBatch(created);
        }

        orderCostService.recalculate(orderId);
        log.info("订单 {} 应用费用模板 \"{}\"({})，生成 {} 条费用", orderId, template.getName(), templateId, created.size());
        return created;
    }

    @Override
    public PriceChangesDTO priceChanges(Long orderId) {
        List<OrderExpense> expenses = this.list(new LambdaQueryWrapper<OrderExpense>()
                .eq(OrderExpense::getOrderId, orderId)
                .isNotNull(OrderExpense::getVendorServiceId)
                .eq(OrderExpense::getIsPriceLocked, false));
        Map<Long, VendorOffer> offers = loadOffers(expenses.stream()
                .map(OrderExpense::getVendorServiceId)
                .collect(Collectors.toList()));

        List<PriceChangesDTO.PriceChange> changes = new ArrayList<>();
        BigDecimal totalImpact = BigDecimal.ZERO;
        for (OrderExpense expense : expenses) {
            VendorOffer offer = offers.get(expense.getVendorServiceId());
            BigDecimal originalPrice = expense.getOriginalPrice();
            if (offer == null || originalPrice == null || originalPrice.signum() == 0) {
                continue;
            }
            BigDecimal currentPrice = offer.getPrice();
            if (currentPrice.compareTo(originalPrice) == 0) {
                continue;
            }
            BigDecimal diff = currentPrice.subtract(originalPrice);
            BigDecimal diffPercent = diff.multiply(BigDecimal.valueOf(100))
                    .divide(originalPrice, 1, RoundingMode.HALF_UP);
            BigDecimal impact = MoneyUtil.multiply(diff, expense.getQuantity());
            changes.add(new PriceChangesDTO.PriceChange(expense.getId(), expense.getDescription(),
                    offer.getId(), offer.getName(), originalPrice, currentPrice, diff, diffPercent,
                    expense.getQuantity(), impact));
            totalImpact = totalImpact.add(impact);
        }
        return new PriceChangesDTO(changes, changes.size(), MoneyUtil.money(totalImpact));
    }

    /**
     * 按新增规则构造费用行：绑定供应商服务时单价默认取报价并记录报价快照
     */
    private OrderExpense buildExpense(Long orderId, ExpenseCreateDTO dto) {
        BigDecimal unitPrice = dto.getUnitPrice();
        BigDecimal originalPrice = null;
        if (dto.getVendorServiceId() != null) {
            VendorOffer offer = vendorOfferService.getById(dto.getVendorServiceId());
            if (offer != null) {
                if (unitPrice == null) {
                    unitPrice = offer.getPrice();
                }
                originalPrice = offer.getPrice();
            }
        }
        // 数量为空或为 0 时按 1 计
        BigDecimal quantity = dto.getQuantity() == null || dto.getQuantity().signum() == 0
                ? BigDecimal.ONE : dto.getQuantity();
        BigDecimal totalAmount = MoneyUtil.multiply(quantity, unitPrice);

        OrderExpense expense = new OrderExpense();
        expense.setOrderId(orderId);
        expense.setCategory(dto.getCategory() != null ? dto.getCategory() : ExpenseCategory.OTHER);
        expense.setSubcategory(dto.getSubcategory());
        expense.setVendorId(dto.getVendorId());
        expense.setVendorServiceId(dto.getVendorServiceId());
        expense.setDescription(StringUtils.hasText(dto.getDescription()) ? dto.getDescription() : DEFAULT_DESCRIPTION);
        expense.setUnit(dto.getUnit() != null ? dto.getUnit() : MeasureUnit.PIECE);
        expense.setQuantity(MoneyUtil.quantity(quantity));
        expense.setUnitPrice(MoneyUtil.money(unitPrice));
        expense.setTotalAmount(totalAmount);
        expense.setPlannedAmount(totalAmount);
        expense.setActualAmount(BigDecimal.ZERO);
        expense.setIsPriceLocked(false);
        expense.setOriginalPrice(originalPrice);
        expense.setStatus(ExpenseStatus.PLANNED);
        expense.setNotes(dto.getNotes());
        return expense;
    }

    private BigDecimal resolveQuantity(ExpenseTemplateItem item, Map<String, BigDecimal> variables) {
        BigDecimal defaultQuantity = MoneyUtil.nz(item.getDefaultQuantity());
        if (!StringUtils.hasText(item.getQuantityFormula())) {
            return defaultQuantity;
        }
        try {
            return QuantityFormulaEvaluator.evaluateCeil(item.getQuantityFormula(), variables);
        } catch (IllegalArgumentException | ArithmeticException e) {
            log.debug("模板明细 {} 数量公式计算失败，使用默认数量 {}: {}", item.getId(), defaultQuantity, e.getMessage());
            return defaultQuantity;
        }
    }

    private Map<String, BigDecimal> formulaVariables(List<OrderItem> items) {
        BigDecimal totalWeight = BigDecimal.ZERO;
        BigDecimal totalVolume = BigDecimal.ZERO;
        for (OrderItem item : items) {
            BigDecimal qty = BigDecimal.valueOf(item.getQuantity() == null ? 0 : item.getQuantity());
            totalWeight = totalWeight.add(MoneyUtil.nz(item.getWeight()).multiply(qty));
            totalVolume = totalVolume.add(MoneyUtil.nz(item.getVolume()).multiply(qty));
        }
        Map<String, BigDecimal> variables = new HashMap<>();
        variables.put("itemsCount", BigDecimal.valueOf(items.size()));
        variables.put("totalWeight", totalWeight);
        variables.put("totalVolume", totalVolume);
        return variables;
    }

    private Map<Long, VendorOffer> loadOffers(List<Long> offerIds) {
        List<Long> ids = offerIds.stream().filter(Objects::nonNull).distinct().collect(Collectors.toList());
        if (ids.isEmpty()) {
            return Collections.emptyMap();
        }
        return vendorOfferService.listByIds(ids).stream()
                .collect(Collectors.toMap(VendorOffer::getId, Function.identity()));
    }
}
