package com.wzz.fulfillcrm.service.impl;

import cn.hutool.core.util.NumberUtil;
import cn.hutool.core.util.RandomUtil;
import cn.hutool.core.util.StrUtil;
import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.metadata.IPage;
import com.baomidou.mybatisplus.extension.plugins.pagination.Page;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.wzz.fulfillcrm.common.Constants;
import com.wzz.fulfillcrm.dto.CreatDTO.IncomeOperationCreateDTO;
import com.wzz.fulfillcrm.dto.CreatDTO.OrderCreateDTO;
import com.wzz.fulfillcrm.dto.CreatDTO.OrderItemDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.OrderDetailDTO;
import com.wzz.fulfillcrm.dto.page.PageQuery;
import com.wzz.fulfillcrm.dto.update.OrderUpdateDTO;
import com.wzz.fulfillcrm.entity.Client;
import com.wzz.fulfillcrm.entity.CostOperation;
import com.wzz.fulfillcrm.entity.IncomeOperation;
import com.wzz.fulfillcrm.entity.Order;
import com.wzz.fulfillcrm.entity.OrderExpense;
import com.wzz.fulfillcrm.entity.OrderItem;
import com.wzz.fulfillcrm.entity.Vendor;
import com.wzz.fulfillcrm.entity.VendorOffer;
import com.wzz.fulfillcrm.enums.MeasureUnit;
import com.wzz.fulfillcrm.enums.OrderStatus;
import com.wzz.fulfillcrm.enums.ServiceType;
import com.wzz.fulfillcrm.exception.BusinessException;
import com.wzz.fulfillcrm.mapper.ClientMapper;
import com.wzz.fulfillcrm.mapper.OrderItemMapper;
import com.wzz.fulfillcrm.mapper.OrderMapper;
import com.wzz.fulfillcrm.mapper.VendorMapper;
import com.wzz.fulfillcrm.service.CostOperationService;
import com.wzz.fulfillcrm.service.IncomeOperationService;
import com.wzz.fulfillcrm.service.OrderCostService;
import com.wzz.fulfillcrm.service.OrderExpenseService;
import com.wzz.fulfillcrm.service.OrderService;
import com.wzz.fulfillcrm.service.VendorOfferService;
import com.wzz.fulfillcrm.util.DateUtil;
import com.wzz.fulfillcrm.util.MoneyUtil;
import com.wzz.fulfillcrm.util.OrderCostCalculator.CostSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Service
public class OrderServiceImpl extends ServiceImpl<OrderMapper, Order> implements OrderService {

    private static final DateTimeFormatter ORDER_NUMBER_DATE = DateTimeFormatter.ofPattern("yyMMdd");
    private static final int ORDER_NUMBER_ATTEMPTS = 5;

    @Autowired
    private ClientMapper clientMapper;

    @Autowired
    private VendorMapper vendorMapper;

    @Autowired
    private OrderItemMapper orderItemMapper;

    @Autowired
    private OrderCostService orderCostService;

    @Autowired
    private OrderExpenseService orderExpenseService;

    @Autowired
    private CostOperationService costOperationService;

    @Autowired
    private IncomeOperationService incomeOperationService;

    @Autowired
    private VendorOfferService vendorOfferService;

    @Value("${crm.order.default-tariff-rate:1.3}")
    private BigDecimal defaultTariffRate;

    @Value("${crm.order.auto-estimate-costs:true}")
    private boolean autoEstimateCosts;

    @Override
    public IPage<Order> listOrders(OrderStatus status, Long clientId, String search,
                                   LocalDate dateFrom, LocalDate dateTo, PageQuery pageQuery) {
        LambdaQueryWrapper<Order> wrapper = new LambdaQueryWrapper<Order>()
                .eq(status != null, Order::getStatus, status)
                .eq(clientId != null, Order::getClientId, clientId)
                .ge(dateFrom != null, Order::getOrderDate, DateUtil.startOfDay(dateFrom))
                .lt(dateTo != null, Order::getOrderDate, DateUtil.startOfNextDay(dateTo));
        if (StrUtil.isNotBlank(search)) {
            List<Long> clientIds = clientMapper.selectList(new LambdaQueryWrapper<Client>()
                            .select(Client::getId)
                            .like(Client::getName, search))
                    .stream().map(Client::getId).collect(Collectors.toList());
            wrapper.and(w -> w.like(Order::getOrderNumber, search)
                    .or(!clientIds.isEmpty(), o -> o.in(Order::getClientId, clientIds)));
        }
        wrapper.orderByDesc(Order::getOrderDate).orderByDesc(Order::getId);
        Page<Order> page = pageQuery.toPage();
        return this.page(page, wrapper);
    }

    @Override
    public Order findByIdOrNumber(String idOrNumber) {
        Order order = null;
        if (NumberUtil.isLong(idOrNumber)) {
            order = this.getById(Long.parseLong(idOrNumber));
        }
        if (order == null && StrUtil.isNotBlank(idOrNumber)) {
            order = this.getOne(new LambdaQueryWrapper<Order>().eq(Order::getOrderNumber, idOrNumber.trim()));
        }
        if (order == null) {
            throw BusinessException.notFound("订单不存在: " + idOrNumber);
        }
        return order;
    }

    @Override
    public OrderDetailDTO getDetail(String idOrNumber) {
        Order order = findByIdOrNumber(idOrNumber);
        OrderDetailDTO dto = new OrderDetailDTO();
        dto.setOrder(order);
        dto.setClient(clientMapper.selectById(order.getClientId()));
        dto.setItems(listItems(order.getId()));
        dto.setExpenses(orderExpenseService.listByOrder(order.getId()).getExpenses());
        dto.setCostOperations(costOperationService.listByOrder(order.getId()));
        dto.setIncomeOperations(incomeOperationService.listByOrder(order.getId()));
        return dto;
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public Order createOrder(OrderCreateDTO dto, Long managerId) {
        Client client = clientMapper.selectById(dto.getClientId());
        if (client == null) {
            throw BusinessException.notFound("客户不存在: " + dto.getClientId());
        }
        if (dto.getItems() == null || dto.getItems().isEmpty()) {
            throw BusinessException.badRequest("订单至少包含一个商品");
        }

        List<OrderItem> items = dto.getItems().stream().map(this::toItem).collect(Collectors.toList());
        boolean estimate = dto.getEstimateCosts() != null ? dto.getEstimateCosts() : autoEstimateCosts;
        List<CostOperation> estimatedCosts = estimate ? estimateCosts(items) : Collections.emptyList();
        BigDecimal estimatedTotal = MoneyUtil.money(estimatedCosts.stream()
                .map(CostOperation::getCalculatedAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add));

        // 收入：优先取请求金额，否则 预估成本 × 客户费率
        BigDecimal income;
        if (dto.getIncomeAmount() != null && dto.getIncomeAmount().signum() > 0) {
            income = MoneyUtil.money(dto.getIncomeAmount());
        } else {
            BigDecimal rate = client.getTariffRate() != null && client.getTariffRate().signum() > 0
                    ? client.getTariffRate() : defaultTariffRate;
            income = MoneyUtil.money(estimatedTotal.multiply(rate));
        }

        Order order = new Order();
        order.setOrderNumber(generateOrderNumber());
        order.setClientId(client.getId());
        order.setManagerId(managerId);
        order.setStatus(OrderStatus.NEW);
        order.setShippingAddress(StrUtil.blankToDefault(dto.getShippingAddress(), client.getAddress()));
        order.setOrderDate(LocalDateTime.now());
        order.setNotes(dto.getNotes());
        order.setEstimatedCost(estimatedTotal);
        order.setActualCost(estimatedTotal);
        order.setTotalIncome(income);
        order.setProfit(MoneyUtil.money(income.subtract(estimatedTotal)));
        order.setMarginPercent(MoneyUtil.percent(order.getProfit(), income));
        this.save(order);

        for (OrderItem item : items) {
            item.setOrderId(order.getId());
            orderItemMapper.insert(item);
        }
        if (!estimatedCosts.isEmpty()) {
            estimatedCosts.forEach(c -> c.setOrderId(order.getId()));
            costOperationService.saveBatch(estimatedCosts);
        }

        if (income.signum() > 0) {
            IncomeOperationCreateDTO invoice = new IncomeOperationCreateDTO();
            invoice.setOrderId(order.getId());
            invoice.setInvoiceAmount(income);
            invoice.setDescription("订单 " + order.getOrderNumber() + " 货款");
            incomeOperationService.createInvoice(invoice);
        }

        orderCostService.recalculate(order.getId());
        log.info("客户 {} 新建订单 {} ({})，商品 {} 行，预估成本操作 {} 条，收入 {}",
                client.getId(), order.getId(), order.getOrderNumber(), items.size(), estimatedCosts.size(), income);
        return this.getById(order.getId());
    }

    @Override
    public Order updateStatus(Long id, OrderStatus status) {
        if (this.getById(id) == null) {
            throw BusinessException.notFound("订单不存在: " + id);
        }
        Order patch = new Order();
        patch.setId(id);
        applyStatus(patch, status);
        this.updateById(patch);
        log.info("订单 {} 状态变更为 {}", id, status);
        return this.getById(id);
    }

    @Override
    public Order updateOrder(Long id, OrderUpdateDTO dto) {
        if (this.getById(id) == null) {
            throw BusinessException.notFound("订单不存在: " + id);
        }
        Order patch = new Order();
        patch.setId(id);
        patch.setShippingAddress(dto.getShippingAddress());
        patch.setNotes(dto.getNotes());
        if (dto.getStatus() != null) {
            applyStatus(patch, dto.getStatus());
        }
        this.updateById(patch);
        log.info("修改订单 {}", id);
        return this.getById(id);
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public void deleteOrder(Long id, boolean anyStatus) {
        Order order = orderCostService.lockOrder(id);
        if (!anyStatus && order.getStatus() != OrderStatus.NEW) {
            log.warn("拒绝删除订单 {}，状态为 {}", id, order.getStatus());
            throw BusinessException.forbidden("只能删除新建状态的订单");
        }
        orderItemMapper.delete(new LambdaQueryWrapper<OrderItem>().eq(OrderItem::getOrderId, id));
        orderExpenseService.remove(new LambdaQueryWrapper<OrderExpense>().eq(OrderExpense::getOrderId, id));
        costOperationService.remove(new LambdaQueryWrapper<CostOperation>().eq(CostOperation::getOrderId, id));
        incomeOperationService.remove(new LambdaQueryWrapper<IncomeOperation>().eq(IncomeOperation::getOrderId, id));
        this.removeById(id);
        log.info("删除订单 {} ({})", id, order.getOrderNumber());
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public CostSnapshot recalculate(Long id) {
        return orderCostService.recalculate(id);
    }

    private List<OrderItem> listItems(Long orderId) {
        return orderItemMapper.selectList(new LambdaQueryWrapper<OrderItem>()
                .eq(OrderItem::getOrderId, orderId)
                .orderByAsc(OrderItem::getId));
    }

    private void applyStatus(Order patch, OrderStatus status) {
        patch.setStatus(status);
        if (status == OrderStatus.SHIPPED) {
            patch.setShippedDate(LocalDateTime.now());
        } else if (status == OrderStatus.DELIVERED || status == OrderStatus.COMPLETED) {
            patch.setDeliveredDate(LocalDateTime.now());
        }
    }

    private OrderItem toItem(OrderItemDTO dto) {
        OrderItem item = new OrderItem();
        item.setSku(StrUtil.nullToEmpty(dto.getSku()));
        item.setName(dto.getName());
        item.setQuantity(dto.getQuantity() == null || dto.getQuantity() < 1 ? 1 : dto.getQuantity());
        item.setWeight(MoneyUtil.quantity(dto.getWeight()));
        item.setVolume(MoneyUtil.quantity(dto.getVolume()));
        item.setUnitCost(MoneyUtil.money(dto.getUnitCost()));
        item.setUnitPrice(MoneyUtil.money(dto.getUnitPrice()));
        return item;
    }

    /**
     * 根据启用的拣货、打包、配送报价预估成本操作
     */
    private List<CostOperation> estimateCosts(List<OrderItem> items) {
        long totalItems = items.stream().mapToLong(OrderItem::getQuantity).sum();
        BigDecimal totalWeight = items.stream()
                .map(i -> MoneyUtil.nz(i.getWeight()).multiply(BigDecimal.valueOf(i.getQuantity())))
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        List<VendorOffer> offers = new ArrayList<>();
        offers.addAll(vendorOfferService.listActiveByType(ServiceType.PICKING));
        offers.addAll(vendorOfferService.listActiveByType(ServiceType.PACKING));
        offers.addAll(vendorOfferService.listActiveByType(ServiceType.SHIPPING));
        if (offers.isEmpty()) {
            return Collections.emptyList();
        }
        Map<Long, Vendor> vendors = vendorMapper.selectBatchIds(
                        offers.stream().map(VendorOffer::getVendorId).distinct().collect(Collectors.toList()))
                .stream().collect(Collectors.toMap(Vendor::getId, Function.identity()));

        List<CostOperation> result = new ArrayList<>();
        for (VendorOffer offer : offers) {
            BigDecimal quantity = estimateQuantity(offer, totalItems, totalWeight);
            if (quantity == null || quantity.signum() <= 0) {
                continue;
            }
            Vendor vendor = vendors.get(offer.getVendorId());
            String description = vendor != null ? vendor.getName() + ": " + offer.getName() : offer.getName();
            result.add(costOperationService.buildCharge(null, offer, quantity, description));
        }
        return result;
    }

    private BigDecimal estimateQuantity(VendorOffer offer, long totalItems, BigDecimal totalWeight) {
        MeasureUnit unit = offer.getUnit();
        switch (offer.getType()) {
            case PICKING:
                if (unit == MeasureUnit.ORDER) {
                    return BigDecimal.ONE;
                }
                return unit == MeasureUnit.PIECE ? BigDecimal.valueOf(totalItems) : null;
            case PACKING:
                return unit == MeasureUnit.ORDER ? BigDecimal.ONE : null;
            case SHIPPING:
                if (unit == MeasureUnit.KG) {
                    return totalWeight;
                }
                if (unit == MeasureUnit.ORDER && inRange(totalWeight, offer.getMinQuantity(), offer.getMaxQuantity())) {
                    return BigDecimal.ONE;
                }
                return null;
            default:
                return null;
        }
    }

    /**
     * 重量区间判断，边界为空视为不限
     */
    private boolean inRange(BigDecimal value, BigDecimal min, BigDecimal max) {
        return (min == null || value.compareTo(min) >= 0) && (max == null || value.compareTo(max) <= 0);
    }

    private String generateOrderNumber() {
        String prefix = Constants.ORDER_NUMBER_PREFIX + LocalDate.now().format(ORDER_NUMBER_DATE) + "-";
        for (int i = 0; i < ORDER_NUMBER_ATTEMPTS; i++) {
            String candidate = prefix + RandomUtil.randomString(RandomUtil.BASE_CHAR_NUMBER, 6).toUpperCase();
            if (this.count(new LambdaQueryWrapper<Order>().eq(Order::getOrderNumber, candidate)) == 0) {
                return candidate;
            }
        }
        throw new IllegalStateException("无法生成唯一订单号");
    }
}
