package com.wzz.fulfillcrm.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.wzz.fulfillcrm.dto.ResultDTO.CostShareDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.DashboardKpiDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.RevenuePointDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.StatusCountDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.TopClientDTO;
import com.wzz.fulfillcrm.entity.Client;
import com.wzz.fulfillcrm.entity.CostOperation;
import com.wzz.fulfillcrm.entity.Order;
import com.wzz.fulfillcrm.entity.OrderItem;
import com.wzz.fulfillcrm.entity.VendorOffer;
import com.wzz.fulfillcrm.enums.DashboardPeriod;
import com.wzz.fulfillcrm.enums.OrderStatus;
import com.wzz.fulfillcrm.enums.ServiceType;
import com.wzz.fulfillcrm.mapper.ClientMapper;
import com.wzz.fulfillcrm.mapper.CostOperationMapper;
import com.wzz.fulfillcrm.mapper.OrderItemMapper;
import com.wzz.fulfillcrm.mapper.OrderMapper;
import com.wzz.fulfillcrm.mapper.VendorOfferMapper;
import com.wzz.fulfillcrm.service.DashboardService;
import com.wzz.fulfillcrm.util.MoneyUtil;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
public class DashboardServiceImpl implements DashboardService {

    private static final List<OrderStatus> EXCLUDED = Arrays.asList(OrderStatus.CANCELLED, OrderStatus.RETURNED);

    private static final List<OrderStatus> SHIPPED = Arrays.asList(
            OrderStatus.SHIPPED, OrderStatus.DELIVERED, OrderStatus.COMPLETED);

    private static final DateTimeFormatter MONTH_KEY = DateTimeFormatter.ofPattern("yyyy-MM");

    @Autowired
    private OrderMapper orderMapper;

    @Autowired
    private OrderItemMapper orderItemMapper;

    @Autowired
    private ClientMapper clientMapper;

    @Autowired
    private CostOperationMapper costOperationMapper;

    @Autowired
    private VendorOfferMapper vendorOfferMapper;

    @Override
    public DashboardKpiDTO kpi(DashboardPeriod period) {
        LocalDateTime now = LocalDateTime.now();
        LocalDateTime from = period.startFrom(now);
        // 上一周期与当前周期等长，紧挨在其之前
        LocalDateTime previousFrom = from.minus(Duration.between(from, now));

        Totals current = totals(ordersBetween(from, now));
        Totals previous = totals(ordersBefore(previousFrom, from));

        DashboardKpiDTO dto = new DashboardKpiDTO();
        dto.setRevenue(metric(current.revenue, previous.revenue));
        dto.setProfit(metric(current.profit, previous.profit));
        dto.setCost(metric(current.cost, previous.cost));
        dto.setOrders(metric(BigDecimal.valueOf(current.orders), BigDecimal.valueOf(previous.orders)));
        dto.setShippedItems(metric(BigDecimal.valueOf(current.shippedItems), BigDecimal.valueOf(previous.shippedItems)));
        dto.setMargin(metric(current.averageMargin(), previous.averageMargin()));
        dto.setAverageOrderValue(MoneyUtil.perUnit(current.revenue, current.orders));
        dto.setPeriodFrom(from);
        dto.setPeriodTo(now);
        return dto;
    }

    @Override
    public List<RevenuePointDTO> revenueChart(DashboardPeriod period, String groupBy) {
        LocalDateTime now = LocalDateTime.now();
        Function<LocalDateTime, String> keyOf = bucket(groupBy);
        Map<String, RevenuePointDTO> points = new TreeMap<>();
        for (Order order : ordersBetween(period.startFrom(now), now)) {
            RevenuePointDTO point = points.computeIfAbsent(keyOf.apply(order.getOrderDate()),
                    k -> new RevenuePointDTO(k, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, 0));
            point.setRevenue(point.getRevenue().add(MoneyUtil.nz(order.getTotalIncome())));
            point.setProfit(point.getProfit().add(MoneyUtil.nz(order.getProfit())));
            point.setCost(point.getCost().add(MoneyUtil.nz(order.getActualCost())));
            point.setOrders(point.getOrders() + 1);
        }
        return new ArrayList<>(points.values());
    }

    @Override
    public List<CostShareDTO> costBreakdown(DashboardPeriod period) {
        LocalDateTime now = LocalDateTime.now();
        List<CostOperation> operations = costOperationMapper.selectList(new LambdaQueryWrapper<CostOperation>()
                .ge(CostOperation::getOperationDate, period.startFrom(now))
                .le(CostOperation::getOperationDate, now));
        Set<Long> offerIds = operations.stream().map(CostOperation::getVendorServiceId).collect(Collectors.toSet());
        Map<Long, VendorOffer> offers = offerIds.isEmpty() ? Collections.emptyMap()
                : vendorOfferMapper.selectBatchIds(offerIds).stream()
                .collect(Collectors.toMap(VendorOffer::getId, Function.identity()));

        Map<ServiceType, BigDecimal> byType = new EnumMap<>(ServiceType.class);
        for (CostOperation op : operations) {
            VendorOffer offer = offers.get(op.getVendorServiceId());
            ServiceType type = offer != null && offer.getType() != null ? offer.getType() : ServiceType.OTHER;
            BigDecimal amount = op.getActualAmount() != null && op.getActualAmount().signum() > 0
                    ? op.getActualAmount() : MoneyUtil.nz(op.getCalculatedAmount());
            byType.merge(type, amount, BigDecimal::add);
        }
        return byType.entrySet().stream()
                .map(e -> new CostShareDTO(e.getKey(), e.getKey().getDescription(), MoneyUtil.money(e.getValue())))
                .sorted(Comparator.comparing(CostShareDTO::getValue).reversed())
                .collect(Collectors.toList());
    }

    @Override
    public List<TopClientDTO> topClients(DashboardPeriod period, int limit) {
        LocalDateTime now = LocalDateTime.now();
        Map<Long, TopClientDTO> rows = new LinkedHashMap<>();
        for (Order order : ordersBetween(period.startFrom(now), now)) {
            TopClientDTO row = rows.computeIfAbsent(order.getClientId(),
                    id -> new TopClientDTO(id, null, null, 0, BigDecimal.ZERO, BigDecimal.ZERO));
            row.setOrdersCount(row.getOrdersCount() + 1);
            row.setRevenue(row.getRevenue().add(MoneyUtil.nz(order.getTotalIncome())));
            row.setProfit(row.getProfit().add(MoneyUtil.nz(order.getProfit())));
        }
        if (rows.isEmpty()) {
            return Collections.emptyList();
        }
        Map<Long, Client> clients = clientMapper.selectBatchIds(rows.keySet()).stream()
                .collect(Collectors.toMap(Client::getId, Function.identity()));
        for (TopClientDTO row : rows.values()) {
            Client client = clients.get(row.getId());
            if (client != null) {
                row.setName(client.getName());
                row.setCompanyName(client.getCompanyName());
            }
        }
        return rows.values().stream()
                .sorted(Comparator.comparing(TopClientDTO::getProfit).reversed())
                .limit(Math.max(limit, 1))
                .collect(Collectors.toList());
    }

    @Override
    public List<StatusCountDTO> ordersByStatus() {
        List<Order> orders = orderMapper.selectList(new LambdaQueryWrapper<Order>().select(Order::getStatus));
        Map<OrderStatus, Long> counts = orders.stream()
                .filter(o -> o.getStatus() != null)
                .collect(Collectors.groupingBy(Order::getStatus, () -> new EnumMap<>(OrderStatus.class),
                        Collectors.counting()));
        return counts.entrySet().stream()
                .map(e -> new StatusCountDTO(e.getKey(), e.getKey().getDescription(), e.getValue()))
                .collect(Collectors.toList());
    }

    /**
     * 当前周期内的有效订单，两端都包含
     */
    private List<Order> ordersBetween(LocalDateTime from, LocalDateTime to) {
        return orderMapper.selectList(new LambdaQueryWrapper<Order>()
                .notIn(Order::getStatus, EXCLUDED)
                .ge(Order::getOrderDate, from)
                .le(Order::getOrderDate, to));
    }

    /**
     * 上一周期的有效订单，左闭右开，不与当前周期重叠
     */
    private List<Order> ordersBefore(LocalDateTime from, LocalDateTime to) {
        return orderMapper.selectList(new LambdaQueryWrapper<Order>()
                .notIn(Order::getStatus, EXCLUDED)
                .ge(Order::getOrderDate, from)
                .lt(Order::getOrderDate, to));
    }

    private Totals totals(List<Order> orders) {
        Totals totals = new Totals();
        List<Long> shippedIds = new ArrayList<>();
        for (Order order : orders) {
            totals.orders++;
            totals.revenue = totals.revenue.add(MoneyUtil.nz(order.getTotalIncome()));
            totals.profit = totals.profit.add(MoneyUtil.nz(order.getProfit()));
            totals.cost = totals.cost.add(MoneyUtil.nz(order.getActualCost()));
            totals.marginSum = totals.marginSum.add(MoneyUtil.nz(order.getMarginPercent()));
            if (SHIPPED.contains(order.getStatus())) {
                shippedIds.add(order.getId());
            }
        }
        if (!shippedIds.isEmpty()) {
            totals.shippedItems = orderItemMapper.selectList(new LambdaQueryWrapper<OrderItem>()
                            .in(OrderItem::getOrderId, shippedIds))
                    .stream().mapToLong(i -> i.getQuantity() == null ? 0 : i.getQuantity()).sum();
        }
        return totals;
    }

    /**
     * 上一周期为 0 时变化记为 0
     */
    private static DashboardKpiDTO.Metric metric(BigDecimal current, BigDecimal previous) {
        BigDecimal change = BigDecimal.ZERO.setScale(1);
        if (previous.signum() > 0) {
            change = current.subtract(previous).multiply(BigDecimal.valueOf(100))
                    .divide(previous, 1, RoundingMode.HALF_UP);
        }
        return new DashboardKpiDTO.Metric(current, change);
    }

    /**
     * day 按日期，week 按周一，month 按 yyyy-MM；无法识别时按日
     */
    private static Function<LocalDateTime, String> bucket(String groupBy) {
        if ("month".equalsIgnoreCase(groupBy)) {
            return t -> t.format(MONTH_KEY);
        }
        if ("week".equalsIgnoreCase(groupBy)) {
            return t -> t.toLocalDate().with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY)).toString();
        }
        return t -> t.toLocalDate().toString();
    }

    private static class Totals {
        long orders;
        long shippedItems;
        BigDecimal revenue = BigDecimal.ZERO;
        BigDecimal profit = BigDecimal.ZERO;
        BigDecimal cost = BigDecimal.ZERO;
        BigDecimal marginSum = BigDecimal.ZERO;

        BigDecimal averageMargin() {
            if (orders == 0) {
                return BigDecimal.ZERO.setScale(1);
            }
            return marginSum.divide(BigDecimal.valueOf(orders), 1, RoundingMode.HALF_UP);
        }
    }
}
