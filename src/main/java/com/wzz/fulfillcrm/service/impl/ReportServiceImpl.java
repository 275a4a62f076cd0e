package com.wzz.fulfillcrm.service.impl;

import cn.hutool.core.util.StrUtil;
import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.wzz.fulfillcrm.dto.ResultDTO.ClientReportRowDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.ClientsReportDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.OrderPnlDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.OrderReportRowDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.OrdersReportDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.VendorReportRowDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.VendorSpendDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.VendorsReportDTO;
import com.wzz.fulfillcrm.entity.Client;
import com.wzz.fulfillcrm.entity.CostOperation;
import com.wzz.fulfillcrm.entity.IncomeOperation;
import com.wzz.fulfillcrm.entity.Order;
import com.wzz.fulfillcrm.entity.OrderItem;
import com.wzz.fulfillcrm.entity.User;
import com.wzz.fulfillcrm.entity.Vendor;
import com.wzz.fulfillcrm.entity.VendorOffer;
import com.wzz.fulfillcrm.enums.OrderStatus;
import com.wzz.fulfillcrm.enums.ServiceType;
import com.wzz.fulfillcrm.enums.VendorStatus;
import com.wzz.fulfillcrm.mapper.ClientMapper;
import com.wzz.fulfillcrm.mapper.CostOperationMapper;
import com.wzz.fulfillcrm.mapper.IncomeOperationMapper;
import com.wzz.fulfillcrm.mapper.OrderItemMapper;
import com.wzz.fulfillcrm.mapper.OrderMapper;
import com.wzz.fulfillcrm.mapper.UserMapper;
import com.wzz.fulfillcrm.mapper.VendorMapper;
import com.wzz.fulfillcrm.mapper.VendorOfferMapper;
import com.wzz.fulfillcrm.service.OrderService;
import com.wzz.fulfillcrm.service.ReportService;
import com.wzz.fulfillcrm.util.DateUtil;
import com.wzz.fulfillcrm.util.MoneyUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Service
public class ReportServiceImpl implements ReportService {

    @Autowired
    private OrderService orderService;

    @Autowired
    private OrderMapper orderMapper;

    @Autowired
    private OrderItemMapper orderItemMapper;

    @Autowired
    private ClientMapper clientMapper;

    @Autowired
    private UserMapper userMapper;

    @Autowired
    private VendorMapper vendorMapper;

    @Autowired
    private VendorOfferMapper vendorOfferMapper;

    @Autowired
    private CostOperationMapper costOperationMapper;

    @Autowired
    private IncomeOperationMapper incomeOperationMapper;

    @Override
    public OrderPnlDTO getOrderPnl(String idOrNumber) {
        Order order = orderService.findByIdOrNumber(idOrNumber);
        Client client = clientMapper.selectById(order.getClientId());
        List<OrderItem> items = orderItemMapper.selectList(new LambdaQueryWrapper<OrderItem>()
                .eq(OrderItem::getOrderId, order.getId())
                .orderByAsc(OrderItem::getId));
        List<CostOperation> operations = costOperationMapper.selectList(new LambdaQueryWrapper<CostOperation>()
                .eq(CostOperation::getOrderId, order.getId())
                .orderByAsc(CostOperation::getOperationDate)
                .orderByAsc(CostOperation::getId));
        List<IncomeOperation> incomes = incomeOperationMapper.selectList(new LambdaQueryWrapper<IncomeOperation>()
                .eq(IncomeOperation::getOrderId, order.getId())
                .orderByAsc(IncomeOperation::getId));
        Map<Long, VendorOffer> offers = loadOffers(operations.stream()
                .map(CostOperation::getVendorServiceId).collect(Collectors.toSet()));
        Map<Long, Vendor> vendors = loadVendors(operations.stream()
                .map(CostOperation::getVendorId).collect(Collectors.toSet()));

        OrderPnlDTO dto = new OrderPnlDTO();

        OrderPnlDTO.OrderHeader header = new OrderPnlDTO.OrderHeader();
        header.setId(order.getId());
        header.setOrderNumber(order.getOrderNumber());
        header.setStatus(order.getStatus());
        header.setOrderDate(order.getOrderDate());
        header.setClient(client != null ? client.getName() : null);
        dto.setOrder(header);

        long totalItems = 0;
        List<OrderPnlDTO.ItemLine> itemLines = new ArrayList<>();
        for (OrderItem item : items) {
            OrderPnlDTO.ItemLine line = new OrderPnlDTO.ItemLine();
            line.setSku(item.getSku());
            line.setName(item.getName());
            line.setQuantity(item.getQuantity());
            line.setWeight(item.getWeight());
            line.setVolume(item.getVolume());
            itemLines.add(line);
            totalItems += item.getQuantity() == null ? 0 : item.getQuantity();
        }
        dto.setItems(itemLines);

        OrderPnlDTO.Income income = new OrderPnlDTO.Income();
        BigDecimal paid = BigDecimal.ZERO;
        BigDecimal invoiced = BigDecimal.ZERO;
        for (IncomeOperation op : incomes) {
            OrderPnlDTO.IncomeLine line = new OrderPnlDTO.IncomeLine();
            line.setInvoiceAmount(op.getInvoiceAmount());
            line.setPaidAmount(op.getPaidAmount());
            line.setPaymentMethod(op.getPaymentMethod());
            line.setPaymentDate(op.getPaymentDate());
            income.getDetails().add(line);
            paid = paid.add(MoneyUtil.nz(op.getPaidAmount()));
            invoiced = invoiced.add(MoneyUtil.nz(op.getInvoiceAmount()));
        }
        income.setTotal(MoneyUtil.money(paid));
        income.setInvoiced(MoneyUtil.money(invoiced));
        dto.setIncome(income);

        OrderPnlDTO.Costs costs = new OrderPnlDTO.Costs();
        Map<ServiceType, OrderPnlDTO.CostGroup> byType = new EnumMap<>(ServiceType.class);
        BigDecimal totalCost = BigDecimal.ZERO;
        for (CostOperation op : operations) {
            VendorOffer offer = offers.get(op.getVendorServiceId());
            Vendor vendor = vendors.get(op.getVendorId());
            OrderPnlDTO.CostLine line = new OrderPnlDTO.CostLine();
            line.setVendor(vendor != null ? vendor.getName() : null);
            line.setService(offer != null ? offer.getName() : null);
            line.setType(offer != null ? offer.getType() : ServiceType.OTHER);
            line.setUnit(offer != null ? offer.getUnit() : null);
            line.setQuantity(op.getQuantity());
            line.setUnitPrice(op.getUnitPrice());
            line.setCalculatedAmount(op.getCalculatedAmount());
            line.setActualAmount(op.getActualAmount());
            line.setDate(op.getOperationDate());
            costs.getDetails().add(line);

            OrderPnlDTO.CostGroup group = byType.computeIfAbsent(line.getType(), t -> new OrderPnlDTO.CostGroup());
            group.setAmount(group.getAmount().add(MoneyUtil.nz(op.getActualAmount())));
            group.getItems().add(line);
            totalCost = totalCost.add(MoneyUtil.nz(op.getActualAmount()));
        }
        byType.values().forEach(g -> g.setAmount(MoneyUtil.money(g.getAmount())));
        costs.setTotal(MoneyUtil.money(totalCost));
        costs.setByType(byType);
        dto.setCosts(costs);

        BigDecimal revenue = income.getTotal();
        BigDecimal cost = costs.getTotal();
        BigDecimal profit = revenue.subtract(cost);
        OrderPnlDTO.Pnl pnl = new OrderPnlDTO.Pnl();
        pnl.setRevenue(revenue);
        pnl.setCost(cost);
        pnl.setProfit(profit);
        pnl.setMarginPercent(MoneyUtil.percent(profit, revenue));
        dto.setPnl(pnl);

        OrderPnlDTO.UnitEconomics unit = new OrderPnlDTO.UnitEconomics();
        unit.setTotalItems(totalItems);
        unit.setRevenuePerItem(MoneyUtil.perUnit(revenue, totalItems));
        unit.setCostPerItem(MoneyUtil.perUnit(cost, totalItems));
        unit.setProfitPerItem(MoneyUtil.perUnit(profit, totalItems));
        dto.setUnitEconomics(unit);
        return dto;
    }

    @Override
    public OrdersReportDTO getOrdersReport(LocalDate dateFrom, LocalDate dateTo, Long clientId, OrderStatus status) {
        List<Order> orders = orderMapper.selectList(new LambdaQueryWrapper<Order>()
                .ge(dateFrom != null, Order::getOrderDate, DateUtil.startOfDay(dateFrom))
                .lt(dateTo != null, Order::getOrderDate, DateUtil.startOfNextDay(dateTo))
                .eq(clientId != null, Order::getClientId, clientId)
                .eq(status != null, Order::getStatus, status)
                .orderByDesc(Order::getOrderDate)
                .orderByDesc(Order::getId));
        if (orders.isEmpty()) {
            return new OrdersReportDTO(Collections.emptyList(), new OrdersReportDTO.Summary(0,
                    MoneyUtil.money(null), MoneyUtil.money(null), MoneyUtil.money(null), MoneyUtil.money(null)));
        }

        List<Long> orderIds = orders.stream().map(Order::getId).collect(Collectors.toList());
        Map<Long, List<OrderItem>> itemsByOrder = orderItemMapper.selectList(new LambdaQueryWrapper<OrderItem>()
                        .in(OrderItem::getOrderId, orderIds))
                .stream().collect(Collectors.groupingBy(OrderItem::getOrderId));
        List<CostOperation> operations = costOperationMapper.selectList(new LambdaQueryWrapper<CostOperation>()
                .in(CostOperation::getOrderId, orderIds));
        Map<Long, List<CostOperation>> opsByOrder = operations.stream()
                .collect(Collectors.groupingBy(CostOperation::getOrderId));
        Map<Long, VendorOffer> offers = loadOffers(operations.stream()
                .map(CostOperation::getVendorServiceId).collect(Collectors.toSet()));
        Map<Long, Client> clients = loadClients(orders.stream().map(Order::getClientId).collect(Collectors.toSet()));
        Map<Long, User> managers = loadUsers(orders.stream().map(Order::getManagerId).collect(Collectors.toSet()));

        List<OrderReportRowDTO> rows = new ArrayList<>();
        BigDecimal totalRevenue = BigDecimal.ZERO;
        BigDecimal totalCost = BigDecimal.ZERO;
        BigDecimal totalProfit = BigDecimal.ZERO;
        BigDecimal marginSum = BigDecimal.ZERO;
        for (Order order : orders) {
            Client client = clients.get(order.getClientId());
            User manager = managers.get(order.getManagerId());
            List<OrderItem> items = itemsByOrder.getOrDefault(order.getId(), Collections.emptyList());

            Map<ServiceType, BigDecimal> costByType = new EnumMap<>(ServiceType.class);
            for (CostOperation op : opsByOrder.getOrDefault(order.getId(), Collections.emptyList())) {
                VendorOffer offer = offers.get(op.getVendorServiceId());
                ServiceType type = offer != null ? offer.getType() : ServiceType.OTHER;
                costByType.merge(type, MoneyUtil.nz(op.getActualAmount()), BigDecimal::add);
            }

            OrderReportRowDTO row = new OrderReportRowDTO();
            row.setOrderNumber(order.getOrderNumber());
            row.setOrderDate(DateUtil.formatDate(order.getOrderDate()));
            row.setStatus(order.getStatus());
            row.setClientName(client != null ? client.getName() : "");
            row.setClientCompany(client != null ? StrUtil.nullToEmpty(client.getCompanyName()) : "");
            row.setManager(manager != null ? manager.getFirstName() + " " + manager.getLastName() : "");
            row.setItemsCount(items.stream().mapToLong(i -> i.getQuantity() == null ? 0 : i.getQuantity()).sum());
            row.setTotalWeight(MoneyUtil.quantity(items.stream()
                    .map(i -> MoneyUtil.nz(i.getWeight()).multiply(BigDecimal.valueOf(i.getQuantity() == null ? 0 : i.getQuantity())))
                    .reduce(BigDecimal.ZERO, BigDecimal::add)));
            row.setRevenue(MoneyUtil.money(order.getTotalIncome()));
            row.setStorageCost(typeCost(costByType, ServiceType.STORAGE));
            row.setPickingCost(typeCost(costByType, ServiceType.PICKING));
            row.setPackingCost(typeCost(costByType, ServiceType.PACKING));
            row.setShippingCost(typeCost(costByType, ServiceType.SHIPPING));
            row.setOtherCost(MoneyUtil.money(typeCost(costByType, ServiceType.RECEIVING)
                    .add(typeCost(costByType, ServiceType.LABELING))
                    .add(typeCost(costByType, ServiceType.RETURNS))
                    .add(typeCost(costByType, ServiceType.OTHER))));
            row.setTotalCost(MoneyUtil.money(order.getActualCost()));
            row.setProfit(MoneyUtil.money(order.getProfit()));
            row.setMarginPercent(MoneyUtil.money(order.getMarginPercent()));
            rows.add(row);

            totalRevenue = totalRevenue.add(row.getRevenue());
            totalCost = totalCost.add(row.getTotalCost());
            totalProfit = totalProfit.add(row.getProfit());
            marginSum = marginSum.add(row.getMarginPercent());
        }

        BigDecimal averageMargin = marginSum.divide(BigDecimal.valueOf(rows.size()), 2, RoundingMode.HALF_UP);
        OrdersReportDTO.Summary summary = new OrdersReportDTO.Summary(rows.size(),
                MoneyUtil.money(totalRevenue), MoneyUtil.money(totalCost), MoneyUtil.money(totalProfit), averageMargin);
        log.debug("订单报表生成 {} 行", rows.size());
        return new OrdersReportDTO(rows, summary);
    }

    @Override
    public ClientsReportDTO getClientsReport(LocalDate dateFrom, LocalDate dateTo) {
        List<Client> clients = clientMapper.selectList(new LambdaQueryWrapper<Client>().orderByAsc(Client::getId));
        Map<Long, List<Order>> ordersByClient = orderMapper.selectList(new LambdaQueryWrapper<Order>()
                        .ge(dateFrom != null, Order::getOrderDate, DateUtil.startOfDay(dateFrom))
                        .lt(dateTo != null, Order::getOrderDate, DateUtil.startOfNextDay(dateTo))
                        .notIn(Order::getStatus, OrderStatus.CANCELLED, OrderStatus.RETURNED))
                .stream().collect(Collectors.groupingBy(Order::getClientId));

        List<ClientReportRowDTO> rows = new ArrayList<>();
        for (Client client : clients) {
            List<Order> orders = ordersByClient.getOrDefault(client.getId(), Collections.emptyList());
            BigDecimal revenue = sum(orders, Order::getTotalIncome);
            BigDecimal cost = sum(orders, Order::getActualCost);
            BigDecimal profit = sum(orders, Order::getProfit);

            ClientReportRowDTO row = new ClientReportRowDTO();
            row.setId(client.getId());
            row.setName(client.getName());
            row.setCompanyName(StrUtil.nullToEmpty(client.getCompanyName()));
            row.setEmail(StrUtil.nullToEmpty(client.getEmail()));
            row.setPhone(StrUtil.nullToEmpty(client.getPhone()));
            row.setIsActive(client.getIsActive());
            row.setOrdersCount(orders.size());
            row.setRevenue(revenue);
            row.setCost(cost);
            row.setProfit(profit);
            row.setMarginPercent(MoneyUtil.percent(profit, revenue));
            rows.add(row);
        }
        rows.sort(Comparator.comparing(ClientReportRowDTO::getProfit).reversed());

        ClientsReportDTO.Summary summary = new ClientsReportDTO.Summary(
                rows.size(),
                (int) rows.stream().filter(r -> Boolean.TRUE.equals(r.getIsActive())).count(),
                MoneyUtil.money(rows.stream().map(ClientReportRowDTO::getRevenue).reduce(BigDecimal.ZERO, BigDecimal::add)),
                MoneyUtil.money(rows.stream().map(ClientReportRowDTO::getProfit).reduce(BigDecimal.ZERO, BigDecimal::add)));
        return new ClientsReportDTO(rows, summary);
    }

    @Override
    public VendorsReportDTO getVendorsReport(LocalDate dateFrom, LocalDate dateTo) {
        List<Vendor> vendors = vendorMapper.selectList(new LambdaQueryWrapper<Vendor>().orderByAsc(Vendor::getId));
        Map<Long, VendorSpendDTO> spend = costOperationMapper.sumByVendor(
                        DateUtil.startOfDay(dateFrom), DateUtil.startOfNextDay(dateTo))
                .stream().collect(Collectors.toMap(VendorSpendDTO::getVendorId, Function.identity()));
        Map<Long, Long> servicesCount = vendorOfferMapper.selectList(new LambdaQueryWrapper<VendorOffer>()
                        .select(VendorOffer::getId, VendorOffer::getVendorId))
                .stream().collect(Collectors.groupingBy(VendorOffer::getVendorId, Collectors.counting()));

        List<VendorReportRowDTO> rows = new ArrayList<>();
        for (Vendor vendor : vendors) {
            VendorSpendDTO s = spend.get(vendor.getId());
            VendorReportRowDTO row = new VendorReportRowDTO();
            row.setId(vendor.getId());
            row.setName(vendor.getName());
            row.setLegalName(vendor.getLegalName());
            row.setStatus(vendor.getStatus());
            row.setServicesCount(servicesCount.getOrDefault(vendor.getId(), 0L));
            row.setOperationsCount(s != null && s.getOperationCount() != null ? s.getOperationCount() : 0L);
            row.setTotalSpent(MoneyUtil.money(s != null ? s.getTotalSpent() : null));
            rows.add(row);
        }
        rows.sort(Comparator.comparing(VendorReportRowDTO::getTotalSpent).reversed());

        VendorsReportDTO.Summary summary = new VendorsReportDTO.Summary(
                rows.size(),
                (int) rows.stream().filter(r -> r.getStatus() == VendorStatus.ACTIVE).count(),
                MoneyUtil.money(rows.stream().map(VendorReportRowDTO::getTotalSpent).reduce(BigDecimal.ZERO, BigDecimal::add)));
        return new VendorsReportDTO(rows, summary);
    }

    private BigDecimal typeCost(Map<ServiceType, BigDecimal> costByType, ServiceType type) {
        return MoneyUtil.money(costByType.get(type));
    }

    private BigDecimal sum(List<Order> orders, Function<Order, BigDecimal> field) {
        return MoneyUtil.money(orders.stream().map(o -> MoneyUtil.nz(field.apply(o))).reduce(BigDecimal.ZERO, BigDecimal::add));
    }

    private Map<Long, VendorOffer> loadOffers(Collection<Long> ids) {
        ids.removeIf(Objects::isNull);
        if (ids.isEmpty()) {
            return Collections.emptyMap();
        }
        return vendorOfferMapper.selectBatchIds(ids).stream()
                .collect(Collectors.toMap(VendorOffer::getId, Function.identity()));
    }

    private Map<Long, Vendor> loadVendors(Collection<Long> ids) {
        ids.removeIf(Objects::isNull);
        if (ids.isEmpty()) {
            return Collections.emptyMap();
        }
        return vendorMapper.selectBatchIds(ids).stream()
                .collect(Collectors.toMap(Vendor::getId, Function.identity()));
    }

    private Map<Long, Client> loadClients(Collection<Long> ids) {
        ids.removeIf(Objects::isNull);
        if (ids.isEmpty()) {
            return Collections.emptyMap();
        }
        return clientMapper.selectBatchIds(ids).stream()
                .collect(Collectors.toMap(Client::getId, Function.identity()));
    }

    private Map<Long, User> loadUsers(Collection<Long> ids) {
        ids.removeIf(Objects::isNull);
        if (ids.isEmpty()) {
            return Collections.emptyMap();
        }
        return userMapper.selectBatchIds(ids).stream()
                .collect(Collectors.toMap(User::getId, Function.identity()));
    }
}
