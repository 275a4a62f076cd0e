package com.wzz.fulfillcrm.service.impl;

import cn.hutool.core.util.StrUtil;
import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.wzz.fulfillcrm.dto.ResultDTO.ClientDetailDTO;
import com.wzz.fulfillcrm.entity.Client;
import com.wzz.fulfillcrm.entity.Order;
import com.wzz.fulfillcrm.exception.BusinessException;
import com.wzz.fulfillcrm.mapper.ClientMapper;
import com.wzz.fulfillcrm.mapper.OrderMapper;
import com.wzz.fulfillcrm.service.ClientService;
import com.wzz.fulfillcrm.util.MoneyUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;

@Slf4j
@Service
public class ClientServiceImpl extends ServiceImpl<ClientMapper, Client> implements ClientService {

    private static final int RECENT_ORDERS = 10;

    @Autowired
    private OrderMapper orderMapper;

    @Value("${crm.order.default-tariff-rate:1.3}")
    private BigDecimal defaultTariffRate;

    @Override
    public List<Client> listClients(String search, Boolean isActive) {
        LambdaQueryWrapper<Client> wrapper = new LambdaQueryWrapper<Client>()
                .eq(isActive != null, Client::getIsActive, isActive);
        if (StrUtil.isNotBlank(search)) {
            wrapper.and(w -> w.like(Client::getName, search)
                    .or().like(Client::getCompanyName, search)
                    .or().like(Client::getEmail, search)
                    .or().like(Client::getInn, search));
        }
        wrapper.orderByDesc(Client::getCreateTime).orderByDesc(Client::getId);
        return this.list(wrapper);
    }

    @Override
    public ClientDetailDTO getDetail(Long id) {
        Client client = this.getById(id);
        if (client == null) {
            throw BusinessException.notFound("客户不存在: " + id);
        }
        List<Order> orders = orderMapper.selectList(new LambdaQueryWrapper<Order>()
                .eq(Order::getClientId, id)
                .orderByDesc(Order::getOrderDate)
                .orderByDesc(Order::getId));

        BigDecimal revenue = BigDecimal.ZERO;
        BigDecimal profit = BigDecimal.ZERO;
        for (Order order : orders) {
            if (order.getStatus() != null && order.getStatus().isClosedWithoutRevenue()) {
                continue;
            }
            revenue = revenue.add(MoneyUtil.nz(order.getTotalIncome()));
            profit = profit.add(MoneyUtil.nz(order.getProfit()));
        }

        ClientDetailDTO dto = new ClientDetailDTO();
        dto.setClient(client);
        dto.setRecentOrders(orders.subList(0, Math.min(RECENT_ORDERS, orders.size())));
        dto.setTotalOrders(orders.size());
        dto.setTotalRevenue(MoneyUtil.money(revenue));
        dto.setTotalProfit(MoneyUtil.money(profit));
        return dto;
    }

    @Override
    public Client createClient(Client client) {
        if (StrUtil.isBlank(client.getName())) {
            throw BusinessException.badRequest("客户名称不能为空");
        }
        if (client.getTariffRate() != null && client.getTariffRate().signum() <= 0) {
            throw BusinessException.badRequest("费率必须大于0");
        }
        client.setId(null);
        if (client.getTariffRate() == null) {
            client.setTariffRate(defaultTariffRate);
        }
        if (client.getIsActive() == null) {
            client.setIsActive(true);
        }
        this.save(client);
        log.info("新增客户 {}: {}", client.getId(), client.getName());
        return client;
    }

    @Override
    public Client updateClient(Long id, Client patch) {
        if (this.getById(id) == null) {
            throw BusinessException.notFound("客户不存在: " + id);
        }
        if (patch.getName() != null && StrUtil.isBlank(patch.getName())) {
            throw BusinessException.badRequest("客户名称不能为空");
        }
        if (patch.getTariffRate() != null && patch.getTariffRate().signum() <= 0) {
            throw BusinessException.badRequest("费率必须大于0");
        }
        patch.setId(id);
        patch.setCreateTime(null);
        this.updateById(patch);
        return this.getById(id);
    }

    @Override
    public void deleteClient(Long id) {
        if (this.getById(id) == null) {
            throw BusinessException.notFound("客户不存在: " + id);
        }
        Long orders = orderMapper.selectCount(new LambdaQueryWrapper<Order>().eq(Order::getClientId, id));
        if (orders > 0) {
            throw BusinessException.badRequest("客户存在订单，无法删除，请改为停用");
        }
        this.removeById(id);
        log.info("删除客户 {}", id);
    }
}
