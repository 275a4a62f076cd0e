package com.wzz.fulfillcrm.service;

import com.baomidou.mybatisplus.core.metadata.IPage;
import com.baomidou.mybatisplus.extension.service.IService;
import com.wzz.fulfillcrm.dto.CreatDTO.OrderCreateDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.OrderDetailDTO;
import com.wzz.fulfillcrm.dto.page.PageQuery;
import com.wzz.fulfillcrm.dto.update.OrderUpdateDTO;
import com.wzz.fulfillcrm.entity.Order;
import com.wzz.fulfillcrm.enums.OrderStatus;
import com.wzz.fulfillcrm.util.OrderCostCalculator.CostSnapshot;

import java.time.LocalDate;

/**
 * 订单服务
 */
public interface OrderService extends IService<Order> {

    /**
     * 分页查询订单，按下单时间倒序
     *
     * @param search 匹配订单号或客户名称
     */
    IPage<Order> listOrders(OrderStatus status, Long clientId, String search,
                            LocalDate dateFrom, LocalDate dateTo, PageQuery pageQuery);

    /**
     * 按数字ID或订单号查询订单，找不到时 404
     */
    Order findByIdOrNumber(String idOrNumber);

    OrderDetailDTO getDetail(String idOrNumber);

    /**
     * 创建订单及商品明细，按需根据供应商报价预估成本，并开具收入发票
     */
    Order createOrder(OrderCreateDTO dto, Long managerId);

    Order updateStatus(Long id, OrderStatus status);

    Order updateOrder(Long id, OrderUpdateDTO dto);

    /**
     * 删除订单及其明细、费用、成本与收入记录
     *
     * @param anyStatus false 时只允许删除新建状态的订单
     */
    void deleteOrder(Long id, boolean anyStatus);

    CostSnapshot recalculate(Long id);
}
