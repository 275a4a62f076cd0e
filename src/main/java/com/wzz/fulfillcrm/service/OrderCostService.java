package com.wzz.fulfillcrm.service;

import com.wzz.fulfillcrm.entity.Order;
import com.wzz.fulfillcrm.util.OrderCostCalculator.CostSnapshot;

/**
 * 订单成本重算
 * <p>
 * 订单的 estimatedCost / actualCost / totalIncome / profit / marginPercent 只能经由本服务写入。
 */
public interface OrderCostService {

    /**
     * 锁定订单行（SELECT ... FOR UPDATE），同一订单的费用变更由此串行化
     *
     * @throws com.wzz.fulfillcrm.exception.BusinessException 订单不存在时 404
     */
    Order lockOrder(Long orderId);

    /**
     * 根据费用行与商品行重算订单汇总字段并写回，幂等
     *
     * @return 重算结果
     */
    CostSnapshot recalculate(Long orderId);
}
