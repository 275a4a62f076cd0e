package com.wzz.fulfillcrm.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.wzz.fulfillcrm.dto.CreatDTO.ExpenseCreateDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.ExpenseCategoryDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.ExpenseListDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.PriceChangesDTO;
import com.wzz.fulfillcrm.dto.update.ExpenseUpdateDTO;
import com.wzz.fulfillcrm.entity.OrderExpense;

import java.util.List;

/**
 * 订单费用台账
 * <p>
 * 所有写操作都在同一事务内先锁定订单，完成后触发一次成本重算。
 */
public interface OrderExpenseService extends IService<OrderExpense> {

    /**
     * 查询订单费用，按类别、创建时间排序，附带汇总
     */
    ExpenseListDTO listByOrder(Long orderId);

    /**
     * 费用类别列表
     */
    List<ExpenseCategoryDTO> categories();

    OrderExpense createExpense(Long orderId, ExpenseCreateDTO dto);

    OrderExpense updateExpense(Long id, ExpenseUpdateDTO dto);

    void deleteExpense(Long id);

    /**
     * 批量新增，只重算一次
     */
    List<OrderExpense> bulkCreate(Long orderId, List<ExpenseCreateDTO> expenses);

    /**
     * 复制源订单的费用到目标订单，绑定了供应商服务的按当前报价重新取价
     */
    List<OrderExpense> cloneFromOrder(Long orderId, Long sourceOrderId);

    /**
     * 按模板生成费用，数量公式计算失败时使用默认数量
     */
    List<OrderExpense> applyTemplate(Long orderId, Long templateId);

    /**
     * 检查未锁价费用的供应商调价情况
     */
    PriceChangesDTO priceChanges(Long orderId);
}
