package com.wzz.fulfillcrm.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.wzz.fulfillcrm.entity.OrderExpense;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface OrderExpenseMapper extends BaseMapper<OrderExpense> {
}
