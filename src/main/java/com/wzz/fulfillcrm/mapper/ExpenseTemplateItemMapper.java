package com.wzz.fulfillcrm.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.wzz.fulfillcrm.entity.ExpenseTemplateItem;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface ExpenseTemplateItemMapper extends BaseMapper<ExpenseTemplateItem> {
}
