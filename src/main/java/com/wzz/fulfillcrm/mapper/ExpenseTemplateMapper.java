package com.wzz.fulfillcrm.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.wzz.fulfillcrm.entity.ExpenseTemplate;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface ExpenseTemplateMapper extends BaseMapper<ExpenseTemplate> {
}
