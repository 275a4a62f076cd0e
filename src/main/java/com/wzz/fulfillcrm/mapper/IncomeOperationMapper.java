package com.wzz.fulfillcrm.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.wzz.fulfillcrm.entity.IncomeOperation;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface IncomeOperationMapper extends BaseMapper<IncomeOperation> {
}
