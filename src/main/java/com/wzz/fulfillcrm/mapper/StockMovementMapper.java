package com.wzz.fulfillcrm.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.wzz.fulfillcrm.entity.StockMovement;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface StockMovementMapper extends BaseMapper<StockMovement> {
}
