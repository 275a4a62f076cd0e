package com.wzz.fulfillcrm.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.wzz.fulfillcrm.entity.PriceHistory;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface PriceHistoryMapper extends BaseMapper<PriceHistory> {
}
