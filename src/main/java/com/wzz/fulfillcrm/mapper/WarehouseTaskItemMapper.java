package com.wzz.fulfillcrm.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.wzz.fulfillcrm.entity.WarehouseTaskItem;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface WarehouseTaskItemMapper extends BaseMapper<WarehouseTaskItem> {
}
