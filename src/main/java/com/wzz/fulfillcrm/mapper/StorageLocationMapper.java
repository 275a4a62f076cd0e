package com.wzz.fulfillcrm.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.wzz.fulfillcrm.entity.StorageLocation;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface StorageLocationMapper extends BaseMapper<StorageLocation> {
}
