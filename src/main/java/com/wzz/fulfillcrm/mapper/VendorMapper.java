package com.wzz.fulfillcrm.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.wzz.fulfillcrm.entity.Vendor;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface VendorMapper extends BaseMapper<Vendor> {
}
