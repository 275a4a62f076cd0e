package com.wzz.fulfillcrm.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.wzz.fulfillcrm.entity.VendorOffer;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface VendorOfferMapper extends BaseMapper<VendorOffer> {
}
