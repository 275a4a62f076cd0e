package com.wzz.fulfillcrm.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.wzz.fulfillcrm.entity.Client;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface ClientMapper extends BaseMapper<Client> {
}
