package com.wzz.fulfillcrm.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.wzz.fulfillcrm.entity.WarehouseTask;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface WarehouseTaskMapper extends BaseMapper<WarehouseTask> {

    /**
     * 根据作业ID查询并加排他锁，同一作业的明细完成与状态变更由此串行化
     */
    @Select("SELECT * FROM warehouse_task WHERE id = #{id} FOR UPDATE")
    WarehouseTask selectByIdForUpdate(@Param("id") Long id);
}
