package com.wzz.fulfillcrm.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.wzz.fulfillcrm.entity.Account;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface AccountMapper extends BaseMapper<Account> {

    /**
     * 根据科目ID查询并施加行级排他锁（悲观锁）
     * @param id 科目ID
     * @return Account 锁定的科目实体
     */
    @Select("SELECT * FROM account WHERE id = #{id} FOR UPDATE")
    Account selectByIdForUpdate(@Param("id") Long id);
}
