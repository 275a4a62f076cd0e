package com.wzz.fulfillcrm.config;

import cn.dev33.satoken.stp.StpInterface;
import com.wzz.fulfillcrm.entity.User;
import com.wzz.fulfillcrm.mapper.UserMapper;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;

/**
 * Sa-Token 角色来源：用户表中的 role 字段
 */
@Component
public class StpInterfaceImpl implements StpInterface {

    private final UserMapper userMapper;

    public StpInterfaceImpl(UserMapper userMapper) {
        this.userMapper = userMapper;
    }

    @Override
    public List<String> getPermissionList(Object loginId, String loginType) {
        return Collections.emptyList();
    }

    @Override
    public List<String> getRoleList(Object loginId, String loginType) {
        User user = userMapper.selectById(Long.valueOf(String.valueOf(loginId)));
        if (user == null || user.getRole() == null || !Boolean.TRUE.equals(user.getIsActive())) {
            return Collections.emptyList();
        }
        return Collections.singletonList(user.getRole().name());
    }
}
