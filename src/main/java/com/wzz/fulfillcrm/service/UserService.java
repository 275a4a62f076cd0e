package com.wzz.fulfillcrm.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.wzz.fulfillcrm.dto.CreatDTO.UserCreateDTO;
import com.wzz.fulfillcrm.dto.LoginDTO.LoginRequestDTO;
import com.wzz.fulfillcrm.dto.LoginDTO.LoginResultDTO;
import com.wzz.fulfillcrm.dto.update.PasswordUpdateDTO;
import com.wzz.fulfillcrm.dto.update.UserUpdateDTO;
import com.wzz.fulfillcrm.entity.User;

import java.util.List;

/**
 * 系统用户服务
 */
public interface UserService extends IService<User> {

    /**
     * 邮箱密码登录，成功后创建 Sa-Token 会话
     */
    LoginResultDTO login(LoginRequestDTO dto);

    /**
     * 查询当前登录用户
     */
    User me(Long userId);

    void changePassword(Long userId, PasswordUpdateDTO dto);

    List<User> listUsers();

    User createUser(UserCreateDTO dto);

    User updateUser(Long id, UserUpdateDTO dto);

    /**
     * 删除用户，不允许删除自己
     */
    void deleteUser(Long id, Long operatorId);

    User getByEmail(String email);
}
