package com.wzz.fulfillcrm.service.impl;

import cn.dev33.satoken.stp.StpUtil;
import cn.hutool.core.util.StrUtil;
import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.wzz.fulfillcrm.dto.CreatDTO.UserCreateDTO;
import com.wzz.fulfillcrm.dto.LoginDTO.LoginRequestDTO;
import com.wzz.fulfillcrm.dto.LoginDTO.LoginResultDTO;
import com.wzz.fulfillcrm.dto.update.PasswordUpdateDTO;
import com.wzz.fulfillcrm.dto.update.UserUpdateDTO;
import com.wzz.fulfillcrm.entity.User;
import com.wzz.fulfillcrm.exception.BusinessException;
import com.wzz.fulfillcrm.mapper.UserMapper;
import com.wzz.fulfillcrm.service.UserService;
import com.wzz.fulfillcrm.util.SecurityUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Slf4j
@Service
public class UserServiceImpl extends ServiceImpl<UserMapper, User> implements UserService {

    @Override
    public LoginResultDTO login(LoginRequestDTO dto) {
        User user = getByEmail(dto.getEmail());
        if (user == null || !SecurityUtil.verifyPassword(dto.getPassword(), user.getPassword())) {
            log.warn("登录失败，邮箱或密码错误: {}", dto.getEmail());
            throw new BusinessException(401, "邮箱或密码错误");
        }
        if (!Boolean.TRUE.equals(user.getIsActive())) {
            log.warn("已停用用户尝试登录: {}", dto.getEmail());
            throw new BusinessException(401, "账号已停用");
        }
        StpUtil.login(user.getId());
        log.info("用户 {} 登录成功", user.getId());
        return new LoginResultDTO(StpUtil.getTokenValue(), user);
    }

    @Override
    public User me(Long userId) {
        User user = this.getById(userId);
        if (user == null) {
            throw BusinessException.notFound("用户不存在");
        }
        return user;
    }

    @Override
    public void changePassword(Long userId, PasswordUpdateDTO dto) {
        User user = me(userId);
        if (!SecurityUtil.verifyPassword(dto.getCurrentPassword(), user.getPassword())) {
            throw BusinessException.badRequest("当前密码错误");
        }
        User patch = new User();
        patch.setId(userId);
        patch.setPassword(SecurityUtil.hashPassword(dto.getNewPassword()));
        this.updateById(patch);
        log.info("用户 {} 修改了密码", userId);
    }

    @Override
    public List<User> listUsers() {
        return this.list(new LambdaQueryWrapper<User>().orderByAsc(User::getId));
    }

    @Transactional(rollbackFor = Exception.class)
    @Override
    public User createUser(UserCreateDTO dto) {
        if (getByEmail(dto.getEmail()) != null) {
            throw BusinessException.badRequest("邮箱已被使用: " + dto.getEmail());
        }
        User user = new User();
        user.setEmail(dto.getEmail().trim().toLowerCase());
        user.setPassword(SecurityUtil.hashPassword(dto.getPassword()));
        user.setFirstName(dto.getFirstName());
        user.setLastName(dto.getLastName());
        user.setRole(dto.getRole());
        user.setPhone(dto.getPhone());
        user.setIsActive(true);
        this.save(user);
        log.info("新增用户 {}: {} ({})", user.getId(), user.getEmail(), user.getRole());
        return user;
    }

    @Override
    public User updateUser(Long id, UserUpdateDTO dto) {
        if (this.getById(id) == null) {
            throw BusinessException.notFound("用户不存在: " + id);
        }
        User patch = new User();
        patch.setId(id);
        patch.setFirstName(dto.getFirstName());
        patch.setLastName(dto.getLastName());
        patch.setRole(dto.getRole());
        patch.setPhone(dto.getPhone());
        patch.setIsActive(dto.getIsActive());
        if (StrUtil.isNotBlank(dto.getPassword())) {
            patch.setPassword(SecurityUtil.hashPassword(dto.getPassword()));
        }
        this.updateById(patch);
        if (Boolean.FALSE.equals(dto.getIsActive())) {
            // 停用后立即踢下线
            StpUtil.logout(id);
        }
        log.info("修改用户 {}", id);
        return this.getById(id);
    }

    @Override
    public void deleteUser(Long id, Long operatorId) {
        if (id.equals(operatorId)) {
            throw BusinessException.badRequest("不能删除当前登录用户");
        }
        if (this.getById(id) == null) {
            throw BusinessException.notFound("用户不存在: " + id);
        }
        this.removeById(id);
        StpUtil.logout(id);
        log.info("用户 {} 删除了用户 {}", operatorId, id);
    }

    @Override
    public User getByEmail(String email) {
        if (StrUtil.isBlank(email)) {
            return null;
        }
        return this.getOne(new LambdaQueryWrapper<User>().eq(User::getEmail, email.trim().toLowerCase()));
    }
}
