package com.wzz.fulfillcrm.controller.sys;

import cn.dev33.satoken.annotation.SaCheckRole;
import cn.dev33.satoken.stp.StpUtil;
import com.wzz.fulfillcrm.common.Result;
import com.wzz.fulfillcrm.dto.CreatDTO.UserCreateDTO;
import com.wzz.fulfillcrm.dto.update.UserUpdateDTO;
import com.wzz.fulfillcrm.entity.User;
import com.wzz.fulfillcrm.service.UserService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 用户管理，仅管理员可用
 */
@RestController
@RequestMapping("/api/users")
@SaCheckRole("ADMIN")
public class UserController {

    private final UserService userService;

    public UserController(UserService userService) {
        this.userService = userService;
    }

    @GetMapping
    public Result<List<User>> list() {
        return Result.success(userService.listUsers());
    }

    @PostMapping
    public Result<User> create(@Valid @RequestBody UserCreateDTO dto) {
        return Result.success("创建成功", userService.createUser(dto));
    }

    @PutMapping("/{id}")
    public Result<User> update(@PathVariable("id") Long id, @Valid @RequestBody UserUpdateDTO dto) {
        return Result.success("更新成功", userService.updateUser(id, dto));
    }

    @DeleteMapping("/{id}")
    public Result<?> delete(@PathVariable("id") Long id) {
        userService.deleteUser(id, StpUtil.getLoginIdAsLong());
        return Result.success("删除成功", null);
    }
}
