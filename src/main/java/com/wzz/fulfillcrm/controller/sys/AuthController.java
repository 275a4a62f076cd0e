package com.wzz.fulfillcrm.controller.sys;

import cn.dev33.satoken.stp.StpUtil;
import com.wzz.fulfillcrm.common.Result;
import com.wzz.fulfillcrm.dto.LoginDTO.LoginRequestDTO;
import com.wzz.fulfillcrm.dto.LoginDTO.LoginResultDTO;
import com.wzz.fulfillcrm.dto.update.PasswordUpdateDTO;
import com.wzz.fulfillcrm.entity.User;
import com.wzz.fulfillcrm.service.UserService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 登录认证接口
 */
@RestController
@RequestMapping("/api/auth")
public class AuthController {

    private final UserService userService;

    public AuthController(UserService userService) {
        this.userService = userService;
    }

    /**
     * 邮箱密码登录，返回 Bearer 令牌
     */
    @PostMapping("/login")
    public Result<LoginResultDTO> login(@Valid @RequestBody LoginRequestDTO loginDTO) {
        return Result.success("登录成功", userService.login(loginDTO));
    }

    @GetMapping("/me")
    public Result<User> me() {
        return Result.success(userService.me(StpUtil.getLoginIdAsLong()));
    }

    @PostMapping("/change-password")
    public Result<?> changePassword(@Valid @RequestBody PasswordUpdateDTO dto) {
        userService.changePassword(StpUtil.getLoginIdAsLong(), dto);
        return Result.success("密码已修改", null);
    }

    @PostMapping("/logout")
    public Result<?> logout() {
        StpUtil.logout();
        return Result.success("已退出登录", null);
    }
}
