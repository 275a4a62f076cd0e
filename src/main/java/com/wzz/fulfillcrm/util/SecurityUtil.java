package com.wzz.fulfillcrm.util;

import cn.dev33.satoken.exception.SaTokenException;
import cn.dev33.satoken.stp.StpUtil;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

/**
 * 安全相关工具类
 */
public final class SecurityUtil {

    private static final PasswordEncoder encoder = new BCryptPasswordEncoder();

    private SecurityUtil() {}

    public static String hashPassword(String rawPassword) {
        return encoder.encode(rawPassword);
    }

    public static boolean verifyPassword(String rawPassword, String encodedPassword) {
        if (rawPassword == null || encodedPassword == null) {
            return false;
        }
        return encoder.matches(rawPassword, encodedPassword);
    }

    /**
     * 当前登录用户ID，未登录时返回 null（如启动任务、测试中直接调用服务）
     */
    public static Long currentUserIdOrNull() {
        try {
            return StpUtil.isLogin() ? StpUtil.getLoginIdAsLong() : null;
        } catch (IllegalStateException | SaTokenException e) {
            // 非 Web 请求上下文
            return null;
        }
    }
}
