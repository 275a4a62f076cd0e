package com.wzz.fulfillcrm.dto.update;

import com.wzz.fulfillcrm.enums.UserRole;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * 管理员修改用户信息，字段为空表示不修改
 */
@Data
public class UserUpdateDTO {
    private String firstName;
    private String lastName;
    private UserRole role;
    private String phone;
    private Boolean isActive;

    /**
     * 重置密码
     */
    @Size(min = 6, message = "密码至少6位")
    private String password;
}
