package com.wzz.fulfillcrm.dto.CreatDTO;

import com.wzz.fulfillcrm.enums.UserRole;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class UserCreateDTO {

    @NotBlank(message = "邮箱不能为空")
    @Email(message = "邮箱格式不正确")
    private String email;

    @NotBlank(message = "密码不能为空")
    @Size(min = 6, message = "密码至少6位")
    private String password;

    @NotBlank(message = "名不能为空")
    private String firstName;

    @NotBlank(message = "姓不能为空")
    private String lastName;

    @NotNull(message = "角色不能为空")
    private UserRole role;

    private String phone;
}
