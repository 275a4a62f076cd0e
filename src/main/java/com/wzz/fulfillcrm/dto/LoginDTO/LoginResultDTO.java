package com.wzz.fulfillcrm.dto.LoginDTO;

import com.wzz.fulfillcrm.entity.User;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LoginResultDTO {

    /**
     * 访问令牌，请求时放入 Authorization: Bearer {token}
     */
    private String token;

    private User user;
}
