package com.wzz.fulfillcrm.dto.CreatDTO;

import com.wzz.fulfillcrm.enums.AccountType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * 新增科目，余额从 0 开始，只能由记账分录改变
 */
@Data
public class AccountCreateDTO {

    @NotBlank(message = "科目代码不能为空")
    private String code;

    @NotBlank(message = "科目名称不能为空")
    private String name;

    @NotNull(message = "科目类型不能为空")
    private AccountType type;

    private String currency;

    private String description;
}
