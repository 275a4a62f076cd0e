package com.wzz.fulfillcrm.dto.ResultDTO;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ExpenseCategoryDTO {

    /**
     * 枚举值
     */
    private String value;

    /**
     * 显示名称
     */
    private String name;

    /**
     * 中文描述
     */
    private String description;
}
