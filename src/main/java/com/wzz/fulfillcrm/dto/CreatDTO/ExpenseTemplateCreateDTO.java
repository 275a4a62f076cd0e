package com.wzz.fulfillcrm.dto.CreatDTO;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * 费用模板新增/修改，修改时明细整体替换
 */
@Data
public class ExpenseTemplateCreateDTO {

    @NotBlank(message = "模板名称不能为空")
    private String name;

    private String description;
    private String productCategory;
    private BigDecimal minWeight;
    private BigDecimal maxWeight;
    private String deliveryMethod;
    private String region;
    private Boolean isActive;

    /**
     * 明细，按列表顺序生成 sortOrder
     */
    @Valid
    private List<ExpenseTemplateItemDTO> items = new ArrayList<>();
}
