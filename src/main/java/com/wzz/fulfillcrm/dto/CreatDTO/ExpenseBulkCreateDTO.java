package com.wzz.fulfillcrm.dto.CreatDTO;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

import java.util.List;

@Data
public class ExpenseBulkCreateDTO {

    @Valid
    @NotEmpty(message = "费用列表不能为空")
    private List<ExpenseCreateDTO> expenses;
}
