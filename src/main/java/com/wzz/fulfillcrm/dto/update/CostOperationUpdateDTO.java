package com.wzz.fulfillcrm.dto.update;

import com.wzz.fulfillcrm.enums.CostOperationType;
import jakarta.validation.constraints.DecimalMin;
import lombok.Data;

import java.math.BigDecimal;

/**
 * 修改成本操作，字段为空表示不修改；数量变化时按快照单价重算计算金额
 */
@Data
public class CostOperationUpdateDTO {

    @DecimalMin(value = "0", inclusive = false, message = "数量必须大于0")
    private BigDecimal quantity;

    private BigDecimal actualAmount;
    private CostOperationType operationType;
    private String description;
}
