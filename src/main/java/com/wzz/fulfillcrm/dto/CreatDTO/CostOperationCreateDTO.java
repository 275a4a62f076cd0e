package com.wzz.fulfillcrm.dto.CreatDTO;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.wzz.fulfillcrm.enums.CostOperationType;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
public class CostOperationCreateDTO {

    @NotNull(message = "订单不能为空")
    private Long orderId;

    @NotNull(message = "供应商服务不能为空")
    private Long vendorServiceId;

    private CostOperationType operationType;

    @NotNull(message = "数量不能为空")
    @DecimalMin(value = "0", inclusive = false, message = "数量必须大于0")
    private BigDecimal quantity;

    /**
     * 为空时等于计算金额
     */
    private BigDecimal actualAmount;

    private String description;

    @JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss")
    private LocalDateTime operationDate;
}
