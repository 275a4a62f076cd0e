package com.wzz.fulfillcrm.dto.CreatDTO;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

@Data
public class OrderCreateDTO {

    @NotNull(message = "客户不能为空")
    private Long clientId;

    private String shippingAddress;

    private String notes;

    /**
     * 订单收入，为空时按 预估成本 × 客户费率 计算
     */
    @DecimalMin(value = "0", message = "收入不能为负")
    private BigDecimal incomeAmount;

    /**
     * 是否根据供应商报价自动生成成本操作，为空时取配置 crm.order.auto-estimate-costs
     */
    private Boolean estimateCosts;

    @Valid
    private List<OrderItemDTO> items = new ArrayList<>();
}
