package com.wzz.fulfillcrm.dto.ResultDTO;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TopClientDTO {
    private Long id;
    private String name;
    private String companyName;
    private int ordersCount;
    private BigDecimal revenue;
    private BigDecimal profit;
}
