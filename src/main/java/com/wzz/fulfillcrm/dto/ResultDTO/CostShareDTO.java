package com.wzz.fulfillcrm.dto.ResultDTO;

import com.wzz.fulfillcrm.enums.ServiceType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CostShareDTO {
    private ServiceType type;
    private String label;
    private BigDecimal value;
}
