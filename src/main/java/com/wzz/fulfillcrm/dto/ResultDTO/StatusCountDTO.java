package com.wzz.fulfillcrm.dto.ResultDTO;

import com.wzz.fulfillcrm.enums.OrderStatus;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class StatusCountDTO {
    private OrderStatus status;
    private String label;
    private long count;
}
