package com.wzz.fulfillcrm.dto.ResultDTO;

import com.wzz.fulfillcrm.enums.VendorStatus;
import lombok.Data;

import java.math.BigDecimal;

@Data
public class VendorReportRowDTO {
    private Long id;
    private String name;
    private String legalName;
    private VendorStatus status;
    private long servicesCount;
    private long operationsCount;
    private BigDecimal totalSpent;
}
