package com.wzz.fulfillcrm.dto.ResultDTO;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ClientsReportDTO {

    /**
     * 按利润倒序
     */
    private List<ClientReportRowDTO> clients;

    private Summary summary;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Summary {
        private int totalClients;
        private int activeClients;
        private BigDecimal totalRevenue;
        private BigDecimal totalProfit;
    }
}
