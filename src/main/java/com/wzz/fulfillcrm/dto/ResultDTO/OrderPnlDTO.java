package com.wzz.fulfillcrm.dto.ResultDTO;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.wzz.fulfillcrm.enums.MeasureUnit;
import com.wzz.fulfillcrm.enums.OrderStatus;
import com.wzz.fulfillcrm.enums.ServiceType;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 单个订单的损益报表
 * <p>
 * 收入取收入操作的已收金额，成本取成本操作的实际金额。
 */
@Data
public class OrderPnlDTO {

    private OrderHeader order;
    private List<ItemLine> items;
    private Income income;
    private Costs costs;
    private Pnl pnl;
    private UnitEconomics unitEconomics;

    @Data
    public static class OrderHeader {
        private Long id;
        private String orderNumber;
        private OrderStatus status;
        @JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss")
        private LocalDateTime orderDate;
        private String client;
    }

    @Data
    public static class ItemLine {
        private String sku;
        private String name;
        private Integer quantity;
        private BigDecimal weight;
        private BigDecimal volume;
    }

    @Data
    public static class Income {
        /**
         * 已收合计
         */
        private BigDecimal total;
        /**
         * 开票合计
         */
        private BigDecimal invoiced;
        private List<IncomeLine> details = new ArrayList<>();
    }

    @Data
    public static class IncomeLine {
        private BigDecimal invoiceAmount;
        private BigDecimal paidAmount;
        private String paymentMethod;
        @JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss")
        private LocalDateTime paymentDate;
    }

    @Data
    public static class Costs {
        private BigDecimal total;
        private Map<ServiceType, CostGroup> byType;
        private List<CostLine> details = new ArrayList<>();
    }

    @Data
    public static class CostGroup {
        private BigDecimal amount = BigDecimal.ZERO;
        private List<CostLine> items = new ArrayList<>();
    }

    @Data
    public static class CostLine {
        private String vendor;
        private String service;
        private ServiceType type;
        private MeasureUnit unit;
        private BigDecimal quantity;
        private BigDecimal unitPrice;
        private BigDecimal calculatedAmount;
        private BigDecimal actualAmount;
        @JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss")
        private LocalDateTime date;
    }

    @Data
    public static class Pnl {
        private BigDecimal revenue;
        private BigDecimal cost;
        private BigDecimal profit;
        private BigDecimal marginPercent;
    }

    @Data
    public static class UnitEconomics {
        private long totalItems;
        private BigDecimal revenuePerItem;
        private BigDecimal costPerItem;
        private BigDecimal profitPerItem;
    }
}
