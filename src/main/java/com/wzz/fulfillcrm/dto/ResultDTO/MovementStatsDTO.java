package com.wzz.fulfillcrm.dto.ResultDTO;

import com.wzz.fulfillcrm.enums.MovementType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MovementStatsDTO {

    private List<TypeCount> byType;

    /**
     * 今日移动笔数
     */
    private long todayCount;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TypeCount {
        private MovementType movementType;
        private long count;
        private long totalQuantity;
    }
}
