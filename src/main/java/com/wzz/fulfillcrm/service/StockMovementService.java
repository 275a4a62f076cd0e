package com.wzz.fulfillcrm.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.wzz.fulfillcrm.dto.CreatDTO.StockAdjustDTO;
import com.wzz.fulfillcrm.dto.CreatDTO.StockReceiveDTO;
import com.wzz.fulfillcrm.dto.CreatDTO.StockTransferDTO;
import com.wzz.fulfillcrm.dto.CreatDTO.StockWriteOffDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.MovementStatsDTO;
import com.wzz.fulfillcrm.entity.StockMovement;
import com.wzz.fulfillcrm.enums.MovementType;

import java.time.LocalDate;
import java.util.List;

/**
 * 库存移动：每次移动在同一事务内写流水并改变库存行数量，在库数量不允许为负
 */
public interface StockMovementService extends IService<StockMovement> {

    StockMovement receive(StockReceiveDTO dto, Long operatorId);

    StockMovement transfer(StockTransferDTO dto, Long operatorId);

    /**
     * 报损，商品成本大于 0 时追加一笔 借 91.2 / 贷 41 的分录
     */
    StockMovement writeOff(StockWriteOffDTO dto, Long operatorId);

    /**
     * 盘点调整，流水数量记录差额
     */
    StockMovement adjust(Long productId, StockAdjustDTO dto, Long operatorId);

    /**
     * 按流水上的类型与库位执行一次移动并落库，供作业明细完成时调用
     * <p>
     * INBOUND / RETURN 需要目标库位，OUTBOUND / WRITE_OFF 需要来源库位，TRANSFER 两者都要
     */
    StockMovement apply(StockMovement movement);

    List<StockMovement> listMovements(Long productId, MovementType movementType, Long warehouseId,
                                      LocalDate dateFrom, LocalDate dateTo, Integer limit);

    List<StockMovement> listByProduct(Long productId, Integer limit);

    List<StockMovement> listByLocation(Long locationId, Integer limit);

    List<StockMovement> listByTask(Long taskId);

    MovementStatsDTO stats(LocalDate dateFrom, LocalDate dateTo);
}
