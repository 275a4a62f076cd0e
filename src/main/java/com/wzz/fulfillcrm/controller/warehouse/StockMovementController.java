package com.wzz.fulfillcrm.controller.warehouse;

import cn.dev33.satoken.annotation.SaCheckRole;
import cn.dev33.satoken.annotation.SaMode;
import cn.dev33.satoken.stp.StpUtil;
import com.wzz.fulfillcrm.common.Result;
import com.wzz.fulfillcrm.dto.CreatDTO.StockReceiveDTO;
import com.wzz.fulfillcrm.dto.CreatDTO.StockTransferDTO;
import com.wzz.fulfillcrm.dto.CreatDTO.StockWriteOffDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.MovementStatsDTO;
import com.wzz.fulfillcrm.entity.StockMovement;
import com.wzz.fulfillcrm.enums.MovementType;
import com.wzz.fulfillcrm.service.StockMovementService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

/**
 * 库存移动接口
 */
@RestController
@RequestMapping("/api/stock-movements")
public class StockMovementController {

    private final StockMovementService stockMovementService;

    public StockMovementController(StockMovementService stockMovementService) {
        this.stockMovementService = stockMovementService;
    }

    @GetMapping
    public Result<List<StockMovement>> list(@RequestParam(required = false) Long productId,
                                            @RequestParam(required = false) MovementType movementType,
                                            @RequestParam(required = false) Long warehouseId,
                                            @RequestParam(required = false) LocalDate dateFrom,
                                            @RequestParam(required = false) LocalDate dateTo,
                                            @RequestParam(required = false) Integer limit) {
        return Result.success(stockMovementService.listMovements(productId, movementType, warehouseId,
                dateFrom, dateTo, limit));
    }

    @GetMapping("/product/{productId}")
    public Result<List<StockMovement>> byProduct(@PathVariable("productId") Long productId,
                                                 @RequestParam(required = false) Integer limit) {
        return Result.success(stockMovementService.listByProduct(productId, limit));
    }

    @GetMapping("/location/{locationId}")
    public Result<List<StockMovement>> byLocation(@PathVariable("locationId") Long locationId,
                                                  @RequestParam(required = false) Integer limit) {
        return Result.success(stockMovementService.listByLocation(locationId, limit));
    }

    @GetMapping("/stats")
    public Result<MovementStatsDTO> stats(@RequestParam(required = false) LocalDate dateFrom,
                                          @RequestParam(required = false) LocalDate dateTo) {
        return Result.success(stockMovementService.stats(dateFrom, dateTo));
    }

    @SaCheckRole(value = {"ADMIN", "MANAGER"}, mode = SaMode.OR)
    @PostMapping
    public Result<StockMovement> receive(@Valid @RequestBody StockReceiveDTO dto) {
        return Result.success("入库成功", stockMovementService.receive(dto, StpUtil.getLoginIdAsLong()));
    }

    @SaCheckRole(value = {"ADMIN", "MANAGER"}, mode = SaMode.OR)
    @PostMapping("/transfer")
    public Result<StockMovement> transfer(@Valid @RequestBody StockTransferDTO dto) {
        return Result.success("移库成功", stockMovementService.transfer(dto, StpUtil.getLoginIdAsLong()));
    }

    @SaCheckRole(value = {"ADMIN", "MANAGER"}, mode = SaMode.OR)
    @PostMapping("/write-off")
    public Result<StockMovement> writeOff(@Valid @RequestBody StockWriteOffDTO dto) {
        return Result.success("报损成功", stockMovementService.writeOff(dto, StpUtil.getLoginIdAsLong()));
    }
}
