package com.wzz.fulfillcrm.controller.warehouse;

import cn.dev33.satoken.annotation.SaCheckRole;
import cn.dev33.satoken.annotation.SaMode;
import cn.dev33.satoken.stp.StpUtil;
import com.wzz.fulfillcrm.common.Result;
import com.wzz.fulfillcrm.dto.CreatDTO.TaskItemCompleteDTO;
import com.wzz.fulfillcrm.dto.CreatDTO.WarehouseTaskCreateDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.WarehouseTaskDetailDTO;
import com.wzz.fulfillcrm.dto.update.TaskCancelDTO;
import com.wzz.fulfillcrm.dto.update.WarehouseTaskUpdateDTO;
import com.wzz.fulfillcrm.entity.WarehouseTask;
import com.wzz.fulfillcrm.enums.TaskStatus;
import com.wzz.fulfillcrm.enums.TaskType;
import com.wzz.fulfillcrm.service.WarehouseTaskService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 仓库作业接口；开始作业和完成明细不限角色，由现场人员执行
 */
@RestController
@RequestMapping("/api/warehouse-tasks")
public class WarehouseTaskController {

    private final WarehouseTaskService warehouseTaskService;

    public WarehouseTaskController(WarehouseTaskService warehouseTaskService) {
        this.warehouseTaskService = warehouseTaskService;
    }

    @GetMapping
    public Result<List<WarehouseTask>> list(@RequestParam(required = false) Long warehouseId,
                                            @RequestParam(required = false) TaskType type,
                                            @RequestParam(required = false) TaskStatus status,
                                            @RequestParam(required = false) Long assignedToId,
                                            @RequestParam(required = false) Long orderId) {
        return Result.success(warehouseTaskService.listTasks(warehouseId, type, status, assignedToId, orderId));
    }

    @GetMapping("/{id}")
    public Result<WarehouseTaskDetailDTO> get(@PathVariable("id") Long id) {
        return Result.success(warehouseTaskService.getDetail(id));
    }

    @SaCheckRole(value = {"ADMIN", "MANAGER"}, mode = SaMode.OR)
    @PostMapping
    public Result<WarehouseTaskDetailDTO> create(@Valid @RequestBody WarehouseTaskCreateDTO dto) {
        return Result.success("创建成功", warehouseTaskService.createTask(dto));
    }

    @SaCheckRole(value = {"ADMIN", "MANAGER"}, mode = SaMode.OR)
    @PutMapping("/{id}")
    public Result<WarehouseTask> update(@PathVariable("id") Long id, @RequestBody WarehouseTaskUpdateDTO dto) {
        return Result.success("更新成功", warehouseTaskService.updateTask(id, dto));
    }

    @PostMapping("/{id}/start")
    public Result<WarehouseTask> start(@PathVariable("id") Long id) {
        return Result.success("已开始", warehouseTaskService.startTask(id, StpUtil.getLoginIdAsLong()));
    }

    @PostMapping("/{taskId}/items/{itemId}/complete")
    public Result<WarehouseTaskDetailDTO> completeItem(@PathVariable("taskId") Long taskId,
                                                       @PathVariable("itemId") Long itemId,
                                                       @Valid @RequestBody(required = false) TaskItemCompleteDTO dto) {
        return Result.success("明细已完成",
                warehouseTaskService.completeItem(taskId, itemId, dto, StpUtil.getLoginIdAsLong()));
    }

    @SaCheckRole(value = {"ADMIN", "MANAGER"}, mode = SaMode.OR)
    @PostMapping("/{id}/cancel")
    public Result<WarehouseTask> cancel(@PathVariable("id") Long id,
                                        @RequestBody(required = false) TaskCancelDTO dto) {
        return Result.success("已取消", warehouseTaskService.cancelTask(id, dto != null ? dto.getReason() : null));
    }

    @SaCheckRole("ADMIN")
    @DeleteMapping("/{id}")
    public Result<?> delete(@PathVariable("id") Long id) {
        warehouseTaskService.deleteTask(id);
        return Result.success("删除成功", null);
    }
}
