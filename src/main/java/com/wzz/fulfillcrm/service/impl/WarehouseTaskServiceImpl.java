package com.wzz.fulfillcrm.service.impl;

import cn.hutool.core.util.StrUtil;
import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.wzz.fulfillcrm.common.Constants;
import com.wzz.fulfillcrm.dto.CreatDTO.StockAdjustDTO;
import com.wzz.fulfillcrm.dto.CreatDTO.TaskItemCompleteDTO;
import com.wzz.fulfillcrm.dto.CreatDTO.WarehouseTaskCreateDTO;
import com.wzz.fulfillcrm.dto.CreatDTO.WarehouseTaskItemDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.WarehouseTaskDetailDTO;
import com.wzz.fulfillcrm.dto.update.WarehouseTaskUpdateDTO;
import com.wzz.fulfillcrm.entity.StockMovement;
import com.wzz.fulfillcrm.entity.Warehouse;
import com.wzz.fulfillcrm.entity.WarehouseTask;
import com.wzz.fulfillcrm.entity.WarehouseTaskItem;
import com.wzz.fulfillcrm.enums.MovementType;
import com.wzz.fulfillcrm.enums.TaskPriority;
import com.wzz.fulfillcrm.enums.TaskStatus;
import com.wzz.fulfillcrm.enums.TaskType;
import com.wzz.fulfillcrm.exception.BusinessException;
import com.wzz.fulfillcrm.mapper.OrderMapper;
import com.wzz.fulfillcrm.mapper.WarehouseTaskItemMapper;
import com.wzz.fulfillcrm.mapper.WarehouseTaskMapper;
import com.wzz.fulfillcrm.service.ProductService;
import com.wzz.fulfillcrm.service.StockMovementService;
import com.wzz.fulfillcrm.service.StorageLocationService;
import com.wzz.fulfillcrm.service.WarehouseService;
import com.wzz.fulfillcrm.service.WarehouseTaskService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

@Slf4j
@Service
public class WarehouseTaskServiceImpl extends ServiceImpl<WarehouseTaskMapper, WarehouseTask>
        implements WarehouseTaskService {

    private static final DateTimeFormatter TASK_NUMBER_DATE = DateTimeFormatter.ofPattern("yyyyMMdd");

    private static final Comparator<WarehouseTask> BY_PRIORITY = Comparator
            .comparing((WarehouseTask t) -> priorityOf(t).ordinal()).reversed()
            .thenComparing(WarehouseTask::getCreateTime, Comparator.nullsLast(Comparator.reverseOrder()));

    @Autowired
    private WarehouseService warehouseService;

    @Autowired
    private StorageLocationService storageLocationService;

    @Autowired
    private ProductService productService;

    @Autowired
    private StockMovementService stockMovementService;

    @Autowired
    private WarehouseTaskItemMapper taskItemMapper;

    @Autowired
    private OrderMapper orderMapper;

    @Override
    public List<WarehouseTask> listTasks(Long warehouseId, TaskType type, TaskStatus status,
                                         Long assignedToId, Long orderId) {
        List<WarehouseTask> tasks = this.list(new LambdaQueryWrapper<WarehouseTask>()
                .eq(warehouseId != null, WarehouseTask::getWarehouseId, warehouseId)
                .eq(type != null, WarehouseTask::getType, type)
                .eq(status != null, WarehouseTask::getStatus, status)
                .eq(assignedToId != null, WarehouseTask::getAssignedToId, assignedToId)
                .eq(orderId != null, WarehouseTask::getOrderId, orderId));
        return tasks.stream().sorted(BY_PRIORITY).collect(Collectors.toList());
    }

    @Override
    public WarehouseTaskDetailDTO getDetail(Long id) {
        return toDetail(requireTask(id));
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public WarehouseTaskDetailDTO createTask(WarehouseTaskCreateDTO dto) {
        warehouseService.requireWarehouse(dto.getWarehouseId());
        if (dto.getOrderId() != null && orderMapper.selectById(dto.getOrderId()) == null) {
            throw BusinessException.notFound("订单不存在: " + dto.getOrderId());
        }
        List<WarehouseTaskItemDTO> itemDtos = dto.getItems() == null ? Collections.emptyList() : dto.getItems();
        for (WarehouseTaskItemDTO itemDto : itemDtos) {
            if (itemDto.getProductId() == null) {
                throw BusinessException.badRequest("作业明细商品不能为空");
            }
            productService.requireProduct(itemDto.getProductId());
            if (itemDto.getFromLocationId() != null) {
                storageLocationService.requireLocation(itemDto.getFromLocationId());
            }
            if (itemDto.getToLocationId() != null) {
                storageLocationService.requireLocation(itemDto.getToLocationId());
            }
        }

        WarehouseTask task = new WarehouseTask();
        task.setTaskNumber(generateTaskNumber());
        task.setWarehouseId(dto.getWarehouseId());
        task.setOrderId(dto.getOrderId());
        task.setType(dto.getType());
        task.setStatus(TaskStatus.NEW);
        task.setPriority(dto.getPriority() != null ? dto.getPriority() : TaskPriority.NORMAL);
        task.setAssignedToId(dto.getAssignedToId());
        task.setPlannedDate(dto.getPlannedDate());
        task.setNotes(dto.getNotes());
        this.save(task);

        for (WarehouseTaskItemDTO itemDto : itemDtos) {
            WarehouseTaskItem item = new WarehouseTaskItem();
            item.setTaskId(task.getId());
            item.setProductId(itemDto.getProductId());
            item.setExpectedQty(itemDto.getExpectedQty() != null ? itemDto.getExpectedQty() : 0);
            item.setFromLocationId(itemDto.getFromLocationId());
            item.setToLocationId(itemDto.getToLocationId());
            item.setIsCompleted(false);
            item.setNotes(itemDto.getNotes());
            taskItemMapper.insert(item);
        }
        log.info("创建仓库作业 {} ({}), 类型 {}, 明细 {} 条", task.getId(), task.getTaskNumber(), task.getType(), itemDtos.size());
        return toDetail(task);
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public WarehouseTask updateTask(Long id, WarehouseTaskUpdateDTO dto) {
        WarehouseTask task = lockTask(id);
        if (task.getStatus().isFinished()) {
            throw BusinessException.badRequest("作业已结束，不能修改: " + task.getTaskNumber());
        }
        if (dto.getStatus() != null && dto.getStatus() != task.getStatus()) {
            changeStatus(task, dto.getStatus());
        }
        if (dto.getPriority() != null) {
            task.setPriority(dto.getPriority());
        }
        if (dto.getAssignedToId() != null) {
            task.setAssignedToId(dto.getAssignedToId());
        }
        if (dto.getPlannedDate() != null) {
            task.setPlannedDate(dto.getPlannedDate());
        }
        if (dto.getNotes() != null) {
            task.setNotes(dto.getNotes());
        }
        this.updateById(task);
        return task;
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public WarehouseTask startTask(Long id, Long userId) {
        WarehouseTask task = lockTask(id);
        if (task.getStatus() != TaskStatus.NEW) {
            throw BusinessException.badRequest("只能开始新建状态的作业，当前状态: " + task.getStatus().getDescription());
        }
        changeStatus(task, TaskStatus.IN_PROGRESS);
        task.setAssignedToId(userId);
        this.updateById(task);
        log.info("作业 {} 开始，执行人 {}", task.getTaskNumber(), userId);
        return task;
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public WarehouseTaskDetailDTO completeItem(Long taskId, Long itemId, TaskItemCompleteDTO dto, Long userId) {
        WarehouseTask task = lockTask(taskId);
        if (task.getStatus().isFinished()) {
            throw BusinessException.badRequest("作业已结束: " + task.getTaskNumber());
        }
        WarehouseTaskItem item = taskItemMapper.selectById(itemId);
        if (item == null || !taskId.equals(item.getTaskId())) {
            throw BusinessException.notFound("作业明细不存在: " + itemId);
        }
        if (Boolean.TRUE.equals(item.getIsCompleted())) {
            throw BusinessException.badRequest("作业明细已完成: " + itemId);
        }
        if (task.getStatus() == TaskStatus.NEW) {
            changeStatus(task, TaskStatus.IN_PROGRESS);
            if (task.getAssignedToId() == null) {
                task.setAssignedToId(userId);
            }
        }

        int quantity = dto != null && dto.getActualQty() != null ? dto.getActualQty() : item.getExpectedQty();
        Long targetId = dto != null && dto.getToLocationId() != null ? dto.getToLocationId() : item.getToLocationId();
        recordMovement(task, item, quantity, targetId, userId);

        item.setActualQty(quantity);
        item.setToLocationId(targetId);
        item.setIsCompleted(true);
        taskItemMapper.updateById(item);

        Long remaining = taskItemMapper.selectCount(new LambdaQueryWrapper<WarehouseTaskItem>()
                .eq(WarehouseTaskItem::getTaskId, taskId)
                .eq(WarehouseTaskItem::getIsCompleted, false));
        if (remaining == 0) {
            changeStatus(task, TaskStatus.COMPLETED);
            log.info("作业 {} 全部明细完成", task.getTaskNumber());
        }
        this.updateById(task);
        return toDetail(task);
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public WarehouseTask cancelTask(Long id, String reason) {
        WarehouseTask task = lockTask(id);
        if (task.getStatus().isFinished()) {
            throw BusinessException.badRequest("作业已结束，不能取消: " + task.getTaskNumber());
        }
        changeStatus(task, TaskStatus.CANCELLED);
        String note = "已取消" + (StrUtil.isNotBlank(reason) ? ": " + reason.trim() : "");
        task.setNotes(StrUtil.isBlank(task.getNotes()) ? note : task.getNotes() + "\n" + note);
        this.updateById(task);
        log.info("作业 {} 已取消", task.getTaskNumber());
        return task;
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public void deleteTask(Long id) {
        WarehouseTask task = lockTask(id);
        if (task.getStatus() != TaskStatus.NEW && task.getStatus() != TaskStatus.CANCELLED) {
            throw BusinessException.badRequest("只能删除新建或已取消的作业: " + task.getTaskNumber());
        }
        taskItemMapper.delete(new LambdaQueryWrapper<WarehouseTaskItem>().eq(WarehouseTaskItem::getTaskId, id));
        this.removeById(id);
        log.info("删除仓库作业 {} ({})", id, task.getTaskNumber());
    }

    /**
     * 盘点作业按实际数量做绝对调整，其余类型按作业类型生成一笔库存移动；数量为 0 时不生成移动
     */
    private void recordMovement(WarehouseTask task, WarehouseTaskItem item, int quantity, Long targetId, Long userId) {
        String reason = "作业 " + task.getTaskNumber();
        if (task.getType() == TaskType.INVENTORY) {
            Long locationId = targetId != null ? targetId : item.getFromLocationId();
            if (locationId == null) {
                throw BusinessException.badRequest("盘点明细缺少库位");
            }
            StockAdjustDTO adjust = new StockAdjustDTO();
            adjust.setLocationId(locationId);
            adjust.setQuantity(quantity);
            adjust.setReason(reason);
            StockMovement movement = stockMovementService.adjust(item.getProductId(), adjust, userId);
            stockMovementService.update(new LambdaUpdateWrapper<StockMovement>()
                    .set(StockMovement::getTaskId, task.getId())
                    .set(StockMovement::getOrderId, task.getOrderId())
                    .eq(StockMovement::getId, movement.getId()));
            return;
        }
        if (quantity == 0) {
            return;
        }
        MovementType type = task.getType().movementType();
        StockMovement movement = new StockMovement();
        movement.setProductId(item.getProductId());
        movement.setQuantity(quantity);
        movement.setMovementType(type);
        movement.setFromLocationId(type == MovementType.INBOUND ? null : item.getFromLocationId());
        movement.setToLocationId(type == MovementType.OUTBOUND ? null : targetId);
        movement.setTaskId(task.getId());
        movement.setOrderId(task.getOrderId());
        movement.setReason(reason);
        movement.setCreatedBy(userId);
        stockMovementService.apply(movement);
    }

    private void changeStatus(WarehouseTask task, TaskStatus target) {
        if (!task.getStatus().canTransitionTo(target)) {
            throw BusinessException.badRequest("作业状态不能从 " + task.getStatus().getDescription()
                    + " 变为 " + target.getDescription());
        }
        LocalDateTime now = LocalDateTime.now();
        if (target == TaskStatus.IN_PROGRESS && task.getStartedAt() == null) {
            task.setStartedAt(now);
        }
        if (target == TaskStatus.COMPLETED) {
            task.setCompletedAt(now);
        }
        task.setStatus(target);
    }

    private WarehouseTask requireTask(Long id) {
        WarehouseTask task = this.getById(id);
        if (task == null) {
            throw BusinessException.notFound("仓库作业不存在: " + id);
        }
        return task;
    }

    private WarehouseTask lockTask(Long id) {
        WarehouseTask task = baseMapper.selectByIdForUpdate(id);
        if (task == null) {
            throw BusinessException.notFound("仓库作业不存在: " + id);
        }
        return task;
    }

    private WarehouseTaskDetailDTO toDetail(WarehouseTask task) {
        Warehouse warehouse = warehouseService.getById(task.getWarehouseId());
        List<WarehouseTaskItem> items = taskItemMapper.selectList(new LambdaQueryWrapper<WarehouseTaskItem>()
                .eq(WarehouseTaskItem::getTaskId, task.getId())
                .orderByAsc(WarehouseTaskItem::getId));
        return new WarehouseTaskDetailDTO(task, warehouse == null ? null : warehouse.getName(), items,
                stockMovementService.listByTask(task.getId()));
    }

    /**
     * 当日流水号递增：WT-20240115-0001
     */
    private String generateTaskNumber() {
        String prefix = Constants.TASK_NUMBER_PREFIX + LocalDate.now().format(TASK_NUMBER_DATE) + "-";
        WarehouseTask last = this.getOne(new LambdaQueryWrapper<WarehouseTask>()
                .likeRight(WarehouseTask::getTaskNumber, prefix)
                .orderByDesc(WarehouseTask::getTaskNumber)
                .last("LIMIT 1"));
        int next = 1;
        if (last != null) {
            next = Integer.parseInt(last.getTaskNumber().substring(prefix.length())) + 1;
        }
        return prefix + String.format("%04d", next);
    }

    private static TaskPriority priorityOf(WarehouseTask task) {
        return task.getPriority() != null ? task.getPriority() : TaskPriority.NORMAL;
    }
}
