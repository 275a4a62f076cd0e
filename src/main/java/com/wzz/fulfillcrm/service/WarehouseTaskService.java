package com.wzz.fulfillcrm.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.wzz.fulfillcrm.dto.CreatDTO.TaskItemCompleteDTO;
import com.wzz.fulfillcrm.dto.CreatDTO.WarehouseTaskCreateDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.WarehouseTaskDetailDTO;
import com.wzz.fulfillcrm.dto.update.WarehouseTaskUpdateDTO;
import com.wzz.fulfillcrm.entity.WarehouseTask;
import com.wzz.fulfillcrm.enums.TaskStatus;
import com.wzz.fulfillcrm.enums.TaskType;

import java.util.List;

/**
 * 仓库作业，状态只能沿 NEW → IN_PROGRESS → COMPLETED 推进，完成或取消后不可再改
 */
public interface WarehouseTaskService extends IService<WarehouseTask> {

    /**
     * 按优先级从高到低、创建时间倒序
     */
    List<WarehouseTask> listTasks(Long warehouseId, TaskType type, TaskStatus status, Long assignedToId, Long orderId);

    WarehouseTaskDetailDTO getDetail(Long id);

    WarehouseTaskDetailDTO createTask(WarehouseTaskCreateDTO dto);

    WarehouseTask updateTask(Long id, WarehouseTaskUpdateDTO dto);

    /**
     * 开始作业并指派给当前用户
     */
    WarehouseTask startTask(Long id, Long userId);

    /**
     * 完成一条明细并生成库存移动，全部明细完成后作业自动完成
     */
    WarehouseTaskDetailDTO completeItem(Long taskId, Long itemId, TaskItemCompleteDTO dto, Long userId);

    WarehouseTask cancelTask(Long id, String reason);

    /**
     * 只能删除新建或已取消的作业
     */
    void deleteTask(Long id);
}
