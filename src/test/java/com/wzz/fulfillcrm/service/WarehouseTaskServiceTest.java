package com.wzz.fulfillcrm.service;

import com.wzz.fulfillcrm.dto.CreatDTO.StockReceiveDTO;
import com.wzz.fulfillcrm.dto.CreatDTO.TaskItemCompleteDTO;
import com.wzz.fulfillcrm.dto.CreatDTO.WarehouseTaskCreateDTO;
import com.wzz.fulfillcrm.dto.CreatDTO.WarehouseTaskItemDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.WarehouseTaskDetailDTO;
import com.wzz.fulfillcrm.dto.update.WarehouseTaskUpdateDTO;
import com.wzz.fulfillcrm.entity.Product;
import com.wzz.fulfillcrm.entity.StorageLocation;
import com.wzz.fulfillcrm.entity.Warehouse;
import com.wzz.fulfillcrm.entity.WarehouseTask;
import com.wzz.fulfillcrm.enums.MovementType;
import com.wzz.fulfillcrm.enums.TaskPriority;
import com.wzz.fulfillcrm.enums.TaskStatus;
import com.wzz.fulfillcrm.enums.TaskType;
import com.wzz.fulfillcrm.exception.BusinessException;
import com.wzz.fulfillcrm.support.BaseIntegrationTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WarehouseTaskServiceTest extends BaseIntegrationTest {

    @Autowired
    private WarehouseTaskService warehouseTaskService;

    @Autowired
    private StockMovementService stockMovementService;

    private Warehouse warehouse;
    private StorageLocation dock;
    private StorageLocation shelf;
    private Product product;

    @BeforeEach
    void setUp() {
        warehouse = newWarehouse("T-WH1");
        dock = newLocation(warehouse.getId(), "DOCK");
        shelf = newLocation(warehouse.getId(), "A-01");
        product = newProduct("T-SKU1", "10");
    }

    private WarehouseTaskItemDTO item(int expected, StorageLocation from, StorageLocation to) {
        WarehouseTaskItemDTO dto = new WarehouseTaskItemDTO();
        dto.setProductId(product.getId());
        dto.setExpectedQty(expected);
        dto.setFromLocationId(from == null ? null : from.getId());
        dto.setToLocationId(to == null ? null : to.getId());
        return dto;
    }

    private WarehouseTaskDetailDTO task(TaskType type, TaskPriority priority, WarehouseTaskItemDTO... items) {
        WarehouseTaskCreateDTO dto = new WarehouseTaskCreateDTO();
        dto.setWarehouseId(warehouse.getId());
        dto.setType(type);
        dto.setPriority(priority);
        dto.setItems(Arrays.asList(items));
        return warehouseTaskService.createTask(dto);
    }

    private int quantityAt(StorageLocation location) {
        return productService.listStocks(null, product.getId()).stream()
                .filter(s -> s.getStock().getStorageLocationId().equals(location.getId()))
                .mapToInt(s -> s.getStock().getQuantity())
                .sum();
    }

    private void stockDock(int quantity) {
        StockReceiveDTO dto = new StockReceiveDTO();
        dto.setProductId(product.getId());
        dto.setToLocationId(dock.getId());
        dto.setQuantity(quantity);
        stockMovementService.receive(dto, adminId());
    }

    @Test
    void taskNumbersAreSequentialPerDay() {
        String prefix = "WT-" + LocalDate.now().format(DateTimeFormatter.ofPattern("yyyyMMdd")) + "-";

        WarehouseTask first = task(TaskType.RECEIVING, null, item(1, null, shelf)).getTask();
        WarehouseTask second = task(TaskType.RECEIVING, null, item(1, null, shelf)).getTask();

        assertThat(first.getTaskNumber()).startsWith(prefix).hasSize(prefix.length() + 4);
        int n1 = Integer.parseInt(first.getTaskNumber().substring(prefix.length()));
        int n2 = Integer.parseInt(second.getTaskNumber().substring(prefix.length()));
        assertThat(n2).isEqualTo(n1 + 1);
        assertThat(first.getStatus()).isEqualTo(TaskStatus.NEW);
        assertThat(first.getPriority()).isEqualTo(TaskPriority.NORMAL);
    }

    @Test
    void completingAllItemsMovesStockAndCompletesTask() {
        stockDock(8);
        WarehouseTaskDetailDTO created = task(TaskType.PLACEMENT, TaskPriority.HIGH,
                item(5, dock, shelf), item(3, dock, shelf));
        Long taskId = created.getTask().getId();

        WarehouseTaskDetailDTO afterFirst = warehouseTaskService.completeItem(taskId,
                created.getItems().get(0).getId(), null, adminId());

        assertThat(afterFirst.getTask().getStatus()).isEqualTo(TaskStatus.IN_PROGRESS);
        assertThat(afterFirst.getTask().getStartedAt()).isNotNull();
        assertThat(afterFirst.getTask().getAssignedToId()).isEqualTo(adminId());

        TaskItemCompleteDTO partial = new TaskItemCompleteDTO();
        partial.setActualQty(2);
        WarehouseTaskDetailDTO done = warehouseTaskService.completeItem(taskId,
                created.getItems().get(1).getId(), partial, adminId());

        assertThat(done.getTask().getStatus()).isEqualTo(TaskStatus.COMPLETED);
        assertThat(done.getTask().getCompletedAt()).isNotNull();
        assertThat(done.getItems()).allSatisfy(i -> assertThat(i.getIsCompleted()).isTrue());
        assertThat(done.getItems().get(1).getActualQty()).isEqualTo(2);
        assertThat(done.getMovements()).hasSize(2)
                .allSatisfy(m -> {
                    assertThat(m.getMovementType()).isEqualTo(MovementType.TRANSFER);
                    assertThat(m.getTaskId()).isEqualTo(taskId);
                });
        assertThat(quantityAt(dock)).isEqualTo(1);
        assertThat(quantityAt(shelf)).isEqualTo(7);
    }

    @Test
    void inventoryTaskSetsCountedQuantity() {
        stockDock(10);
        WarehouseTaskDetailDTO created = task(TaskType.INVENTORY, null, item(10, dock, null));

        TaskItemCompleteDTO counted = new TaskItemCompleteDTO();
        counted.setActualQty(9);
        WarehouseTaskDetailDTO done = warehouseTaskService.completeItem(created.getTask().getId(),
                created.getItems().get(0).getId(), counted, adminId());

        assertThat(quantityAt(dock)).isEqualTo(9);
        assertThat(done.getMovements()).singleElement()
                .satisfies(m -> {
                    assertThat(m.getMovementType()).isEqualTo(MovementType.ADJUSTMENT);
                    assertThat(m.getQuantity()).isEqualTo(-1);
                });
    }

    @Test
    void failedItemLeavesTaskAndStockUntouched() {
        stockDock(1);
        WarehouseTaskDetailDTO created = task(TaskType.SHIPPING, null, item(5, dock, null));

        assertThatThrownBy(() -> warehouseTaskService.completeItem(created.getTask().getId(),
                created.getItems().get(0).getId(), null, adminId()))
                .isInstanceOf(BusinessException.class)
                .extracting("code").isEqualTo(400);
        assertThat(quantityAt(dock)).isEqualTo(1);
    }

    @Test
    void completedItemCannotBeCompletedAgain() {
        stockDock(4);
        WarehouseTaskDetailDTO created = task(TaskType.PICKING, null, item(1, dock, shelf), item(1, dock, shelf));
        Long taskId = created.getTask().getId();
        Long itemId = created.getItems().get(0).getId();
        warehouseTaskService.completeItem(taskId, itemId, null, adminId());

        assertThatThrownBy(() -> warehouseTaskService.completeItem(taskId, itemId, null, adminId()))
                .isInstanceOf(BusinessException.class)
                .extracting("code").isEqualTo(400);
    }

    @Test
    void statusCannotJumpFromNewToCompleted() {
        WarehouseTask created = task(TaskType.RECEIVING, null, item(1, null, shelf)).getTask();
        WarehouseTaskUpdateDTO dto = new WarehouseTaskUpdateDTO();
        dto.setStatus(TaskStatus.COMPLETED);

        assertThatThrownBy(() -> warehouseTaskService.updateTask(created.getId(), dto))
                .isInstanceOf(BusinessException.class)
                .extracting("code").isEqualTo(400);
    }

    @Test
    void startOnlyFromNew() {
        WarehouseTask created = task(TaskType.RECEIVING, null, item(1, null, shelf)).getTask();

        WarehouseTask started = warehouseTaskService.startTask(created.getId(), adminId());

        assertThat(started.getStatus()).isEqualTo(TaskStatus.IN_PROGRESS);
        assertThat(started.getStartedAt()).isNotNull();
        assertThatThrownBy(() -> warehouseTaskService.startTask(created.getId(), adminId()))
                .isInstanceOf(BusinessException.class)
                .extracting("code").isEqualTo(400);
    }

    @Test
    void finishedTaskCannotBeCancelledOrDeleted() {
        WarehouseTaskDetailDTO created = task(TaskType.RECEIVING, null, item(2, null, shelf));
        Long taskId = created.getTask().getId();
        warehouseTaskService.completeItem(taskId, created.getItems().get(0).getId(), null, adminId());

        assertThatThrownBy(() -> warehouseTaskService.cancelTask(taskId, "late"))
                .isInstanceOf(BusinessException.class)
                .extracting("code").isEqualTo(400);
        assertThatThrownBy(() -> warehouseTaskService.deleteTask(taskId))
                .isInstanceOf(BusinessException.class)
                .extracting("code").isEqualTo(400);
        assertThat(quantityAt(shelf)).isEqualTo(2);
    }

    @Test
    void cancelledTaskKeepsReasonAndCanBeDeleted() {
        WarehouseTask created = task(TaskType.RECEIVING, null, item(1, null, shelf)).getTask();

        WarehouseTask cancelled = warehouseTaskService.cancelTask(created.getId(), "供应商未到货");

        assertThat(cancelled.getStatus()).isEqualTo(TaskStatus.CANCELLED);
        assertThat(cancelled.getNotes()).isEqualTo("已取消: 供应商未到货");
        warehouseTaskService.deleteTask(created.getId());
        assertThat(warehouseTaskService.getById(created.getId())).isNull();
    }

    @Test
    void listIsOrderedByPriority() {
        WarehouseTask low = task(TaskType.RECEIVING, TaskPriority.LOW, item(1, null, shelf)).getTask();
        WarehouseTask urgent = task(TaskType.RECEIVING, TaskPriority.URGENT, item(1, null, shelf)).getTask();
        WarehouseTask normal = task(TaskType.RECEIVING, null, item(1, null, shelf)).getTask();

        List<Long> ids = warehouseTaskService.listTasks(warehouse.getId(), null, null, null, null).stream()
                .map(WarehouseTask::getId).collect(Collectors.toList());

        assertThat(ids).containsExactly(urgent.getId(), normal.getId(), low.getId());
    }

    @Test
    void unknownWarehouseIsNotFound() {
        WarehouseTaskCreateDTO dto = new WarehouseTaskCreateDTO();
        dto.setWarehouseId(-1L);
        dto.setType(TaskType.PICKING);
        dto.setItems(Collections.emptyList());

        assertThatThrownBy(() -> warehouseTaskService.createTask(dto))
                .isInstanceOf(BusinessException.class)
                .extracting("code").isEqualTo(404);
    }
}
