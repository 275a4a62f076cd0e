package com.wzz.fulfillcrm.controller.crm;

import cn.dev33.satoken.annotation.SaCheckRole;
import cn.dev33.satoken.annotation.SaMode;
import com.wzz.fulfillcrm.common.Result;
import com.wzz.fulfillcrm.dto.ResultDTO.ClientDetailDTO;
import com.wzz.fulfillcrm.entity.Client;
import com.wzz.fulfillcrm.service.ClientService;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 客户接口
 */
@RestController
@RequestMapping("/api/clients")
public class ClientController {

    private final ClientService clientService;

    public ClientController(ClientService clientService) {
        this.clientService = clientService;
    }

    @GetMapping
    public Result<List<Client>> list(@RequestParam(required = false) String search,
                                     @RequestParam(required = false) Boolean isActive) {
        return Result.success(clientService.listClients(search, isActive));
    }

    @GetMapping("/{id}")
    public Result<ClientDetailDTO> get(@PathVariable("id") Long id) {
        return Result.success(clientService.getDetail(id));
    }

    @SaCheckRole(value = {"ADMIN", "MANAGER"}, mode = SaMode.OR)
    @PostMapping
    public Result<Client> create(@RequestBody Client client) {
        return Result.success("创建成功", clientService.createClient(client));
    }

    @SaCheckRole(value = {"ADMIN", "MANAGER"}, mode = SaMode.OR)
    @PutMapping("/{id}")
    public Result<Client> update(@PathVariable("id") Long id, @RequestBody Client client) {
        return Result.success("更新成功", clientService.updateClient(id, client));
    }

    @SaCheckRole("ADMIN")
    @DeleteMapping("/{id}")
    public Result<?> delete(@PathVariable("id") Long id) {
        clientService.deleteClient(id);
        return Result.success("删除成功", null);
    }
}
