package com.wzz.fulfillcrm.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.wzz.fulfillcrm.dto.ResultDTO.ClientDetailDTO;
import com.wzz.fulfillcrm.entity.Client;

import java.util.List;

public interface ClientService extends IService<Client> {

    /**
     * 按名称、公司名、邮箱、税号模糊查询
     */
    List<Client> listClients(String search, Boolean isActive);

    /**
     * 客户详情，附带最近订单与累计收入、利润
     */
    ClientDetailDTO getDetail(Long id);

    Client createClient(Client client);

    Client updateClient(Long id, Client patch);

    void deleteClient(Long id);
}
