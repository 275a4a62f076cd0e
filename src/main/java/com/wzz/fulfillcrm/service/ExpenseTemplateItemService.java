package com.wzz.fulfillcrm.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.wzz.fulfillcrm.entity.ExpenseTemplateItem;

import java.util.List;
import java.util.Map;

public interface ExpenseTemplateItemService extends IService<ExpenseTemplateItem> {

    /**
     * 查询模板明细，按 sortOrder 排序
     */
    List<ExpenseTemplateItem> listByTemplate(Long templateId);

    /**
     * 批量查询多个模板的明细，按模板ID分组
     */
    Map<Long, List<ExpenseTemplateItem>> groupByTemplate(List<Long> templateIds);

    void removeByTemplate(Long templateId);
}
