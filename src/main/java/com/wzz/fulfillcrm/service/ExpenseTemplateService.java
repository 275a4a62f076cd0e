package com.wzz.fulfillcrm.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.wzz.fulfillcrm.dto.CreatDTO.ExpenseTemplateCreateDTO;
import com.wzz.fulfillcrm.entity.ExpenseTemplate;

import java.util.List;

public interface ExpenseTemplateService extends IService<ExpenseTemplate> {

    /**
     * 查询模板列表（含明细），按名称排序
     *
     * @param activeOnly 仅查询启用的模板
     */
    List<ExpenseTemplate> listTemplates(boolean activeOnly);

    /**
     * 查询单个模板（含明细），不存在时 404
     */
    ExpenseTemplate getTemplate(Long id);

    ExpenseTemplate createTemplate(ExpenseTemplateCreateDTO dto);

    /**
     * 修改模板，明细整体替换
     */
    ExpenseTemplate updateTemplate(Long id, ExpenseTemplateCreateDTO dto);

    void deleteTemplate(Long id);

    /**
     * 复制模板及明细，名称追加 " (copy)"
     */
    ExpenseTemplate duplicateTemplate(Long id);
}
