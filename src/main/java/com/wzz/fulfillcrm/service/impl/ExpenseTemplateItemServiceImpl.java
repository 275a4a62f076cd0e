package com.wzz.fulfillcrm.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.wzz.fulfillcrm.entity.ExpenseTemplateItem;
import com.wzz.fulfillcrm.mapper.ExpenseTemplateItemMapper;
import com.wzz.fulfillcrm.service.ExpenseTemplateItemService;
import org.springframework.stereotype.Service;
import org.springframework.util.CollectionUtils;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Service
public class ExpenseTemplateItemServiceImpl extends ServiceImpl<ExpenseTemplateItemMapper, ExpenseTemplateItem> implements ExpenseTemplateItemService {

    @Override
    public List<ExpenseTemplateItem> listByTemplate(Long templateId) {
        return this.list(new LambdaQueryWrapper<ExpenseTemplateItem>()
                .eq(ExpenseTemplateItem::getTemplateId, templateId)
                .orderByAsc(ExpenseTemplateItem::getSortOrder)
                .orderByAsc(ExpenseTemplateItem::getId));
    }

    @Override
    public Map<Long, List<ExpenseTemplateItem>> groupByTemplate(List<Long> templateIds) {
        if (CollectionUtils.isEmpty(templateIds)) {
            return Collections.emptyMap();
        }
        return this.list(new LambdaQueryWrapper<ExpenseTemplateItem>()
                        .in(ExpenseTemplateItem::getTemplateId, templateIds)
                        .orderByAsc(ExpenseTemplateItem::getSortOrder)
                        .orderByAsc(ExpenseTemplateItem::getId))
                .stream()
                .collect(Collectors.groupingBy(ExpenseTemplateItem::getTemplateId));
    }

    @Override
    public void removeByTemplate(Long templateId) {
        this.remove(new LambdaQueryWrapper<ExpenseTemplateItem>()
                .eq(ExpenseTemplateItem::getTemplateId, templateId));
    }
}
