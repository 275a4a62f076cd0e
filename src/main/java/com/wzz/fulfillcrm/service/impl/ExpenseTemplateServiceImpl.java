package com.wzz.fulfillcrm.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.wzz.fulfillcrm.dto.CreatDTO.ExpenseTemplateCreateDTO;
import com.wzz.fulfillcrm.dto.CreatDTO.ExpenseTemplateItemDTO;
import com.wzz.fulfillcrm.entity.ExpenseTemplate;
import com.wzz.fulfillcrm.entity.ExpenseTemplateItem;
import com.wzz.fulfillcrm.enums.ExpenseCategory;
import com.wzz.fulfillcrm.enums.MeasureUnit;
import com.wzz.fulfillcrm.exception.BusinessException;
import com.wzz.fulfillcrm.mapper.ExpenseTemplateMapper;
import com.wzz.fulfillcrm.service.ExpenseTemplateItemService;
import com.wzz.fulfillcrm.service.ExpenseTemplateService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.BeanUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.CollectionUtils;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@Service
public class ExpenseTemplateServiceImpl extends ServiceImpl<ExpenseTemplateMapper, ExpenseTemplate> implements ExpenseTemplateService {

    @Autowired
    private ExpenseTemplateItemService expenseTemplateItemService;

    @Override
    public List<ExpenseTemplate> listTemplates(boolean activeOnly) {
        List<ExpenseTemplate> templates = this.list(new LambdaQueryWrapper<ExpenseTemplate>()
                .eq(activeOnly, ExpenseTemplate::getIsActive, true)
                .orderByAsc(ExpenseTemplate::getName));
        Map<Long, List<ExpenseTemplateItem>> itemsByTemplate = expenseTemplateItemService.groupByTemplate(
                templates.stream().map(ExpenseTemplate::getId).collect(Collectors.toList()));
        templates.forEach(t -> t.setItems(itemsByTemplate.getOrDefault(t.getId(), Collections.emptyList())));
        return templates;
    }

    @Override
    public ExpenseTemplate getTemplate(Long id) {
        ExpenseTemplate template = this.getById(id);
        if (template == null) {
            throw BusinessException.notFound("费用模板不存在: " + id);
        }
        template.setItems(expenseTemplateItemService.listByTemplate(id));
        return template;
    }

    @Transactional(rollbackFor = Exception.class)
    @Override
    public ExpenseTemplate createTemplate(ExpenseTemplateCreateDTO dto) {
        ExpenseTemplate template = new ExpenseTemplate();
        copyHeader(dto, template);
        template.setIsActive(dto.getIsActive() == null || dto.getIsActive());
        this.save(template);

        saveItems(template.getId(), dto.getItems());
        log.info("新增费用模板 {}: {}", template.getId(), template.getName());
        return getTemplate(template.getId());
    }

    @Transactional(rollbackFor = Exception.class)
    @Override
    public ExpenseTemplate updateTemplate(Long id, ExpenseTemplateCreateDTO dto) {
        ExpenseTemplate existing = this.getById(id);
        if (existing == null) {
            throw BusinessException.notFound("费用模板不存在: " + id);
        }
        copyHeader(dto, existing);
        if (dto.getIsActive() != null) {
            existing.setIsActive(dto.getIsActive());
        }
        this.updateById(existing);

        // 明细整体替换：删除旧的插入新的
        expenseTemplateItemService.removeByTemplate(id);
        saveItems(id, dto.getItems());
        log.info("修改费用模板 {}", id);
        return getTemplate(id);
    }

    @Transactional(rollbackFor = Exception.class)
    @Override
    public void deleteTemplate(Long id) {
        if (this.getById(id) == null) {
            throw BusinessException.notFound("费用模板不存在: " + id);
        }
        expenseTemplateItemService.removeByTemplate(id);
        this.removeById(id);
        log.info("删除费用模板 {}", id);
    }

    @Transactional(rollbackFor = Exception.class)
    @Override
    public ExpenseTemplate duplicateTemplate(Long id) {
        ExpenseTemplate source = getTemplate(id);

        ExpenseTemplate copy = new ExpenseTemplate();
        BeanUtils.copyProperties(source, copy, "id", "createTime", "updateTime", "items");
        copy.setName(source.getName() + " (copy)");
        this.save(copy);

        List<ExpenseTemplateItem> items = new ArrayList<>();
        for (ExpenseTemplateItem src : source.getItems()) {
            ExpenseTemplateItem item = new ExpenseTemplateItem();
            BeanUtils.copyProperties(src, item, "id", "createTime", "updateTime");
            item.setTemplateId(copy.getId());
            items.add(item);
        }
        if (!items.isEmpty()) {
            expenseTemplateItemService.saveBatch(items);
        }
        log.info("复制费用模板 {} -> {}", id, copy.getId());
        return getTemplate(copy.getId());
    }

    private void copyHeader(ExpenseTemplateCreateDTO dto, ExpenseTemplate template) {
        template.setName(dto.getName());
        template.setDescription(dto.getDescription());
        template.setProductCategory(dto.getProductCategory());
        template.setMinWeight(dto.getMinWeight());
        template.setMaxWeight(dto.getMaxWeight());
        template.setDeliveryMethod(dto.getDeliveryMethod());
        template.setRegion(dto.getRegion());
    }

    private void saveItems(Long templateId, List<ExpenseTemplateItemDTO> itemDTOs) {
        if (CollectionUtils.isEmpty(itemDTOs)) {
            return;
        }
        List<ExpenseTemplateItem> items = new ArrayList<>();
        for (int i = 0; i < itemDTOs.size(); i++) {
            ExpenseTemplateItemDTO dto = itemDTOs.get(i);
            ExpenseTemplateItem item = new ExpenseTemplateItem();
            item.setTemplateId(templateId);
            item.setCategory(dto.getCategory() != null ? dto.getCategory() : ExpenseCategory.OTHER);
            item.setSubcategory(dto.getSubcategory());
            item.setDescription(dto.getDescription());
            item.setVendorServiceId(dto.getVendorServiceId());
            item.setUnit(dto.getUnit() != null ? dto.getUnit() : MeasureUnit.PIECE);
            item.setDefaultQuantity(dto.getDefaultQuantity() == null || dto.getDefaultQuantity().signum() == 0
                    ? BigDecimal.ONE : dto.getDefaultQuantity());
            item.setDefaultPrice(dto.getDefaultPrice() != null ? dto.getDefaultPrice() : BigDecimal.ZERO);
            item.setQuantityFormula(dto.getQuantityFormula());
            item.setIsRequired(dto.getIsRequired() == null || dto.getIsRequired());
            item.setSortOrder(dto.getSortOrder() != null ? dto.getSortOrder() : i);
            items.add(item);
        }
        expenseTemplateItemService.saveBatch(items);
    }
}
