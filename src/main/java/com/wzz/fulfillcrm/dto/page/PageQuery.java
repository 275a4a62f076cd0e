package com.wzz.fulfillcrm.dto.page;

import com.baomidou.mybatisplus.extension.plugins.pagination.Page;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;

/**
 * 通用分页查询参数对象，对应查询串 ?page=1&limit=20
 */
@Data
public class PageQuery {

    @Min(value = 1, message = "页码不能小于1")
    private long page = 1L;

    @Min(value = 1, message = "每页数量不能小于1")
    @Max(value = 100, message = "每页数量不能超过100") // 设置一个最大值，防止恶意查询
    private long limit = 20L;

    public <T> Page<T> toPage() {
        return new Page<>(page, limit);
    }
}
