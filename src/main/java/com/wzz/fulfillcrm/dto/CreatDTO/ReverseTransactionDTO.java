package com.wzz.fulfillcrm.dto.CreatDTO;

import lombok.Data;

@Data
public class ReverseTransactionDTO {

    /**
     * 冲销摘要，为空时自动生成
     */
    private String description;
}
