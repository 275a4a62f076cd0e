package com.wzz.fulfillcrm.dto.update;

import lombok.Data;

@Data
public class AccountUpdateDTO {
    private String name;
    private String description;
    private Boolean isActive;
}
