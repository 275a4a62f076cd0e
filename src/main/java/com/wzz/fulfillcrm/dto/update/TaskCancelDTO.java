package com.wzz.fulfillcrm.dto.update;

import lombok.Data;

@Data
public class TaskCancelDTO {

    private String reason;
}
