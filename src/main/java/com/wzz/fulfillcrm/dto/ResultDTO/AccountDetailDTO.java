package com.wzz.fulfillcrm.dto.ResultDTO;

import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.wzz.fulfillcrm.entity.Account;
import com.wzz.fulfillcrm.entity.FinTransaction;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AccountDetailDTO {

    @JsonUnwrapped
    private Account account;

    private List<FinTransaction> debitTransactions;

    private List<FinTransaction> creditTransactions;
}
