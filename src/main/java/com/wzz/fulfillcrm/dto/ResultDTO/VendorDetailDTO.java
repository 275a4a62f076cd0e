package com.wzz.fulfillcrm.dto.ResultDTO;

import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.wzz.fulfillcrm.entity.Vendor;
import com.wzz.fulfillcrm.entity.VendorOffer;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class VendorDetailDTO {

    @JsonUnwrapped
    private Vendor vendor;

    private List<VendorOffer> services;
}
