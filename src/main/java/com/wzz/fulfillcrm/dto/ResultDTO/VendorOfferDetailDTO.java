package com.wzz.fulfillcrm.dto.ResultDTO;

import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.wzz.fulfillcrm.entity.PriceHistory;
import com.wzz.fulfillcrm.entity.Vendor;
import com.wzz.fulfillcrm.entity.VendorOffer;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class VendorOfferDetailDTO {

    @JsonUnwrapped
    private VendorOffer offer;

    private Vendor vendor;

    /**
     * 最近的调价记录，按时间倒序
     */
    private List<PriceHistory> priceHistory;
}
