package com.wzz.fulfillcrm.service;

import com.wzz.fulfillcrm.dto.CreatDTO.CostOperationCreateDTO;
import com.wzz.fulfillcrm.dto.CreatDTO.UserCreateDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.ClientDetailDTO;
import com.wzz.fulfillcrm.dto.ResultDTO.VendorOfferDetailDTO;
import com.wzz.fulfillcrm.entity.Client;
import com.wzz.fulfillcrm.entity.Order;
import com.wzz.fulfillcrm.entity.User;
import com.wzz.fulfillcrm.entity.Vendor;
import com.wzz.fulfillcrm.entity.VendorOffer;
import com.wzz.fulfillcrm.enums.MeasureUnit;
import com.wzz.fulfillcrm.enums.OrderStatus;
import com.wzz.fulfillcrm.enums.ServiceType;
import com.wzz.fulfillcrm.enums.UserRole;
import com.wzz.fulfillcrm.enums.VendorStatus;
import com.wzz.fulfillcrm.exception.BusinessException;
import com.wzz.fulfillcrm.support.BaseIntegrationTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 客户、供应商、用户目录维护
 */
class CrmDirectoryServiceTest extends BaseIntegrationTest {

    @Autowired
    private CostOperationService costOperationService;

    @Test
    void clientDefaultsAndDetailTotals() {
        Client client = newClient("Detail Client");
        assertThat(client.getTariffRate()).isEqualByComparingTo("1.3");
        assertThat(client.getIsActive()).isTrue();

        newOrder(client.getId(), "1000", 1, "100", "0");
        Order cancelled = newOrder(client.getId(), "400", 1, "0", "0");
        orderService.updateStatus(cancelled.getId(), OrderStatus.CANCELLED);

        ClientDetailDTO detail = clientService.getDetail(client.getId());
        assertThat(detail.getTotalOrders()).isEqualTo(2);
        assertThat(detail.getTotalRevenue()).isEqualByComparingTo("1000");
        assertThat(detail.getTotalProfit()).isEqualByComparingTo("900");
    }

    @Test
    void clientWithOrdersCannotBeDeleted() {
        Client client = newClient("Busy Client");
        newOrder(client.getId(), "100", 1, "0", "0");

        assertThatThrownBy(() -> clientService.deleteClient(client.getId()))
                .isInstanceOf(BusinessException.class)
                .extracting("code").isEqualTo(400);
    }

    @Test
    void nonPositiveTariffIsRejected() {
        Client client = new Client();
        client.setName("Zero Tariff");
        client.setTariffRate(BigDecimal.ZERO);

        assertThatThrownBy(() -> clientService.createClient(client))
                .isInstanceOf(BusinessException.class)
                .extracting("code").isEqualTo(400);
    }

    @Test
    void priceUpdateWritesHistoryAndKeepsVendor() {
        Vendor vendor = newVendor("History Vendor");
        Vendor other = newVendor("Other Vendor");
        VendorOffer offer = newOffer(vendor.getId(), "Storage per pallet", ServiceType.STORAGE, MeasureUnit.PALLET, "100");

        VendorOffer patch = new VendorOffer();
        patch.setPrice(new BigDecimal("120"));
        patch.setVendorId(other.getId());
        VendorOffer updated = vendorOfferService.updateOffer(offer.getId(), patch, adminId());

        assertThat(updated.getVendorId()).isEqualTo(vendor.getId());
        assertThat(updated.getPrice()).isEqualByComparingTo("120");
        VendorOfferDetailDTO detail = vendorOfferService.getDetail(offer.getId());
        assertThat(detail.getPriceHistory()).hasSize(1);
        assertThat(detail.getPriceHistory().get(0).getOldPrice()).isEqualByComparingTo("100");
        assertThat(detail.getPriceHistory().get(0).getNewPrice()).isEqualByComparingTo("120");
    }

    @Test
    void vendorWithCostOperationsCannotBeDeleted() {
        Vendor vendor = newVendor("Used Vendor");
        assertThat(vendor.getStatus()).isEqualTo(VendorStatus.ACTIVE);
        VendorOffer offer = newOffer(vendor.getId(), "Shipping per kg", ServiceType.SHIPPING, MeasureUnit.KG, "15");
        Order order = newOrder(newClient("Ship Client").getId(), "500", 1, "0", "0");

        CostOperationCreateDTO charge = new CostOperationCreateDTO();
        charge.setOrderId(order.getId());
        charge.setVendorServiceId(offer.getId());
        charge.setQuantity(new BigDecimal("3"));
        costOperationService.createOperation(charge);

        assertThatThrownBy(() -> vendorService.deleteVendor(vendor.getId()))
                .isInstanceOf(BusinessException.class)
                .extracting("code").isEqualTo(400);
        assertThatThrownBy(() -> vendorOfferService.deleteOffer(offer.getId()))
                .isInstanceOf(BusinessException.class)
                .extracting("code").isEqualTo(400);
    }

    @Test
    void unusedVendorIsDeletedWithItsOffers() {
        Vendor vendor = newVendor("Idle Vendor");
        VendorOffer offer = newOffer(vendor.getId(), "Labeling", ServiceType.LABELING, MeasureUnit.PIECE, "2");

        vendorService.deleteVendor(vendor.getId());

        assertThat(vendorService.getById(vendor.getId())).isNull();
        assertThat(vendorOfferService.getById(offer.getId())).isNull();
    }

    @Test
    void duplicateEmailIsRejectedCaseInsensitively() {
        UserCreateDTO dto = new UserCreateDTO();
        dto.setEmail("Analyst@Fulfillment.local");
        dto.setPassword("secret1");
        dto.setFirstName("Anna");
        dto.setLastName("Analyst");
        dto.setRole(UserRole.ANALYST);
        User created = userService.createUser(dto);
        assertThat(created.getEmail()).isEqualTo("analyst@fulfillment.local");

        dto.setEmail("analyst@fulfillment.local");
        assertThatThrownBy(() -> userService.createUser(dto))
                .isInstanceOf(BusinessException.class)
                .extracting("code").isEqualTo(400);
    }

    @Test
    void userCannotDeleteThemselves() {
        assertThatThrownBy(() -> userService.deleteUser(adminId(), adminId()))
                .isInstanceOf(BusinessException.class)
                .extracting("code").isEqualTo(400);
    }
}
