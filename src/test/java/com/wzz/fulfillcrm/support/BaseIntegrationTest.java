package com.wzz.fulfillcrm.support;

import com.wzz.fulfillcrm.dto.CreatDTO.OrderCreateDTO;
import com.wzz.fulfillcrm.dto.CreatDTO.OrderItemDTO;
import com.wzz.fulfillcrm.entity.Client;
import com.wzz.fulfillcrm.entity.Order;
import com.wzz.fulfillcrm.entity.Product;
import com.wzz.fulfillcrm.entity.StorageLocation;
import com.wzz.fulfillcrm.entity.User;
import com.wzz.fulfillcrm.entity.Vendor;
import com.wzz.fulfillcrm.entity.VendorOffer;
import com.wzz.fulfillcrm.entity.Warehouse;
import com.wzz.fulfillcrm.enums.MeasureUnit;
import com.wzz.fulfillcrm.enums.ServiceType;
import com.wzz.fulfillcrm.service.ClientService;
import com.wzz.fulfillcrm.service.OrderService;
import com.wzz.fulfillcrm.service.ProductService;
import com.wzz.fulfillcrm.service.StorageLocationService;
import com.wzz.fulfillcrm.service.UserService;
import com.wzz.fulfillcrm.service.VendorOfferService;
import com.wzz.fulfillcrm.service.VendorService;
import com.wzz.fulfillcrm.service.WarehouseService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.Collections;

/**
 * 集成测试基类：H2 内存库，每个用例结束后回滚
 */
@SpringBootTest
@Transactional
public abstract class BaseIntegrationTest {

    @Autowired
    protected ClientService clientService;

    @Autowired
    protected VendorService vendorService;

    @Autowired
    protected VendorOfferService vendorOfferService;

    @Autowired
    protected OrderService orderService;

    @Autowired
    protected UserService userService;

    @Autowired
    protected WarehouseService warehouseService;

    @Autowired
    protected StorageLocationService storageLocationService;

    @Autowired
    protected ProductService productService;

    @Value("${crm.admin.email}")
    protected String adminEmail;

    protected Long adminId() {
        User admin = userService.getByEmail(adminEmail);
        return admin.getId();
    }

    protected Client newClient(String name) {
        Client client = new Client();
        client.setName(name);
        client.setEmail(name.toLowerCase().replace(' ', '.') + "@client.test");
        return clientService.createClient(client);
    }

    protected Vendor newVendor(String name) {
        Vendor vendor = new Vendor();
        vendor.setName(name);
        return vendorService.createVendor(vendor);
    }

    protected VendorOffer newOffer(Long vendorId, String name, ServiceType type, MeasureUnit unit, String price) {
        VendorOffer offer = new VendorOffer();
        offer.setVendorId(vendorId);
        offer.setName(name);
        offer.setType(type);
        offer.setUnit(unit);
        offer.setPrice(new BigDecimal(price));
        return vendorOfferService.createOffer(offer);
    }

    /**
     * 单商品行订单，不做成本预估
     */
    protected Order newOrder(Long clientId, String incomeAmount, int quantity, String unitCost, String unitPrice) {
        OrderItemDTO item = new OrderItemDTO();
        item.setSku("SKU-1");
        item.setName("Test item");
        item.setQuantity(quantity);
        item.setWeight(new BigDecimal("0.5"));
        item.setVolume(new BigDecimal("0.01"));
        item.setUnitCost(new BigDecimal(unitCost));
        item.setUnitPrice(new BigDecimal(unitPrice));

        OrderCreateDTO dto = new OrderCreateDTO();
        dto.setClientId(clientId);
        dto.setIncomeAmount(incomeAmount == null ? null : new BigDecimal(incomeAmount));
        dto.setEstimateCosts(false);
        dto.setItems(Collections.singletonList(item));
        return orderService.createOrder(dto, adminId());
    }

    protected Warehouse newWarehouse(String code) {
        Warehouse warehouse = new Warehouse();
        warehouse.setName("Warehouse " + code);
        warehouse.setCode(code);
        return warehouseService.createWarehouse(warehouse);
    }

    protected StorageLocation newLocation(Long warehouseId, String code) {
        StorageLocation location = new StorageLocation();
        location.setCode(code);
        return storageLocationService.createLocation(warehouseId, location);
    }

    protected Product newProduct(String sku, String unitCost) {
        Product product = new Product();
        product.setSku(sku);
        product.setName("Product " + sku);
        product.setUnitCost(new BigDecimal(unitCost));
        return productService.createProduct(product);
    }
}
