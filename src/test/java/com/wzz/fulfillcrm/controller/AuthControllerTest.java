package com.wzz.fulfillcrm.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wzz.fulfillcrm.dto.CreatDTO.UserCreateDTO;
import com.wzz.fulfillcrm.dto.LoginDTO.LoginRequestDTO;
import com.wzz.fulfillcrm.enums.UserRole;
import com.wzz.fulfillcrm.service.UserService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.transaction.annotation.Transactional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@Transactional
class AuthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private UserService userService;

    @Value("${crm.admin.email}")
    private String adminEmail;

    @Value("${crm.admin.password}")
    private String adminPassword;

    private String login(String email, String password) throws Exception {
        LoginRequestDTO dto = new LoginRequestDTO();
        dto.setEmail(email);
        dto.setPassword(password);
        MvcResult result = mockMvc.perform(post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(dto)))
                .andExpect(status().isOk())
                .andReturn();
        JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
        return "Bearer " + body.path("data").path("token").asText();
    }

    @Test
    void adminLoginReturnsTokenAndProfile() throws Exception {
        String token = login(adminEmail, adminPassword);
        assertThat(token).isNotEqualTo("Bearer ");

        mockMvc.perform(get("/api/auth/me").header(HttpHeaders.AUTHORIZATION, token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.email").value(adminEmail))
                .andExpect(jsonPath("$.data.role").value("ADMIN"))
                .andExpect(jsonPath("$.data.password").doesNotExist());
    }

    @Test
    void wrongPasswordIsUnauthorized() throws Exception {
        LoginRequestDTO dto = new LoginRequestDTO();
        dto.setEmail(adminEmail);
        dto.setPassword("not-the-password");

        mockMvc.perform(post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(dto)))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").exists());
    }

    @Test
    void protectedEndpointWithoutTokenIsUnauthorized() throws Exception {
        mockMvc.perform(get("/api/orders"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void missingOrderReturnsNotFoundErrorShape() throws Exception {
        String token = login(adminEmail, adminPassword);

        mockMvc.perform(get("/api/orders/ORD-000000-NOPE00").header(HttpHeaders.AUTHORIZATION, token))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").exists());
    }

    @Test
    void managerCannotManageUsers() throws Exception {
        UserCreateDTO manager = new UserCreateDTO();
        manager.setEmail("manager@fulfillment.local");
        manager.setPassword("manager123");
        manager.setFirstName("Olga");
        manager.setLastName("Manager");
        manager.setRole(UserRole.MANAGER);
        userService.createUser(manager);

        String token = login("manager@fulfillment.local", "manager123");

        mockMvc.perform(get("/api/users").header(HttpHeaders.AUTHORIZATION, token))
                .andExpect(status().isForbidden());
        mockMvc.perform(get("/api/reports/vendors").header(HttpHeaders.AUTHORIZATION, token))
                .andExpect(status().isForbidden());
        mockMvc.perform(get("/api/reports/orders").header(HttpHeaders.AUTHORIZATION, token))
                .andExpect(status().isOk());
    }

    @Test
    void ordersReportExportsCsv() throws Exception {
        String token = login(adminEmail, adminPassword);

        mockMvc.perform(get("/api/reports/orders")
                        .param("format", "csv")
                        .header(HttpHeaders.AUTHORIZATION, token))
                .andExpect(status().isOk())
                .andExpect(header().string(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=orders-report.csv"))
                .andExpect(content().contentTypeCompatibleWith("text/csv"));
    }
}
