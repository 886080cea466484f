package com.giveawaybot.web.admin;

import com.giveawaybot.domain.admin.entity.Admin;
import com.giveawaybot.domain.admin.service.AdminService;
import com.giveawaybot.exception.BusinessException;
import com.giveawaybot.exception.ResourceNotFoundException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class AdminRegistryControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AdminService adminService;

    @Test
    void index_ListsAdminsWithTotal() throws Exception {
        when(adminService.getAdmins()).thenReturn(List.of(
                Admin.builder().userId(1L).mainAdmin(true).build(),
                Admin.builder().userId(20L).username("helper").build()));

        mockMvc.perform(get("/admin/admins"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(2))
                .andExpect(jsonPath("$.admins[0].main_admin").value(true))
                .andExpect(jsonPath("$.admins[1].username").value("helper"));
    }

    @Test
    void create_NewAdmin_ReturnsAdmin() throws Exception {
        when(adminService.addAdmin(20L, "helper", "Ольга", null))
                .thenReturn(Admin.builder().userId(20L).username("helper").firstName("Ольга").build());

        mockMvc.perform(post("/admin/admins")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"userId": 20, "username": "helper", "firstName": "Ольга"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.result").value("success"))
                .andExpect(jsonPath("$.admin.user_id").value(20));
    }

    @Test
    void create_MissingUserId_ReturnsValidationError() throws Exception {
        mockMvc.perform(post("/admin/admins")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"username": "helper"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Validation failed"));

        verify(adminService, never()).addAdmin(any(), any(), any(), any());
    }

    @Test
    void check_ReportsMembership() throws Exception {
        when(adminService.isAdmin(20L)).thenReturn(true);

        mockMvc.perform(get("/admin/admins/20"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.is_admin").value(true));
    }

    @Test
    void delete_MainAdmin_ReturnsBadRequest() throws Exception {
        doThrow(new BusinessException("The main admin cannot be removed")).when(adminService).removeAdmin(1L);

        mockMvc.perform(delete("/admin/admins/1"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("The main admin cannot be removed"));
    }

    @Test
    void delete_UnknownAdmin_ReturnsNotFound() throws Exception {
        doThrow(new ResourceNotFoundException("Admin", 404L)).when(adminService).removeAdmin(404L);

        mockMvc.perform(delete("/admin/admins/404"))
                .andExpect(status().isNotFound());
    }
}
