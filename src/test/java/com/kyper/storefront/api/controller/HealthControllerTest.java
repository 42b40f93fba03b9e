package com.kyper.storefront.api.controller;

import com.kyper.storefront.api.exception.GlobalExceptionHandler;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ContextConfiguration;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Unit tests for HealthController using MockMvc.
 */
@WebMvcTest(HealthController.class)
@ContextConfiguration(classes = {HealthController.class, GlobalExceptionHandler.class})
@AutoConfigureMockMvc(addFilters = false)
@DisplayName("HealthController Tests")
class HealthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private JdbcTemplate jdbcTemplate;

    @Test
    @DisplayName("GET / - Returns the plain text banner")
    void root_ReturnsBanner() throws Exception {
        mockMvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(content().string("Kyper3D API is running correctly."));
    }

    @Test
    @DisplayName("GET /api/health - Database reachable returns ok")
    void health_DatabaseUp_ReturnsOk() throws Exception {
        // Given
        when(jdbcTemplate.queryForObject("SELECT 1 + 1", Integer.class)).thenReturn(2);

        // When / Then
        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"))
                .andExpect(jsonPath("$.db_check").value(true))
                .andExpect(jsonPath("$.message").doesNotExist());
    }

    @Test
    @DisplayName("GET /api/health - Database failure returns 500 with the error")
    void health_DatabaseDown_Returns500() throws Exception {
        // Given
        when(jdbcTemplate.queryForObject("SELECT 1 + 1", Integer.class))
                .thenThrow(new DataAccessResourceFailureException("Connection refused"));

        // When / Then
        mockMvc.perform(get("/api/health"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.status").value("error"))
                .andExpect(jsonPath("$.message").value("Connection refused"));
    }
}
