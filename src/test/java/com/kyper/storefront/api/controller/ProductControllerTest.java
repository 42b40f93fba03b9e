package com.kyper.storefront.api.controller;

import com.kyper.storefront.api.exception.GlobalExceptionHandler;
import com.kyper.storefront.domain.model.Product;
import com.kyper.storefront.exception.ResourceNotFoundException;
import com.kyper.storefront.service.ProductService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ContextConfiguration;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.util.List;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Unit tests for ProductController using MockMvc.
 */
@WebMvcTest(ProductController.class)
@ContextConfiguration(classes = {ProductController.class, GlobalExceptionHandler.class})
@AutoConfigureMockMvc(addFilters = false)
@DisplayName("ProductController Tests")
class ProductControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ProductService productService;

    @Test
    @DisplayName("GET /api/products - Returns products with snake_case fields")
    void getAllProducts_ReturnsList() throws Exception {
        // Given
        Product product = Product.builder()
                .id(1L)
                .nameEs("Dragón")
                .nameEn("Dragon")
                .price(new BigDecimal("24.90"))
                .stock(3)
                .build();
        when(productService.getAllProducts()).thenReturn(List.of(product));

        // When / Then
        mockMvc.perform(get("/api/products"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].name_en").value("Dragon"))
                .andExpect(jsonPath("$[0].stock").value(3));
    }

    @Test
    @DisplayName("GET /api/products/{id} - Unknown product returns 404")
    void getProduct_NotFound_Returns404() throws Exception {
        // Given
        when(productService.getProduct(5L)).thenThrow(new ResourceNotFoundException("Product", 5L));

        // When / Then
        mockMvc.perform(get("/api/products/5"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Product not found"));
    }

    @Test
    @DisplayName("GET /api/products/{id} - Non-numeric id returns 400")
    void getProduct_NonNumericId_Returns400() throws Exception {
        mockMvc.perform(get("/api/products/abc"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(productService);
    }

    @Test
    @DisplayName("POST /api/products - Creates the product and returns it with its id")
    void createProduct_ReturnsCreated() throws Exception {
        // Given
        when(productService.createProduct(any(Product.class))).thenAnswer(invocation -> {
            Product product = invocation.getArgument(0);
            product.setId(12L);
            return product;
        });

        // When / Then
        mockMvc.perform(post("/api/products")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name_en\": \"Vase\", \"price\": 15.00, \"stock\": 4, \"category\": \"home\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(12))
                .andExpect(jsonPath("$.name_en").value("Vase"))
                .andExpect(jsonPath("$.category").value("home"));
    }

    @Test
    @DisplayName("POST /api/products - Negative stock returns 400")
    void createProduct_NegativeStock_Returns400() throws Exception {
        mockMvc.perform(post("/api/products")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name_en\": \"Vase\", \"price\": 15.00, \"stock\": -1}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.fieldErrors.stock").exists());

        verifyNoInteractions(productService);
    }

    @Test
    @DisplayName("POST /api/products - Price with more than two decimals returns 400")
    void createProduct_PriceTooPrecise_Returns400() throws Exception {
        mockMvc.perform(post("/api/products")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name_en\": \"Vase\", \"price\": 15.005, \"stock\": 4}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.fieldErrors.price").exists());

        verifyNoInteractions(productService);
    }

    @Test
    @DisplayName("DELETE /api/products/{id} - Returns confirmation message")
    void deleteProduct_ReturnsMessage() throws Exception {
        mockMvc.perform(delete("/api/products/3"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Product deleted"));

        verify(productService).deleteProduct(3L);
    }
}
