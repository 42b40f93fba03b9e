package com.kyper.storefront.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.kyper.storefront.domain.model.Brand;

import java.time.Instant;

/**
 * Response DTO for a brand.
 *
 * @author Storefront Team
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class BrandResponse {

    private Long id;
    private String name;
    private String color;
    private String image;
    private Instant createdAt;

    public BrandResponse() {
    }

    public static BrandResponse fromEntity(Brand brand) {
        BrandResponse response = new BrandResponse();
        response.setId(brand.getId());
        response.setName(brand.getName());
        response.setColor(brand.getColor());
        response.setImage(brand.getImage());
        response.setCreatedAt(brand.getCreatedAt());
        return response;
    }

    // Getters and setters
    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getColor() {
        return color;
    }

    public void setColor(String color) {
        this.color = color;
    }

    public String getImage() {
        return image;
    }

    public void setImage(String image) {
        this.image = image;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
}
