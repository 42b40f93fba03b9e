package com.kyper.storefront.api.dto;

import com.kyper.storefront.domain.model.Brand;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Request DTO for creating a brand.
 *
 * @author Storefront Team
 */
public class BrandRequest {

    @NotBlank(message = "Name is required")
    @Size(max = 255, message = "Name must be at most 255 characters")
    private String name;

    @Size(max = 50, message = "Color must be at most 50 characters")
    private String color;

    private String image;

    public BrandRequest() {
    }

    public Brand toEntity() {
        return Brand.builder()
                .name(name)
                .color(color)
                .image(image)
                .build();
    }

    // Getters and setters
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
}
