package com.kyper.storefront.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Health check result.
 *
 * @author Storefront Team
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class HealthResponse {

    private String status;
    private Boolean dbCheck;
    private String message;

    public HealthResponse() {
    }

    public static HealthResponse ok(boolean dbCheck) {
        HealthResponse response = new HealthResponse();
        response.setStatus("ok");
        response.setDbCheck(dbCheck);
        return response;
    }

    public static HealthResponse error(String message) {
        HealthResponse response = new HealthResponse();
        response.setStatus("error");
        response.setMessage(message);
        return response;
    }

    // Getters and setters
    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public Boolean getDbCheck() {
        return dbCheck;
    }

    public void setDbCheck(Boolean dbCheck) {
        this.dbCheck = dbCheck;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }
}
