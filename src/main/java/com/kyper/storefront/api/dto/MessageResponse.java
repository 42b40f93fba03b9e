package com.kyper.storefront.api.dto;

/**
 * Single-message acknowledgement, e.g. {"message": "Product deleted"}.
 *
 * @author Storefront Team
 */
public class MessageResponse {

    private String message;

    public MessageResponse() {
    }

    public MessageResponse(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }
}
