package com.siteledger.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;

/**
 * DTO for opening an account for one material at one location.
 */
public class OpenInventoryAccountRequest extends StockThresholdsRequest {

    @NotBlank(message = "Material code is required")
    @Size(max = 100, message = "Material code must be at most 100 characters")
    private String code;

    @NotBlank(message = "Material name is required")
    @Size(max = 255, message = "Material name must be at most 255 characters")
    private String name;

    @Size(max = 255, message = "Location must be at most 255 characters")
    private String location;

    public OpenInventoryAccountRequest() {
    }

    public OpenInventoryAccountRequest(String code, String name, String location, BigDecimal minimumStockLevel,
                                       BigDecimal maximumStockLevel, BigDecimal reorderPoint) {
        super(minimumStockLevel, maximumStockLevel, reorderPoint);
        this.code = code;
        this.name = name;
        this.location = location;
    }

    public String getCode() {
        return code;
    }

    public void setCode(String code) {
        this.code = code;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getLocation() {
        return location;
    }

    public void setLocation(String location) {
        this.location = location;
    }
}
