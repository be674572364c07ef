package com.siteledger.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * DTO for opening a supplier account.
 */
public class OpenFinancialAccountRequest {

    @NotBlank(message = "Supplier code is required")
    @Size(max = 100, message = "Supplier code must be at most 100 characters")
    private String code;

    @NotBlank(message = "Supplier name is required")
    @Size(max = 255, message = "Supplier name must be at most 255 characters")
    private String name;

    @Min(value = 0, message = "Payment terms cannot be negative")
    private Integer paymentTermsDays;

    public OpenFinancialAccountRequest() {
    }

    public OpenFinancialAccountRequest(String code, String name, Integer paymentTermsDays) {
        this.code = code;
        this.name = name;
        this.paymentTermsDays = paymentTermsDays;
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

    public Integer getPaymentTermsDays() {
        return paymentTermsDays;
    }

    public void setPaymentTermsDays(Integer paymentTermsDays) {
        this.paymentTermsDays = paymentTermsDays;
    }
}
