package com.siteledger.dto;

import jakarta.validation.constraints.Min;

/**
 * DTO for changing a supplier's credit terms. Null clears them.
 */
public class PaymentTermsRequest {

    @Min(value = 0, message = "Payment terms cannot be negative")
    private Integer paymentTermsDays;

    public PaymentTermsRequest() {
    }

    public PaymentTermsRequest(Integer paymentTermsDays) {
        this.paymentTermsDays = paymentTermsDays;
    }

    public Integer getPaymentTermsDays() {
        return paymentTermsDays;
    }

    public void setPaymentTermsDays(Integer paymentTermsDays) {
        this.paymentTermsDays = paymentTermsDays;
    }
}
