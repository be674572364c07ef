package com.siteledger.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public class ResumeAccountRequest {

    @NotBlank(message = "Operator is required")
    @Size(max = 100, message = "Operator must be at most 100 characters")
    private String operator;

    public ResumeAccountRequest() {
    }

    public ResumeAccountRequest(String operator) {
        this.operator = operator;
    }

    public String getOperator() {
        return operator;
    }

    public void setOperator(String operator) {
        this.operator = operator;
    }
}
