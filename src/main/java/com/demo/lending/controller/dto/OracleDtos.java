package com.demo.lending.controller.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.math.BigInteger;

public final class OracleDtos {
    private OracleDtos() {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PublishQuote {
        @NotBlank
        public String feed;        // e.g. "ETH/USD"
        @NotNull
        public BigInteger price;
        @Min(0)
        @Max(36)
        public int decimals;
        public Long updatedAt;     // epoch seconds, now when absent
    }
}
