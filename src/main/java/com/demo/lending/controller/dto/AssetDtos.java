package com.demo.lending.controller.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.math.BigInteger;

public final class AssetDtos {
    private AssetDtos() {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Faucet {
        @NotBlank
        public String holder;
        public int tokenId;
        @NotNull
        public BigInteger amount;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Approve {
        @NotBlank
        public String owner;
        public int tokenId;
        @NotNull
        public BigInteger amount;
    }

    public static class Holding {
        public String holder;
        public int tokenId;
        public BigInteger balance;
        public BigInteger allowance;
    }
}
