package com.demo.lending.controller.dto;

import com.demo.lending.domain.Token;
import com.demo.lending.domain.TokenKind;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public final class TokenDtos {
    private TokenDtos() {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RegisterToken {
        public int id;
        @NotNull
        public TokenKind kind;
        public String assetRef;       // contract address for fungible tokens
        @NotBlank
        public String symbol;
        public int decimals;
        public String priceFeedRef;   // optional

        public Token toToken() {
            return new Token(id, kind, assetRef, symbol, decimals, true, priceFeedRef);
        }
    }
}
