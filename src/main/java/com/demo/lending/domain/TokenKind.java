package com.demo.lending.domain;

/** Native chain asset vs. fungible token contract. Codes match the on-chain enum. */
public enum TokenKind {
    NATIVE(0),
    FUNGIBLE(1);

    private final int code;

    TokenKind(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static TokenKind fromCode(int code) {
        for (TokenKind k : values()) {
            if (k.code == code) return k;
        }
        throw new IllegalArgumentException("Unknown token kind code " + code);
    }
}
