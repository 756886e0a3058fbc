package com.demo.lending.domain;

public enum VoteChoice {
    LIQUIDATE(1),
    CLAIM_PROPORTIONAL(2);

    private final int code;

    VoteChoice(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /** 0 means "no resolution yet" on the contract side. */
    public static VoteChoice fromCode(int code) {
        for (VoteChoice c : values()) {
            if (c.code == code) return c;
        }
        return null;
    }
}
