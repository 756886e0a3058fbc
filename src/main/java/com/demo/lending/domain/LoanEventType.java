package com.demo.lending.domain;

public enum LoanEventType {
    REQUESTED,
    CONTRIBUTED,
    FULLY_FUNDED,
    EXPIRED,
    REFUNDED,
    REPAID,
    DEFAULTED,
    VOTE_CAST,
    LIQUIDATED,
    COLLATERAL_CLAIMED
}
