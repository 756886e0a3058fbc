package com.demo.lending.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * Loan lifecycle. Codes follow the ledger contract's enum so that records read
 * over RPC map onto the same values.
 */
public enum LoanStatus {
    REQUESTED(0),
    FUNDED(1),
    ACTIVE(2),
    REPAID(3),
    PAST_DUE(4),
    EXPIRED(5),
    VOTING(6),
    LIQUIDATED(7),
    PARTIALLY_CLAIMED(8);

    private final int code;

    LoanStatus(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public boolean canTransitionTo(LoanStatus next) {
        return successors().contains(next);
    }

    private Set<LoanStatus> successors() {
        switch (this) {
            case REQUESTED:
                return EnumSet.of(FUNDED, EXPIRED);
            case FUNDED:
                return EnumSet.of(ACTIVE);
            case ACTIVE:
                return EnumSet.of(REPAID, PAST_DUE);
            case PAST_DUE:
                return EnumSet.of(VOTING);
            case VOTING:
                return EnumSet.of(LIQUIDATED, PARTIALLY_CLAIMED);
            default:
                return EnumSet.noneOf(LoanStatus.class);
        }
    }

    public static LoanStatus fromCode(int code) {
        for (LoanStatus s : values()) {
            if (s.code == code) return s;
        }
        throw new IllegalArgumentException("Unknown loan status code " + code);
    }
}
