package com.demo.lending.domain;

import lombok.With;

/**
 * Registry entry for an asset a loan may be denominated or collateralized in.
 * Only {@code active} ever changes after registration.
 */
@With
public record Token(
        int id,
        TokenKind kind,
        String assetRef,
        String symbol,
        int decimals,
        boolean active,
        String priceFeedRef
) {
    public boolean hasPriceFeed() {
        return priceFeedRef != null && !priceFeedRef.isBlank();
    }
}
