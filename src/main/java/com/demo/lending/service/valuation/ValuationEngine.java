package com.demo.lending.service.valuation;

import com.demo.lending.domain.Quote;
import com.demo.lending.domain.Token;
import com.demo.lending.domain.UsdValue;
import com.demo.lending.exception.StaleQuoteException;
import com.demo.lending.service.TokenRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Converts raw token amounts to USD with {@link UsdValue#DECIMALS} decimals. Amounts are
 * normalized by the token's own precision, so 6- and 18-decimal assets compare directly.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ValuationEngine {

    private static final int MAX_QUOTE_DECIMALS = 36;

    private final TokenRegistry tokens;
    private final PriceOracle oracle;
    private final Clock clock;

    @Value("${lending.stale-bound-secs:3600}")
    private long staleBoundSecs;

    public UsdValue usdValue(int tokenId, BigInteger rawAmount) {
        Token token = tokens.get(tokenId);
        if (!token.hasPriceFeed()) {
            throw new StaleQuoteException("Token " + token.symbol() + " has no price feed");
        }
        Quote q;
        try {
            q = oracle.latestQuote(token.priceFeedRef());
        } catch (StaleQuoteException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new StaleQuoteException("Price feed " + token.priceFeedRef() + " failed: " + ex.getMessage(), ex);
        }
        if (q == null || q.price() == null || q.price().signum() <= 0 || q.updatedAt() == null) {
            throw new StaleQuoteException("Price feed " + token.priceFeedRef() + " returned no usable price");
        }
        if (q.decimals() < 0 || q.decimals() > MAX_QUOTE_DECIMALS) {
            throw new StaleQuoteException("Price feed " + token.priceFeedRef() + " reported " + q.decimals() + " decimals");
        }
        Instant now = clock.instant();
        long age = Duration.between(q.updatedAt(), now).getSeconds();
        if (age > staleBoundSecs) {
            throw new StaleQuoteException("Quote for " + token.symbol() + " is " + age + "s old (bound " + staleBoundSecs + "s)");
        }
        return new UsdValue(convert(rawAmount, token.decimals(), q), q.updatedAt());
    }

    public BigInteger usdValueOf(int tokenId, BigInteger rawAmount) {
        return usdValue(tokenId, rawAmount).value();
    }

    /** raw * price * 10^8 / (10^tokenDecimals * 10^quoteDecimals), floored. */
    static BigInteger convert(BigInteger rawAmount, int tokenDecimals, Quote q) {
        return rawAmount
                .multiply(q.price())
                .multiply(BigInteger.TEN.pow(UsdValue.DECIMALS))
                .divide(BigInteger.TEN.pow(tokenDecimals).multiply(BigInteger.TEN.pow(q.decimals())));
    }
}
