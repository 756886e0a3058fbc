package com.demo.lending.service.valuation;

import com.demo.lending.domain.Quote;
import com.demo.lending.exception.StaleQuoteException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** Operator-published quotes, for local ledgers and demos. */
@Slf4j
@Component
@ConditionalOnProperty(name = "oracle.mode", havingValue = "static", matchIfMissing = true)
public class StaticPriceOracle implements PriceOracle {

    private final Map<String, Quote> quotes = new ConcurrentHashMap<>();

    @Override
    public Quote latestQuote(String priceFeedRef) {
        Quote q = quotes.get(priceFeedRef);
        if (q == null) {
            throw new StaleQuoteException("No quote published for feed " + priceFeedRef);
        }
        return q;
    }

    public Quote publish(String priceFeedRef, BigInteger price, int decimals, Instant updatedAt) {
        Quote q = new Quote(price, decimals, updatedAt);
        quotes.put(priceFeedRef, q);
        log.debug("Published {} = {} (dec {}) at {}", priceFeedRef, price, decimals, updatedAt);
        return q;
    }

    public Optional<Quote> peek(String priceFeedRef) {
        return Optional.ofNullable(quotes.get(priceFeedRef));
    }

    public void withdraw(String priceFeedRef) {
        quotes.remove(priceFeedRef);
    }

    public void clear() {
        quotes.clear();
    }
}
