package com.demo.lending.service.valuation;

import com.demo.lending.domain.Quote;
import com.demo.lending.exception.StaleQuoteException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Remote quote service. Expects {@code GET {base}/feeds/{ref}/latest} to answer
 * {@code {"price":"200000000000","decimals":8,"updated_at":1700000000}}.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "oracle.mode", havingValue = "http")
public class HttpPriceOracle implements PriceOracle {

    private final RestTemplate rest;
    private final String base;

    public HttpPriceOracle(RestTemplate rest, @Value("${oracle.base-url}") String baseUrl) {
        this.rest = rest;
        this.base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    @Override
    public Quote latestQuote(String priceFeedRef) {
        String url = base + "/feeds/{ref}/latest";
        QuotePayload body;
        try {
            body = rest.getForObject(url, QuotePayload.class, priceFeedRef);
        } catch (RestClientException ex) {
            throw new StaleQuoteException("Oracle unreachable for feed " + priceFeedRef + ": " + ex.getMessage(), ex);
        }
        if (body == null || body.getPrice() == null || body.getUpdatedAt() == null) {
            throw new StaleQuoteException("Oracle returned an incomplete quote for feed " + priceFeedRef);
        }
        try {
            return new Quote(new BigInteger(body.getPrice()), body.getDecimals(), Instant.ofEpochSecond(body.getUpdatedAt()));
        } catch (NumberFormatException ex) {
            throw new StaleQuoteException("Oracle price for feed " + priceFeedRef + " is not an integer: " + body.getPrice(), ex);
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class QuotePayload {
        private String price;
        private int decimals;
        @JsonProperty("updated_at")
        private Long updatedAt;
    }
}
