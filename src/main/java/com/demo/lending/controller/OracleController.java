package com.demo.lending.controller;

import com.demo.lending.controller.dto.OracleDtos;
import com.demo.lending.domain.Quote;
import com.demo.lending.domain.UsdValue;
import com.demo.lending.service.valuation.StaticPriceOracle;
import com.demo.lending.service.valuation.ValuationEngine;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;

@RestController
@RequestMapping("/api/oracle")
@RequiredArgsConstructor
public class OracleController {

    private final ObjectProvider<StaticPriceOracle> staticOracle;
    private final ValuationEngine valuation;
    private final Clock clock;

    /** Only available with {@code oracle.mode=static}. */
    @PostMapping("/quotes")
    public Quote publish(@Valid @RequestBody OracleDtos.PublishQuote body) {
        Instant at = body.updatedAt != null ? Instant.ofEpochSecond(body.updatedAt) : clock.instant();
        return oracle().publish(body.feed, body.price, body.decimals, at);
    }

    @GetMapping("/quotes")
    public Quote quote(@RequestParam String feed) {
        return oracle().peek(feed)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "No quote for " + feed));
    }

    /** Drops a feed's quote, so valuations of its tokens go stale. */
    @DeleteMapping("/quotes")
    public void withdraw(@RequestParam String feed) {
        oracle().withdraw(feed);
    }

    @GetMapping("/value")
    public UsdValue value(@RequestParam int tokenId, @RequestParam BigInteger amount) {
        return valuation.usdValue(tokenId, amount);
    }

    private StaticPriceOracle oracle() {
        StaticPriceOracle o = staticOracle.getIfAvailable();
        if (o == null) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "Quotes are published only in oracle.mode=static");
        }
        return o;
    }
}
