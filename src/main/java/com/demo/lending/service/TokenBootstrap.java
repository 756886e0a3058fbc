package com.demo.lending.service;

import com.demo.lending.domain.Addresses;
import com.demo.lending.domain.Token;
import com.demo.lending.domain.TokenKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Registers the chain's native asset as token 0 on first start. */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "lending.native-token.enabled", havingValue = "true", matchIfMissing = true)
public class TokenBootstrap implements ApplicationRunner {

    private final TokenRegistry registry;

    @Value("${lending.native-token.symbol:ETH}")
    private String symbol;

    @Value("${lending.native-token.decimals:18}")
    private int decimals;

    @Value("${lending.native-token.price-feed:ETH/USD}")
    private String priceFeed;

    @Override
    public void run(ApplicationArguments args) {
        if (registry.exists(0)) {
            log.debug("Native token already registered");
            return;
        }
        registry.register(new Token(0, TokenKind.NATIVE, Addresses.ZERO, symbol, decimals, true, priceFeed));
    }
}
