package com.demo.lending.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

/** JSON-RPC client and liquidator key, only when the monitor targets a deployed contract. */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "ledger.mode", havingValue = "web3")
public class Web3jConfig {

    @Bean(destroyMethod = "shutdown")
    public Web3j web3j(Environment env) {
        String rpc = env.getRequiredProperty("ledger.web3.rpc-url");
        log.info("Ledger RPC endpoint {}", rpc);
        return Web3j.build(new HttpService(rpc));
    }

    @Bean
    public Credentials liquidatorCredentials(Environment env) {
        String key = env.getProperty("monitor.liquidator-private-key", "");
        if (key.isBlank()) {
            throw new IllegalStateException("monitor.liquidator-private-key is required when ledger.mode=web3");
        }
        return Credentials.create(key);
    }
}
