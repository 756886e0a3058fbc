package com.demo.lending.config;

import com.demo.lending.monitor.RetryPolicy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

@Configuration
public class MonitorConfig {

    @Bean
    public RetryPolicy.Sleeper sleeper() {
        return RetryPolicy.Sleeper.SYSTEM;
    }

    @Bean
    public RetryPolicy ledgerRetryPolicy(RetryPolicy.Sleeper sleeper,
                                         @Value("${monitor.retry.max-attempts:3}") int maxAttempts,
                                         @Value("${monitor.retry.delays-ms:500,1000,2000}") String delaysMs) {
        List<Duration> delays = Arrays.stream(delaysMs.split(","))
                .map(String::trim).filter(s -> !s.isEmpty())
                .map(s -> Duration.ofMillis(Long.parseLong(s)))
                .toList();
        return new RetryPolicy(maxAttempts, delays, sleeper);
    }
}
