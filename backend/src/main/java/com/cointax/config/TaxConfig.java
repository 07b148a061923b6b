package com.cointax.config;

import com.cointax.common.FiatRegistry;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Tax evaluation configuration: properties, fiat registry and the clock used for the deadline.
 */
@Configuration
@EnableConfigurationProperties(TaxProperties.class)
public class TaxConfig {

    @Bean
    public FiatRegistry fiatRegistry(TaxProperties taxProperties) {
        return new FiatRegistry(taxProperties.getFiat(), taxProperties.getFiatCurrencies());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
