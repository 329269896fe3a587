package com.example.checkout.simulator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

import java.util.Random;

/**
 * Wires the simulated collaborators. Active only under the {@code simulator} profile.
 */
@Configuration
@Profile("simulator")
@EnableConfigurationProperties(SimulatorProperties.class)
public class SimulatorConfig {

    private static final Logger log = LoggerFactory.getLogger(SimulatorConfig.class);

    @Bean
    public Random simulatorRandom(SimulatorProperties properties) {
        return properties.seed() != null ? new Random(properties.seed()) : new Random();
    }

    @Bean
    public FailurePolicy paymentFailurePolicy(SimulatorProperties properties,
                                              @Qualifier("simulatorRandom") Random random) {
        return policy("payment", properties.paymentFailureRate(), random);
    }

    @Bean
    public FailurePolicy shippingFailurePolicy(SimulatorProperties properties,
                                               @Qualifier("simulatorRandom") Random random) {
        return policy("shipping", properties.shippingFailureRate(), random);
    }

    @Bean
    public FailurePolicy fraudDetectionFailurePolicy(SimulatorProperties properties,
                                                     @Qualifier("simulatorRandom") Random random) {
        return policy("fraud-detection", properties.fraudDetectionFailureRate(), random);
    }

    @Bean
    public CurrencyTable currencyTable(SimulatorProperties properties) {
        return new CurrencyTable(properties.baseCurrency(), properties.currencyRates());
    }

    private FailurePolicy policy(String collaborator, double rate, Random random) {
        log.info("Simulated {} fails {}% of calls", collaborator, rate * 100);
        return rate <= 0.0 ? FailurePolicy.never() : new ProbabilisticFailurePolicy(random, rate);
    }
}
