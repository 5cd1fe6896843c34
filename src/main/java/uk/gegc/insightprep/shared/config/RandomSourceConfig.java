package uk.gegc.insightprep.shared.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;
import java.util.Random;
import java.util.function.Supplier;

@Configuration
public class RandomSourceConfig {

    /**
     * Randomness for question and option shuffling.
     */
    @Bean
    public Supplier<Random> shuffleRandomSupplier() {
        SecureRandom random = new SecureRandom();
        return () -> random;
    }
}
