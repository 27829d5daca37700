package heartdisease.etl.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Application-wide beans
 */
@Configuration
public class AppConfig {

    /**
     * Wall clock for lineage timestamps; tests pass a fixed clock instead
     */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
