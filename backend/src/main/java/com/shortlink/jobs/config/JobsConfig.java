package com.shortlink.jobs.config;

import com.shortlink.common.Sleeper;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers job properties and the sleeper used between page retries.
 */
@Configuration
@EnableConfigurationProperties({ JobSchedulerProperties.class, UrlExpirationProperties.class })
public class JobsConfig {

    @Bean
    public Sleeper retrySleeper() {
        return Sleeper.THREAD;
    }
}
