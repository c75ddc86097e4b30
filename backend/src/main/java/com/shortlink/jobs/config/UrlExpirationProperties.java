package com.shortlink.jobs.config;

import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * URL expiration job config. Documented in application.yml.
 */
@ConfigurationProperties(prefix = "shortlink.jobs.url-expiration")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class UrlExpirationProperties {

    /** Links fetched and updated per page. Default 1000. */
    @Positive
    private int batchSize = 1000;

    /** Attempts per page (first call included) before the page is skipped. Default 3. */
    @Positive
    private int maxRetries = 3;

    /** Fixed pause between page attempts in ms. Default 5000. */
    @PositiveOrZero
    private long retryDelayMs = 5_000L;

    /** Auto-expired links older than this many days are soft-deleted by maintenance. Default 90. */
    @Positive
    private int cleanupAfterDays = 90;
}
