package com.bmsedge.production.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Tunables for the daily production import, bound from {@code production.import.*}.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "production.import")
public class ImportProperties {

    /**
     * Net production may exceed the previous remaining quantity by this much
     * before the row is flagged.
     */
    private int overproductionSlack = 50;

    /**
     * Store-imposed ceiling on operations per atomic write batch.
     */
    private int maxBatchOperations = 500;

    private long sessionTimeoutMinutes = 30;

    private long sessionSweepIntervalMs = 60000;
}
