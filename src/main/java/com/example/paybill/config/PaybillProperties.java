package com.example.paybill.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.math.BigDecimal;

/**
 * Tunables of the paybill pipeline, bound from the {@code paybill.*} keys of application.properties.
 *
 * @param amountTolerance     absolute difference allowed by every arithmetic cross-check
 * @param documentParallelism number of documents loaded and parsed at the same time
 */
@ConfigurationProperties(prefix = "paybill")
public record PaybillProperties(
        @DefaultValue("1.00") BigDecimal amountTolerance,
        @DefaultValue("2") int documentParallelism
) {
    public PaybillProperties {
        amountTolerance = amountTolerance == null ? BigDecimal.ONE : amountTolerance.abs();
        documentParallelism = Math.max(1, documentParallelism);
    }

    public static PaybillProperties defaults() {
        return new PaybillProperties(new BigDecimal("1.00"), 2);
    }
}
