package com.streamfirst.tabular.verified.domain;

import java.time.Duration;
import java.util.Objects;

/**
 * Engine-wide settings for verified writes.
 *
 * @param verifyByDefault whether writes are verified when the caller does not say
 * @param slowVerificationThreshold verification taking longer than this is logged as a warning
 */
public record ExecutorSettings(boolean verifyByDefault, Duration slowVerificationThreshold) {
    public ExecutorSettings {
        Objects.requireNonNull(slowVerificationThreshold, "Slow verification threshold cannot be null");
        if (slowVerificationThreshold.isNegative()) {
            throw new IllegalArgumentException("Slow verification threshold cannot be negative");
        }
    }

    public static ExecutorSettings defaults() {
        return new ExecutorSettings(true, Duration.ofSeconds(2));
    }
}
