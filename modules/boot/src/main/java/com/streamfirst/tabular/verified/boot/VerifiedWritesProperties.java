package com.streamfirst.tabular.verified.boot;

import com.streamfirst.tabular.verified.domain.ExecutorSettings;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Externalized settings of the verified write engine, bound from {@code verified-writes.*}.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "verified-writes")
public class VerifiedWritesProperties {

    /** Whether writes are verified when the caller does not say. */
    private boolean verifyByDefault = true;

    /** Verification slower than this is logged as a warning. */
    private Duration slowVerificationThreshold = Duration.ofSeconds(2);

    /** Runs the demo flow against the in-memory backend on startup. */
    private boolean demo = false;

    public ExecutorSettings toSettings() {
        return new ExecutorSettings(verifyByDefault, slowVerificationThreshold);
    }
}
