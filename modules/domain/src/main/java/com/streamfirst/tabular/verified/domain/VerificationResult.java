package com.streamfirst.tabular.verified.domain;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Value;

/**
 * Aggregate of the checks made for one write operation. {@code passed} is always exactly the
 * logical AND of the checks' flags, so an empty result passes.
 */
@Value
@EqualsAndHashCode
public class VerificationResult {

    @NonNull List<VerificationCheck> checks;
    @NonNull Optional<Duration> duration;

    /** Summary error that takes precedence over the default failure message */
    @NonNull Optional<String> error;

    private VerificationResult(
        List<VerificationCheck> checks, Optional<Duration> duration, Optional<String> error) {
        this.checks = List.copyOf(checks);
        this.duration = duration;
        this.error = error;
    }

    public static VerificationResult of(List<VerificationCheck> checks) {
        return new VerificationResult(checks, Optional.empty(), Optional.empty());
    }

    public static VerificationResult of(List<VerificationCheck> checks, Duration duration) {
        return new VerificationResult(checks, Optional.of(duration), Optional.empty());
    }

    /** Creates a result whose summary error replaces the default failure message. */
    public static VerificationResult withError(List<VerificationCheck> checks, String error) {
        return new VerificationResult(checks, Optional.empty(), Optional.of(error));
    }

    public boolean isPassed() {
        return checks.stream().allMatch(VerificationCheck::passed);
    }

    public List<VerificationCheck> getFailedChecks() {
        return checks.stream().filter(c -> !c.passed()).toList();
    }

    public VerificationResult withDuration(Duration elapsed) {
        return new VerificationResult(checks, Optional.of(elapsed), error);
    }

    @Override
    public String toString() {
        return "VerificationResult{passed=" + isPassed()
            + ", checks=" + checks.size()
            + ", failed=" + getFailedChecks().size()
            + duration.map(d -> ", duration=" + d.toMillis() + "ms").orElse("")
            + '}';
    }
}
