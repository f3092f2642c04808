package com.streamfirst.tabular.verified.domain;

import java.util.List;
import java.util.stream.Collectors;
import lombok.Getter;
import lombok.NonNull;

/**
 * Thrown when a write was accepted by the backend but reading it back did not confirm the intended
 * state. Distinct from a rejected write, which surfaces as the backend's own exception.
 *
 * <p>Possible causes include access rules silently dropping part of the write, a formula column
 * recomputing the written value, or a concurrent modification. Verification failures are never
 * retried by the engine.
 */
@Getter
public class VerificationException extends RuntimeException {

    public static final String ERROR_CODE = "VERIFICATION_FAILED";

    private static final int MAX_RENDERED_FAILURES = 3;

    private static final List<String> SUGGESTIONS = List.of(
        "Check if access rules are blocking the write",
        "Verify the column is not a formula or otherwise read-only column",
        "Check if another user or process modified the data",
        "Retry the whole operation to rule out transient issues");

    private final VerificationResult result;
    private final String operation;
    private final String entityType;
    private final String entityId;

    public VerificationException(@NonNull VerificationResult result, @NonNull OperationContext context) {
        super(result.getError().orElseGet(
            () -> "Verification failed: " + result.getFailedChecks().size() + " check(s) failed"));
        this.result = result;
        this.operation = context.operation();
        this.entityType = context.entityType();
        this.entityId = context.entityId();
    }

    public OperationContext getContext() {
        return new OperationContext(operation, entityType, entityId);
    }

    public String getErrorCode() {
        return ERROR_CODE;
    }

    public boolean isRetryable() {
        return false;
    }

    public List<String> getSuggestions() {
        return SUGGESTIONS;
    }

    public List<VerificationCheck> getFailedChecks() {
        return result.getFailedChecks();
    }

    /** Returns true if any failing check covers the given written field. */
    public boolean hasFieldFailure(String fieldName) {
        return result.getChecks().stream().anyMatch(c -> c.isFieldFailure(fieldName));
    }

    /**
     * Renders the failure for an end user: up to three failing checks with expected and actual
     * values, a count of the remainder, and the fixed remediation suggestions.
     */
    public String toUserMessage() {
        List<VerificationCheck> failed = getFailedChecks();
        if (failed.isEmpty()) {
            return getMessage();
        }

        String details = failed.stream()
            .limit(MAX_RENDERED_FAILURES)
            .map(VerificationException::renderCheck)
            .collect(Collectors.joining("\n"));
        String more = failed.size() > MAX_RENDERED_FAILURES
            ? "\n... and " + (failed.size() - MAX_RENDERED_FAILURES) + " more"
            : "";
        String suggestions = SUGGESTIONS.stream()
            .map(s -> "  * " + s)
            .collect(Collectors.joining("\n"));

        return "Write operation succeeded but verification failed for " + entityType + " " + entityId
            + ":\n" + details + more + "\nSuggestions:\n" + suggestions;
    }

    private static String renderCheck(VerificationCheck check) {
        if (check.hasValues()) {
            return "- " + check.description()
                + ": expected " + ValueFormatter.format(check.expected())
                + ", got " + ValueFormatter.format(check.actual());
        }
        return "- " + check.description();
    }
}
