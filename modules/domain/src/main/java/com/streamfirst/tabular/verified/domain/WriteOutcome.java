package com.streamfirst.tabular.verified.domain;

import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Value;

/**
 * Outcome of a verified write as a value instead of an exception. Exactly one of three kinds:
 * the certified result, the backend's rejection of the write, or a verification failure carrying
 * the evidence and operation context.
 *
 * @param <T> the caller-facing result type
 */
@Value
@EqualsAndHashCode
public class WriteOutcome<T> {

    public enum Kind {
        /** Write accepted and, when requested, confirmed by read-back */
        SUCCESS,
        /** Write refused by the backend; nothing to verify */
        WRITE_ERROR,
        /** Write accepted but the read-back state does not match */
        VERIFICATION_FAILURE
    }

    Kind kind;
    T data;
    Throwable writeError;
    VerificationResult verification;
    OperationContext context;

    private WriteOutcome(
        Kind kind, T data, Throwable writeError, VerificationResult verification, OperationContext context) {
        this.kind = kind;
        this.data = data;
        this.writeError = writeError;
        this.verification = verification;
        this.context = context;
    }

    public static <T> WriteOutcome<T> success(T data) {
        return new WriteOutcome<>(Kind.SUCCESS, data, null, null, null);
    }

    public static <T> WriteOutcome<T> writeError(@NonNull Throwable error) {
        return new WriteOutcome<>(Kind.WRITE_ERROR, null, error, null, null);
    }

    public static <T> WriteOutcome<T> verificationFailure(
        @NonNull VerificationResult verification, @NonNull OperationContext context) {
        return new WriteOutcome<>(Kind.VERIFICATION_FAILURE, null, null, verification, context);
    }

    /** Converts a verification exception into the equivalent failure outcome. */
    public static <T> WriteOutcome<T> from(@NonNull VerificationException e) {
        return verificationFailure(e.getResult(), e.getContext());
    }

    public boolean isSuccess() {
        return kind == Kind.SUCCESS;
    }

    /** Always false: neither failure kind is retried by the engine. */
    public boolean isRetryable() {
        return false;
    }

    /**
     * Returns the data if successful. Otherwise throws the write error when it is unchecked, or a
     * {@link VerificationException} rebuilt from the evidence.
     */
    public T orElseThrow() {
        switch (kind) {
            case SUCCESS:
                return data;
            case VERIFICATION_FAILURE:
                throw new VerificationException(verification, context);
            default:
                if (writeError instanceof RuntimeException runtime) {
                    throw runtime;
                }
                throw new IllegalStateException("Write rejected: " + writeError.getMessage(), writeError);
        }
    }

    public T orElse(T defaultValue) {
        return isSuccess() ? data : defaultValue;
    }

    public T orElseGet(Supplier<T> supplier) {
        return isSuccess() ? data : supplier.get();
    }

    /** Maps the data if successful, preserves either failure otherwise. */
    public <U> WriteOutcome<U> map(Function<T, U> mapper) {
        if (isSuccess()) {
            return WriteOutcome.success(mapper.apply(data));
        }
        return new WriteOutcome<>(kind, null, writeError, verification, context);
    }

    public Optional<T> getData() {
        return isSuccess() ? Optional.ofNullable(data) : Optional.empty();
    }

    public Optional<Throwable> getWriteError() {
        return Optional.ofNullable(writeError);
    }

    public Optional<VerificationResult> getVerification() {
        return Optional.ofNullable(verification);
    }

    public Optional<OperationContext> getContext() {
        return Optional.ofNullable(context);
    }

    @Override
    public String toString() {
        switch (kind) {
            case SUCCESS:
                return "WriteOutcome.success(" + data + ")";
            case WRITE_ERROR:
                return "WriteOutcome.writeError(" + writeError + ")";
            default:
                return "WriteOutcome.verificationFailure(" + context + ", " + verification + ")";
        }
    }
}
