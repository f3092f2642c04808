package com.streamfirst.tabular.verified.domain;

/**
 * Per-call options for a verified write.
 *
 * @param verify true to read back and verify, false to skip, null to use the configured default
 */
public record WriteOptions(Boolean verify) {

    private static final WriteOptions DEFAULTS = new WriteOptions(null);
    private static final WriteOptions VERIFIED = new WriteOptions(true);
    private static final WriteOptions UNVERIFIED = new WriteOptions(false);

    public static WriteOptions defaults() {
        return DEFAULTS;
    }

    public static WriteOptions verified() {
        return VERIFIED;
    }

    public static WriteOptions unverified() {
        return UNVERIFIED;
    }

    public boolean verifyOr(boolean fallback) {
        return verify == null ? fallback : verify;
    }
}
