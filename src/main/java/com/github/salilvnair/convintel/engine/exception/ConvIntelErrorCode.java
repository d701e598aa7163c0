package com.github.salilvnair.convintel.engine.exception;

public enum ConvIntelErrorCode {

    // =========================
    // Classification
    // =========================
    UNKNOWN_LOCALE(
            "No intent lexicon registered for locale",
            true
    ),

    INVALID_LEXICON(
            "Intent lexicon is invalid",
            false
    ),

    // =========================
    // Profile store
    // =========================
    PROFILE_SCOPE_REQUIRED(
            "Tenant and bot id are required",
            false
    ),

    PROFILE_DUPLICATE_IDENTITY(
            "Another profile already owns this identity",
            true
    ),

    PROFILE_UPDATE_CONFLICT(
            "Profile changed concurrently and could not be updated",
            true
    ),

    PROFILE_SCOPE_MISMATCH(
            "Profiles belong to different tenant/bot scopes",
            false
    ),

    PROFILE_STORE_TIMEOUT(
            "Profile store call timed out",
            true
    ),

    PROFILE_STORE_FAILED(
            "Profile store call failed",
            true
    ),

    PROFILE_DATA_UNREADABLE(
            "Stored profile column could not be read",
            false
    );

    private final String defaultMessage;
    private final boolean recoverable;

    ConvIntelErrorCode(String defaultMessage, boolean recoverable) {
        this.defaultMessage = defaultMessage;
        this.recoverable = recoverable;
    }

    public String defaultMessage() {
        return defaultMessage;
    }

    public boolean recoverable() {
        return recoverable;
    }
}
