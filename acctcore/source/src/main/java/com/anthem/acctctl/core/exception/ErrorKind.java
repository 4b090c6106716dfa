package com.anthem.acctctl.core.exception;

/**
 * Categories of failures reported by account and credential operations.
 */
public enum ErrorKind {

    /** Account credentials are missing, invalid or denied (HTTP 403). */
    NO_ACCESS("account access denied"),

    /** Account is not under management (no control record). */
    NO_CTL("account control not initialized"),

    /** Optimistic control update lost a race or failed verification. */
    CTL_UPDATE("account control update interrupted"),

    /** Credentials cannot satisfy the requested validity window. */
    UNABLE("unable to satisfy minimum expiration time"),

    /** Account spec references an unknown account or uses illegal syntax. */
    INVALID_SPEC("invalid account spec"),

    /** Tag name or tag list is malformed. */
    INVALID_TAG("invalid tag"),

    /** Control record could not be decoded. */
    CTL_FORMAT("invalid account control record"),

    /** Not enough free accounts to satisfy an allocation. */
    ALLOC_FAILED("allocation failed"),

    /** Error text restored from a persisted session. */
    SAVED("saved error");

    private final String defaultMessage;

    ErrorKind(String defaultMessage) {
        this.defaultMessage = defaultMessage;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
