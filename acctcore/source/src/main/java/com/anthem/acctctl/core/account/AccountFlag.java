package com.anthem.acctctl.core.account;

/**
 * Account state flags.
 */
public enum AccountFlag {
    /** Credentials are valid. */
    CREDS,
    /** Control record load was attempted. */
    LOADED,
    /** Control record is valid. */
    CTL,
    /** Account belongs to the organization. */
    ORG
}
