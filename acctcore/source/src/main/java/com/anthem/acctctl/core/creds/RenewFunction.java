package com.anthem.acctctl.core.creds;

/**
 * Obtains a fresh set of credentials. Failures may be thrown or returned as a
 * snapshot carrying an error; a returned error with its own expiry controls how
 * long it is cached, otherwise {@link CredentialsProvider} applies a backoff.
 */
@FunctionalInterface
public interface RenewFunction {

    CredentialSnapshot renew();
}
