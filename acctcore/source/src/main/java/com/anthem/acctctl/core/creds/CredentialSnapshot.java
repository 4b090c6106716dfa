package com.anthem.acctctl.core.creds;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentials;
import software.amazon.awssdk.auth.credentials.AwsSessionCredentials;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable set of access credentials together with the error, if any, of the
 * renewal attempt that produced it. A provider replaces its snapshot as a
 * whole; snapshots are never modified in place.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class CredentialSnapshot {

    public static final CredentialSnapshot EMPTY =
            new CredentialSnapshot(null, null, null, false, null, null, null);

    private final String accessKeyId;
    private final String secretAccessKey;
    private final String sessionToken;
    private final boolean canExpire;
    private final Instant expires;
    private final String source;
    private final RuntimeException error;

    @JsonCreator
    public CredentialSnapshot(
            @JsonProperty("accessKeyId") String accessKeyId,
            @JsonProperty("secretAccessKey") String secretAccessKey,
            @JsonProperty("sessionToken") String sessionToken,
            @JsonProperty("canExpire") boolean canExpire,
            @JsonProperty("expires") Instant expires,
            @JsonProperty("source") String source) {
        this(accessKeyId, secretAccessKey, sessionToken, canExpire, expires, source, null);
    }

    private CredentialSnapshot(String accessKeyId, String secretAccessKey, String sessionToken,
                               boolean canExpire, Instant expires, String source,
                               RuntimeException error) {
        this.accessKeyId = accessKeyId;
        this.secretAccessKey = secretAccessKey;
        this.sessionToken = sessionToken;
        this.canExpire = canExpire;
        this.expires = expires;
        this.source = source;
        this.error = error;
    }

    /**
     * Permanent credentials that never expire.
     */
    public static CredentialSnapshot permanent(String accessKeyId, String secretAccessKey, String source) {
        return new CredentialSnapshot(accessKeyId, secretAccessKey, null, false, null, source);
    }

    /**
     * Temporary credentials valid until {@code expires}.
     */
    public static CredentialSnapshot temporary(String accessKeyId, String secretAccessKey,
                                               String sessionToken, Instant expires, String source) {
        return new CredentialSnapshot(accessKeyId, secretAccessKey, sessionToken, true, expires, source);
    }

    /**
     * Snapshot that carries only a renewal error.
     */
    public static CredentialSnapshot failed(RuntimeException error) {
        return EMPTY.withError(error);
    }

    /**
     * Converts SDK credentials, keeping their expiration time if they report one.
     */
    public static CredentialSnapshot fromAws(AwsCredentials cr, String source) {
        String token = cr instanceof AwsSessionCredentials
                ? ((AwsSessionCredentials) cr).sessionToken() : null;
        Instant expires = cr.expirationTime().orElse(null);
        return new CredentialSnapshot(cr.accessKeyId(), cr.secretAccessKey(), token,
                expires != null, expires, source);
    }

    public String getAccessKeyId() {
        return accessKeyId;
    }

    public String getSecretAccessKey() {
        return secretAccessKey;
    }

    public String getSessionToken() {
        return sessionToken;
    }

    public boolean isCanExpire() {
        return canExpire;
    }

    public Instant getExpires() {
        return expires;
    }

    public String getSource() {
        return source;
    }

    @JsonIgnore
    public RuntimeException getError() {
        return error;
    }

    @JsonIgnore
    public boolean hasKeys() {
        return accessKeyId != null && !accessKeyId.isEmpty()
                && secretAccessKey != null && !secretAccessKey.isEmpty();
    }

    /**
     * Returns true if the keys will remain valid until time {@code t}.
     */
    public boolean validUntil(Instant t) {
        return hasKeys() && !(canExpire && (expires == null || expires.isBefore(t)));
    }

    public CredentialSnapshot withError(RuntimeException err) {
        return new CredentialSnapshot(accessKeyId, secretAccessKey, sessionToken, canExpire,
                expires, source, err);
    }

    public CredentialSnapshot withSource(String src) {
        return new CredentialSnapshot(accessKeyId, secretAccessKey, sessionToken, canExpire,
                expires, src, error);
    }

    public CredentialSnapshot withExpiry(Instant t) {
        return new CredentialSnapshot(accessKeyId, secretAccessKey, sessionToken, true,
                t, source, error);
    }

    public AwsCredentials toAwsCredentials() {
        if (sessionToken == null || sessionToken.isEmpty()) {
            return AwsBasicCredentials.create(accessKeyId, secretAccessKey);
        }
        return AwsSessionCredentials.create(accessKeyId, secretAccessKey, sessionToken);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CredentialSnapshot)) return false;
        CredentialSnapshot that = (CredentialSnapshot) o;
        return canExpire == that.canExpire
                && Objects.equals(accessKeyId, that.accessKeyId)
                && Objects.equals(secretAccessKey, that.secretAccessKey)
                && Objects.equals(sessionToken, that.sessionToken)
                && Objects.equals(expires, that.expires)
                && Objects.equals(source, that.source)
                && error == that.error;
    }

    @Override
    public int hashCode() {
        return Objects.hash(accessKeyId, sessionToken, canExpire, expires, source);
    }

    @Override
    public String toString() {
        return "CredentialSnapshot{accessKeyId=" + accessKeyId
                + ", canExpire=" + canExpire
                + ", expires=" + expires
                + ", source=" + source
                + (error != null ? ", error=" + error.getMessage() : "")
                + "}";
    }
}
