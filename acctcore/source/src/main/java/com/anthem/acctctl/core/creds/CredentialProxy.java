package com.anthem.acctctl.core.creds;

import com.anthem.acctctl.core.org.OrgInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.sts.StsClient;
import software.amazon.awssdk.services.sts.model.AssumeRoleRequest;
import software.amazon.awssdk.services.sts.model.AssumeRoleResponse;
import software.amazon.awssdk.services.sts.model.Credentials;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.time.Duration;
import java.util.HexFormat;

/**
 * Derives credentials for delegated IAM roles from one base identity via
 * sts:AssumeRole.
 */
public class CredentialProxy {

    private static final Logger log = LoggerFactory.getLogger(CredentialProxy.class);

    private static final String EXTERNAL_ID_MAC = "HmacSHA512/256";

    private final StsClient sts;
    private final Clock clock;
    private CallerIdentity identity;
    private String sessionName;

    public CredentialProxy(StsClient sts, Clock clock) {
        this.sts = sts;
        this.clock = clock;
    }

    /**
     * Loads the identity of the base credentials and derives the session name.
     */
    public void init() {
        identity = CallerIdentity.from(sts.getCallerIdentity());
        sessionName = identity.sessionName();
        log.info("Gateway identity: arn={}, sessionName={}", identity.getArn(), sessionName);
    }

    /**
     * Restores identity information without calling STS.
     */
    public void restore(CallerIdentity ident, String sessName) {
        this.identity = ident;
        this.sessionName = sessName;
    }

    public CallerIdentity getIdentity() {
        return identity;
    }

    public String getSessionName() {
        return sessionName;
    }

    /**
     * Returns the ARN of {@code roleName} in {@code account}. An empty account
     * refers to the account of the base credentials.
     */
    public Arn role(String account, String roleName) {
        if (account == null || account.isEmpty()) {
            account = identity.getAccount();
        }
        String path = roleName.startsWith("/") ? roleName : "/" + roleName;
        return Arn.of(identity.partition(), "iam", "", account, "role" + path);
    }

    /**
     * Returns a new provider for the given role. The service default session
     * duration is used if {@code d} is zero.
     */
    public CredentialsProvider assumeRole(Arn role, Duration d) {
        AssumeRoleRequest.Builder in = AssumeRoleRequest.builder()
                .roleArn(role.toString())
                .roleSessionName(sessionName);
        if (d != null && !d.isZero()) {
            in.durationSeconds((int) d.toSeconds());
        }
        return provider(in.build());
    }

    /**
     * Returns a new provider that calls AssumeRole with the given request.
     */
    public CredentialsProvider provider(AssumeRoleRequest in) {
        return CredentialsProvider.renewable(() -> {
            AssumeRoleResponse out = sts.assumeRole(in);
            log.debug("Assumed role: roleArn={}", in.roleArn());
            return fromSts(out.credentials());
        }, clock);
    }

    /**
     * Converts STS credentials to a snapshot.
     */
    public static CredentialSnapshot fromSts(Credentials src) {
        if (src == null) {
            return CredentialSnapshot.EMPTY.withSource(CredentialsProvider.PROXY_SOURCE);
        }
        return CredentialSnapshot.temporary(src.accessKeyId(), src.secretAccessKey(),
                src.sessionToken(), src.expiration(), CredentialsProvider.PROXY_SOURCE);
    }

    /**
     * Computes the external ID required to assume the master-account role of
     * {@code org}. The value is confirmable by anyone who can describe the
     * organization, but differs across unrelated organizations.
     *
     * @throws IllegalStateException if the organization ID is unknown
     */
    public static String externalId(OrgInfo org, String namespace) {
        if (org == null || org.getId() == null || org.getId().isEmpty()) {
            throw new IllegalStateException("unknown organization id");
        }
        String msg = namespace + ":" + org.getMasterId() + ":" + org.getMasterEmail();
        try {
            Mac mac = Mac.getInstance(EXTERNAL_ID_MAC);
            mac.init(new SecretKeySpec(org.getId().getBytes(StandardCharsets.UTF_8), EXTERNAL_ID_MAC));
            return HexFormat.of().formatHex(mac.doFinal(msg.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("external id derivation failed", e);
        }
    }
}
