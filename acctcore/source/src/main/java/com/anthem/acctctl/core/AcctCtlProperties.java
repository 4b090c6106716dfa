package com.anthem.acctctl.core;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Account control plane configuration, bound from {@code acctctl.*}.
 */
@Data
@ConfigurationProperties(prefix = "acctctl")
public class AcctCtlProperties {

    private Aws aws = new Aws();
    private Iam iam = new Iam();
    private Creds creds = new Creds();
    private Bulk bulk = new Bulk();
    private Alloc alloc = new Alloc();
    private Session session = new Session();
    private MutexTest mutexTest = new MutexTest();

    @Data
    public static class Aws {
        private String region = "us-east-1";
        /** Endpoint override, used with LocalStack. */
        private String endpoint;
        /** Connection pool size of the HTTP client shared by all AWS clients. */
        private int maxConnections = 100;
    }

    @Data
    public static class Iam {
        /** Path of all IAM users and roles managed by the control plane. */
        private String path = "/acctctl/";
        private String ctlRole = "AcctCtlAccountControl";
        /** Role assumed in every account; defaults to path + session name. */
        private String commonRole;
        private String masterRole = "AcctCtlOrganizationsProxy";
        /** Prefix of the master role external ID. */
        private String namespace = "acctctl";

        public String qualify(String role) {
            return role.startsWith("/") ? role : path + role;
        }
    }

    @Data
    public static class Creds {
        /** Assumed role session duration; zero uses the service default. */
        private Duration sessionDuration = Duration.ZERO;
        /** How long to wait for credentials of new accounts to become usable. */
        private Duration readyTimeout = Duration.ofSeconds(30);
        private Duration readyInterval = Duration.ofSeconds(2);
    }

    @Data
    public static class Bulk {
        private int workers = 32;
    }

    @Data
    public static class Alloc {
        /** Wait before confirming ownership claims. */
        private Duration confirmDelay = Duration.ofSeconds(10);
        private int maxAccounts = 100;
    }

    @Data
    public static class Session {
        /** Persisted session file; blank disables persistence. */
        private String file;
        /** Credentials expiring sooner than this are not persisted. */
        private Duration saveMargin = Duration.ofMinutes(5);
    }

    @Data
    public static class MutexTest {
        private int workers = 5;
        private int tests = 10;
        /** Delay between claiming and verifying the claim inside each worker. */
        private Duration verifyDelay = Duration.ZERO;
    }
}
