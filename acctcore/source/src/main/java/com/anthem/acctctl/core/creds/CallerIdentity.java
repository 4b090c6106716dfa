package com.anthem.acctctl.core.creds;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import software.amazon.awssdk.services.sts.model.GetCallerIdentityResponse;

/**
 * Result of sts:GetCallerIdentity for the gateway credentials.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CallerIdentity {

    /** Session name used when the identity is an account root. */
    public static final String ROOT_SESSION_NAME = "OrganizationAccountAccessRole";

    private Arn arn;
    private String account;
    private String userId;

    public static CallerIdentity from(GetCallerIdentityResponse out) {
        return CallerIdentity.builder()
                .arn(Arn.parse(out.arn()))
                .account(out.account())
                .userId(out.userId())
                .build();
    }

    /**
     * Returns the RoleSessionName for this identity: the current session name
     * of an assumed role, the IAM user name, or a fixed name for the root.
     */
    public String sessionName() {
        if (userId != null) {
            int i = userId.indexOf(':');
            if (i >= 0) {
                return userId.substring(i + 1);
            }
        }
        if (arn != null) {
            if ("user".equals(arn.type())) {
                return arn.name();
            }
            if ("root".equals(arn.getResource())) {
                return ROOT_SESSION_NAME;
            }
        }
        return userId;
    }

    public String partition() {
        return arn != null ? arn.getPartition() : "aws";
    }
}
