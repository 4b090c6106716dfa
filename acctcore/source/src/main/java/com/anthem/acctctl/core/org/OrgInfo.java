package com.anthem.acctctl.core.org;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import software.amazon.awssdk.services.organizations.model.Organization;

/**
 * Organization information. All fields are null if the gateway account is not
 * part of an organization.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrgInfo {

    private String arn;
    private String id;
    private String featureSet;
    private String masterArn;
    private String masterId;
    private String masterEmail;

    public static OrgInfo none() {
        return new OrgInfo();
    }

    public static OrgInfo from(Organization src) {
        return OrgInfo.builder()
                .arn(src.arn())
                .id(src.id())
                .featureSet(src.featureSetAsString())
                .masterArn(src.masterAccountArn())
                .masterId(src.masterAccountId())
                .masterEmail(src.masterAccountEmail())
                .build();
    }

    public boolean exists() {
        return id != null && !id.isEmpty();
    }
}
