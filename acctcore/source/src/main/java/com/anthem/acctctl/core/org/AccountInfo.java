package com.anthem.acctctl.core.org;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import software.amazon.awssdk.services.organizations.model.Account;

/**
 * Directory entry for one organization member account.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccountInfo {

    private String id;
    private String arn;
    private String name;
    private String email;
    private String status;

    public static AccountInfo from(Account src) {
        return AccountInfo.builder()
                .id(src.id())
                .arn(src.arn())
                .name(src.name())
                .email(src.email())
                .status(src.statusAsString())
                .build();
    }
}
