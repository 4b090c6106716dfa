package com.anthem.acctctl.core.session;

import com.anthem.acctctl.core.creds.CredentialSnapshot;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Cached credentials of one account. Errors are kept as message text only.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SavedCredentials {

    private String accountId;
    private CredentialSnapshot snapshot;
    private String error;
}
