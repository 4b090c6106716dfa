package com.anthem.acctctl.core.session;

import com.anthem.acctctl.core.creds.CallerIdentity;
import com.anthem.acctctl.core.org.OrgInfo;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Serializable state of an {@link com.anthem.acctctl.core.context.AccountContext}.
 * Restoring a saved session avoids re-discovering the identity, organization
 * and accounts, and reuses credentials that are still valid.
 *
 * {@link #VERSION} must be incremented for any incompatible change; sessions
 * of other versions are discarded.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SavedSession {

    public static final int VERSION = 1;

    private int version;
    private CallerIdentity identity;
    private String sessionName;
    private String commonRole;
    private OrgInfo org;
    private List<SavedCredentials> credentials;
    private List<SavedAccount> accounts;
}
