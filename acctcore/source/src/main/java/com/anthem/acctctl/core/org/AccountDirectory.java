package com.anthem.acctctl.core.org;

import java.util.List;

/**
 * Source of organization and member account information.
 */
public interface AccountDirectory extends AutoCloseable {

    /**
     * Returns organization info, or {@link OrgInfo#none()} if the caller is
     * not part of an organization.
     */
    OrgInfo describeOrganization();

    /**
     * Lists all member accounts. Only the organization master may call this.
     */
    List<AccountInfo> listAccounts();

    @Override
    void close();
}
