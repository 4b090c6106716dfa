package com.anthem.acctctl.core.org;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.organizations.OrganizationsClient;
import software.amazon.awssdk.services.organizations.model.AwsOrganizationsNotInUseException;
import software.amazon.awssdk.services.organizations.model.ListAccountsRequest;

import java.util.ArrayList;
import java.util.List;

/**
 * Account directory backed by the AWS Organizations API.
 */
public class OrganizationsAccountDirectory implements AccountDirectory {

    private static final Logger log = LoggerFactory.getLogger(OrganizationsAccountDirectory.class);

    private final OrganizationsClient client;

    public OrganizationsAccountDirectory(OrganizationsClient client) {
        this.client = client;
    }

    @Override
    public OrgInfo describeOrganization() {
        try {
            return OrgInfo.from(client.describeOrganization().organization());
        } catch (AwsOrganizationsNotInUseException e) {
            log.info("Gateway account is not part of an organization");
            return OrgInfo.none();
        }
    }

    @Override
    public List<AccountInfo> listAccounts() {
        List<AccountInfo> accounts = new ArrayList<>();
        client.listAccountsPaginator(ListAccountsRequest.builder().build())
                .accounts()
                .forEach(ac -> accounts.add(AccountInfo.from(ac)));
        log.debug("Listed organization accounts: count={}", accounts.size());
        return accounts;
    }

    @Override
    public void close() {
        client.close();
    }
}
