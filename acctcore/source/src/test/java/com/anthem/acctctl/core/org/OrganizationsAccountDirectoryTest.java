package com.anthem.acctctl.core.org;

import org.junit.jupiter.api.Test;
import software.amazon.awssdk.services.organizations.OrganizationsClient;
import software.amazon.awssdk.services.organizations.model.Account;
import software.amazon.awssdk.services.organizations.model.AccountStatus;
import software.amazon.awssdk.services.organizations.model.AwsOrganizationsNotInUseException;
import software.amazon.awssdk.services.organizations.model.DescribeOrganizationResponse;
import software.amazon.awssdk.services.organizations.model.ListAccountsRequest;
import software.amazon.awssdk.services.organizations.model.ListAccountsResponse;
import software.amazon.awssdk.services.organizations.model.Organization;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;

class OrganizationsAccountDirectoryTest {

    private final OrganizationsClient client = mock(OrganizationsClient.class);
    private final OrganizationsAccountDirectory directory = new OrganizationsAccountDirectory(client);

    @Test
    void describeOrganization_shouldMapMasterAccount() {
        when(client.describeOrganization()).thenReturn(DescribeOrganizationResponse.builder()
                .organization(Organization.builder()
                        .id("o-abc123")
                        .arn("arn:aws:organizations::000000000000:organization/o-abc123")
                        .masterAccountId("000000000000")
                        .masterAccountEmail("master@example.com")
                        .featureSet("ALL")
                        .build())
                .build());

        OrgInfo org = directory.describeOrganization();

        assertTrue(org.exists());
        assertEquals("000000000000", org.getMasterId());
        assertEquals("master@example.com", org.getMasterEmail());
        assertEquals("ALL", org.getFeatureSet());
    }

    @Test
    void describeOrganization_shouldReturnEmptyInfoOutsideOrganization() {
        when(client.describeOrganization())
                .thenThrow(AwsOrganizationsNotInUseException.builder().message("not in use").build());

        assertFalse(directory.describeOrganization().exists());
    }

    @Test
    void listAccounts_shouldFollowPages() {
        // Given: two pages of accounts
        when(client.listAccountsPaginator(any(ListAccountsRequest.class))).thenCallRealMethod();
        when(client.listAccounts(argThat((ListAccountsRequest r) -> r != null && r.nextToken() == null)))
                .thenReturn(ListAccountsResponse.builder()
                        .accounts(account("111111111111", "test1"))
                        .nextToken("page2")
                        .build());
        when(client.listAccounts(argThat((ListAccountsRequest r) -> r != null && "page2".equals(r.nextToken()))))
                .thenReturn(ListAccountsResponse.builder()
                        .accounts(account("222222222222", "test2"))
                        .build());

        // When
        List<AccountInfo> accounts = directory.listAccounts();

        // Then
        assertEquals(List.of("test1", "test2"),
                accounts.stream().map(AccountInfo::getName).collect(Collectors.toList()));
        assertEquals("ACTIVE", accounts.get(0).getStatus());
    }

    @Test
    void close_shouldCloseClient() {
        directory.close();

        verify(client).close();
    }

    private static Account account(String id, String name) {
        return Account.builder().id(id).name(name).email(name + "@example.com")
                .status(AccountStatus.ACTIVE).build();
    }
}
