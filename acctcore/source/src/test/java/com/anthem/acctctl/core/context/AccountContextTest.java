package com.anthem.acctctl.core.context;

import com.anthem.acctctl.core.AcctCtlProperties;
import com.anthem.acctctl.core.AwsClientFactory;
import com.anthem.acctctl.core.account.Account;
import com.anthem.acctctl.core.account.AccountFlag;
import com.anthem.acctctl.core.account.AccountOps;
import com.anthem.acctctl.core.account.AccountRegistry;
import com.anthem.acctctl.core.bulk.BulkRunner;
import com.anthem.acctctl.core.creds.Arn;
import com.anthem.acctctl.core.creds.CallerIdentity;
import com.anthem.acctctl.core.creds.CredentialProxy;
import com.anthem.acctctl.core.creds.CredentialSnapshot;
import com.anthem.acctctl.core.creds.CredentialsProvider;
import com.anthem.acctctl.core.ctl.Ctl;
import com.anthem.acctctl.core.ctl.CtlCodec;
import com.anthem.acctctl.core.ctl.CtlRoleStore;
import com.anthem.acctctl.core.exception.AcctCtlException;
import com.anthem.acctctl.core.exception.ErrorKind;
import com.anthem.acctctl.core.org.AccountDirectory;
import com.anthem.acctctl.core.org.AccountInfo;
import com.anthem.acctctl.core.org.OrgInfo;
import com.anthem.acctctl.core.session.SavedAccount;
import com.anthem.acctctl.core.session.SavedCredentials;
import com.anthem.acctctl.core.session.SavedSession;
import com.anthem.acctctl.core.testutil.FakeCtlRole;
import com.anthem.acctctl.core.testutil.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.services.iam.IamClient;
import software.amazon.awssdk.services.sts.StsClient;
import software.amazon.awssdk.services.sts.model.GetCallerIdentityResponse;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AccountContextTest {

    private static final String GATEWAY = "000000000000";

    @Mock(lenient = true)
    private StsClient sts;

    @Mock(lenient = true)
    private AwsClientFactory clients;

    @Mock(lenient = true)
    private AccountDirectory directory;

    private MutableClock clock;
    private AcctCtlProperties properties;
    private CredentialsProvider baseCreds;
    private AccountRegistry registry;
    private BulkRunner runner;
    private AccountContext context;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
        properties = new AcctCtlProperties();
        when(sts.getCallerIdentity()).thenReturn(GetCallerIdentityResponse.builder()
                .account(GATEWAY)
                .arn("arn:aws:iam::" + GATEWAY + ":user/alice")
                .userId("AIDAEXAMPLE")
                .build());
        when(clients.directory(any())).thenReturn(directory);
        when(clients.iam(any())).thenReturn(mock(IamClient.class));
        when(directory.describeOrganization()).thenReturn(OrgInfo.none());

        CredentialProxy proxy = new CredentialProxy(sts, clock);
        baseCreds = CredentialsProvider.ofStatic(CredentialSnapshot.permanent("BASE", "SECRET", "test"), null, clock);
        registry = new AccountRegistry(proxy, baseCreds, clients, clock);
        runner = new BulkRunner(4);
        AccountOps ops = new AccountOps(runner, new CtlRoleStore("AcctCtlAccountControl", "/acctctl/"), clock);
        context = new AccountContext(properties, proxy, baseCreds, registry, ops, clients, clock);
    }

    @AfterEach
    void tearDown() {
        runner.close();
    }

    @Test
    void init_shouldDeriveCommonRoleFromSessionName() {
        context.init();

        assertTrue(context.isInitialized());
        assertEquals("/acctctl/alice", context.getCommonRole());
        assertEquals("alice", context.owner());
        verify(clients).directory(baseCreds);
    }

    @Test
    void init_shouldUseConfiguredCommonRole() {
        properties.getIam().setCommonRole("/acctctl/shared");

        context.init();

        assertEquals("shared", context.owner());
    }

    @Test
    void init_shouldUseMasterRoleWhenNotInMasterAccount() {
        // Given
        AccountDirectory master = mock(AccountDirectory.class);
        when(clients.directory(any())).thenReturn(directory, master);
        when(directory.describeOrganization()).thenReturn(OrgInfo.builder()
                .id("o-abc123").masterId("999999999999").masterEmail("master@example.com").build());

        // When
        context.init();

        // Then
        ArgumentCaptor<AwsCredentialsProvider> captor = ArgumentCaptor.forClass(AwsCredentialsProvider.class);
        verify(clients, times(2)).directory(captor.capture());
        assertSame(baseCreds, captor.getAllValues().get(0));
        assertNotSame(baseCreds, captor.getAllValues().get(1));
        verify(directory).close();
        verify(master, never()).close();
    }

    @Test
    void close_shouldReleaseDirectoryAndIamClients() {
        // Given
        context.init();
        Account ac = registry.register(List.of(new Account("111111111111", "test1"))).get(0);
        IamClient iam = ac.getIam();

        // When
        context.close();

        // Then
        verify(directory).close();
        verify(iam).close();
        assertNull(ac.getIam());
        assertTrue(registry.isEmpty());
    }

    @Test
    void restore_shouldRejectSessionWithoutIdentity() {
        SavedSession s = saved("/acctctl/alice");
        s.setIdentity(null);

        assertThrows(IllegalArgumentException.class, () -> context.restore(s));
        assertFalse(context.isInitialized());
    }

    @Test
    void init_shouldFailWhenCalledTwice() {
        context.init();

        assertThrows(IllegalStateException.class, () -> context.init());
    }

    @Test
    void operations_shouldRequireInitialization() {
        assertThrows(IllegalStateException.class, () -> context.save());
        assertThrows(IllegalStateException.class, () -> context.match(""));
    }

    @Test
    void refresh_shouldSkipWithoutOrganization() {
        context.init();

        assertTrue(context.refresh().isEmpty());
        verify(directory, never()).listAccounts();
    }

    @Test
    void match_shouldRefreshAndLoadControlRecords() {
        // Given
        FakeCtlRole owned = new FakeCtlRole().with(CtlCodec.encode(Ctl.EMPTY.withOwner("alice")));
        FakeCtlRole free = new FakeCtlRole().with(CtlCodec.encode(Ctl.EMPTY));
        IamClient ownedIam = owned.client();
        IamClient freeIam = free.client();
        when(clients.iam(any())).thenReturn(ownedIam, freeIam);
        when(directory.describeOrganization()).thenReturn(OrgInfo.builder()
                .id("o-abc123").masterId(GATEWAY).build());
        when(directory.listAccounts()).thenReturn(List.of(
                AccountInfo.builder().id("111111111111").name("test1").build(),
                AccountInfo.builder().id("222222222222").name("test2").build()));
        context.init();

        // When
        List<Account> mine = context.match("owner=me");
        List<Account> all = context.match("");

        // Then
        assertEquals(List.of("111111111111"), ids(mine));
        assertEquals(List.of("111111111111", "222222222222"), ids(all));
        assertTrue(all.get(1).test(AccountFlag.ORG));
        verify(directory, times(1)).listAccounts();
    }

    @Test
    void match_shouldClearErrorsOfPreviousOperations() {
        context.restore(saved("/acctctl/alice"));
        Account ac = registry.get("111111111111");
        ac.setErr(new IllegalStateException("old"));

        context.match("");

        assertNull(ac.getErr());
    }

    @Test
    void restore_shouldSeedCredentialsForSameCommonRole() {
        context.restore(saved("/acctctl/alice"));

        assertTrue(context.isInitialized());
        assertEquals("alice", context.owner());
        Account ac = registry.get("111111111111");
        assertEquals("alice", ac.getCtl().getOwner());
        assertEquals(ac.getCtl(), ac.getRef());
        assertTrue(ac.isCtlValid());
        assertEquals("AKID", ac.getCredsProvider().creds().getAccessKeyId());
        RuntimeException err = registry.credsProvider("222222222222").creds().getError();
        assertTrue(AcctCtlException.is(err, ErrorKind.SAVED));
        assertEquals("access denied", err.getMessage());
        verify(sts, never()).getCallerIdentity();
    }

    @Test
    void restore_shouldDropCredentialsForDifferentCommonRole() {
        context.restore(saved("/acctctl/bob"));

        assertFalse(registry.get("111111111111").getCredsProvider().creds().hasKeys());
    }

    @Test
    void save_shouldKeepOnlyCredentialsValidPastMargin() {
        // Given
        context.init();
        registry.register(List.of(new Account("111111111111", "test1"), new Account("222222222222", "test2"),
                new Account("333333333333", "test3")));
        Instant now = clock.instant();
        registry.credsProvider("111111111111").store(
                CredentialSnapshot.temporary("LONG", "S", "T", now.plus(Duration.ofHours(1)), "test"), null);
        registry.credsProvider("222222222222").store(
                CredentialSnapshot.temporary("SHORT", "S", "T", now.plus(Duration.ofMinutes(2)), "test"), null);
        registry.credsProvider("333333333333").store(
                CredentialSnapshot.EMPTY.withExpiry(now.plus(Duration.ofHours(2))),
                AcctCtlException.noAccess());

        // When
        SavedSession s = context.save();

        // Then
        assertEquals(SavedSession.VERSION, s.getVersion());
        assertEquals("/acctctl/alice", s.getCommonRole());
        assertEquals(List.of("111111111111", "333333333333"),
                s.getCredentials().stream().map(SavedCredentials::getAccountId).collect(Collectors.toList()));
        assertEquals("account access denied", s.getCredentials().get(1).getError());
        assertEquals(3, s.getAccounts().size());
    }

    @Test
    void save_shouldRoundTripThroughRestore() {
        context.restore(saved("/acctctl/alice"));

        SavedSession s = context.save();

        assertEquals("alice", s.getSessionName());
        assertEquals("o-abc123", s.getOrg().getId());
        assertEquals(List.of("111111111111", "222222222222"),
                s.getCredentials().stream().map(SavedCredentials::getAccountId).collect(Collectors.toList()));
    }

    private SavedSession saved(String commonRole) {
        Instant now = clock.instant();
        return SavedSession.builder()
                .version(SavedSession.VERSION)
                .identity(CallerIdentity.builder()
                        .arn(Arn.parse("arn:aws:iam::" + GATEWAY + ":user/alice"))
                        .account(GATEWAY)
                        .userId("AIDAEXAMPLE")
                        .build())
                .sessionName("alice")
                .commonRole(commonRole)
                .org(OrgInfo.builder().id("o-abc123").masterId(GATEWAY).build())
                .credentials(List.of(
                        SavedCredentials.builder()
                                .accountId("111111111111")
                                .snapshot(CredentialSnapshot.temporary("AKID", "SECRET", "TOKEN",
                                        now.plus(Duration.ofHours(1)), "test"))
                                .build(),
                        SavedCredentials.builder()
                                .accountId("222222222222")
                                .snapshot(CredentialSnapshot.EMPTY.withExpiry(now.plus(Duration.ofHours(1))))
                                .error("access denied")
                                .build()))
                .accounts(List.of(SavedAccount.builder()
                        .id("111111111111")
                        .name("test1")
                        .flags(EnumSet.of(AccountFlag.CREDS, AccountFlag.LOADED, AccountFlag.CTL))
                        .ctl(Ctl.EMPTY.withOwner("alice"))
                        .build()))
                .build();
    }

    private static List<String> ids(List<Account> acs) {
        return acs.stream().map(Account::getId).collect(Collectors.toList());
    }
}
