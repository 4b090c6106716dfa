package com.anthem.acctctl.gateway.config;

import com.anthem.acctctl.core.AcctCtlProperties;
import com.anthem.acctctl.core.AwsClientFactory;
import com.anthem.acctctl.core.account.AccountOps;
import com.anthem.acctctl.core.account.AccountRegistry;
import com.anthem.acctctl.core.bulk.BulkRunner;
import com.anthem.acctctl.core.context.AccountContext;
import com.anthem.acctctl.core.creds.CredentialProxy;
import com.anthem.acctctl.core.creds.CredentialsProvider;
import com.anthem.acctctl.core.ctl.CtlRoleStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.http.SdkHttpClient;
import software.amazon.awssdk.http.apache.ApacheHttpClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.sts.StsClient;

import java.net.URI;
import java.time.Clock;

/**
 * Wires the account control plane: base credentials, STS proxy, account
 * registry, bulk runner and the shared account context.
 */
@Configuration
@EnableConfigurationProperties(AcctCtlProperties.class)
public class AwsClientConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public Sleeper sleeper() {
        return new ThreadWaitSleeper();
    }

    /**
     * Gateway credentials from the default chain (environment, profile, IRSA).
     */
    @Bean
    @ConditionalOnMissingBean
    public AwsCredentialsProvider awsCredentialsProvider() {
        return DefaultCredentialsProvider.create();
    }

    @Bean
    public CredentialsProvider baseCredentials(AwsCredentialsProvider awsCredentialsProvider, Clock clock) {
        return CredentialsProvider.wrap(awsCredentialsProvider, clock);
    }

    /**
     * Connection pool shared by every AWS client of the gateway.
     */
    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public SdkHttpClient awsHttpClient(AcctCtlProperties properties) {
        return ApacheHttpClient.builder()
                .maxConnections(properties.getAws().getMaxConnections())
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public StsClient stsClient(AcctCtlProperties properties, CredentialsProvider baseCredentials,
                               SdkHttpClient awsHttpClient) {
        var builder = StsClient.builder()
                .httpClient(awsHttpClient)
                .region(Region.of(properties.getAws().getRegion()))
                .credentialsProvider(baseCredentials);
        String endpoint = properties.getAws().getEndpoint();
        if (endpoint != null && !endpoint.isBlank()) {
            builder.endpointOverride(URI.create(endpoint));
        }
        return builder.build();
    }

    @Bean
    @ConditionalOnMissingBean
    public AwsClientFactory awsClientFactory(AcctCtlProperties properties, SdkHttpClient awsHttpClient) {
        return new DefaultAwsClientFactory(properties, awsHttpClient);
    }

    @Bean
    public CredentialProxy credentialProxy(StsClient stsClient, Clock clock) {
        return new CredentialProxy(stsClient, clock);
    }

    @Bean(destroyMethod = "close")
    public AccountRegistry accountRegistry(CredentialProxy proxy, CredentialsProvider baseCredentials,
                                           AwsClientFactory clients, Clock clock, AcctCtlProperties properties) {
        AccountRegistry registry = new AccountRegistry(proxy, baseCredentials, clients, clock);
        registry.setSessionDuration(properties.getCreds().getSessionDuration());
        return registry;
    }

    @Bean(destroyMethod = "close")
    public BulkRunner bulkRunner(AcctCtlProperties properties) {
        return new BulkRunner(properties.getBulk().getWorkers());
    }

    @Bean
    public CtlRoleStore ctlRoleStore(AcctCtlProperties properties) {
        return new CtlRoleStore(properties.getIam().getCtlRole(), properties.getIam().getPath());
    }

    @Bean
    public AccountOps accountOps(BulkRunner bulkRunner, CtlRoleStore ctlRoleStore, Clock clock) {
        return new AccountOps(bulkRunner, ctlRoleStore, clock);
    }

    @Bean(destroyMethod = "close")
    public AccountContext accountContext(AcctCtlProperties properties, CredentialProxy proxy,
                                         CredentialsProvider baseCredentials, AccountRegistry registry,
                                         AccountOps ops, AwsClientFactory clients, Clock clock) {
        return new AccountContext(properties, proxy, baseCredentials, registry, ops, clients, clock);
    }
}
