package com.anthem.acctctl.gateway.config;

import com.anthem.acctctl.core.AcctCtlProperties;
import com.anthem.acctctl.core.AwsClientFactory;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.http.SdkHttpClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.iam.IamClient;
import software.amazon.awssdk.services.organizations.OrganizationsClient;

import java.net.URI;

/**
 * Builds IAM and Organizations clients for the configured region, honoring
 * an endpoint override when one is set. All clients share one HTTP client,
 * which is not closed with them.
 */
public class DefaultAwsClientFactory implements AwsClientFactory {

    private final AcctCtlProperties.Aws aws;
    private final SdkHttpClient httpClient;

    public DefaultAwsClientFactory(AcctCtlProperties properties, SdkHttpClient httpClient) {
        this.aws = properties.getAws();
        this.httpClient = httpClient;
    }

    @Override
    public IamClient iam(AwsCredentialsProvider credentials) {
        var builder = IamClient.builder()
                .httpClient(httpClient)
                .region(hasEndpoint() ? Region.of(aws.getRegion()) : Region.AWS_GLOBAL)
                .credentialsProvider(credentials);
        if (hasEndpoint()) {
            builder.endpointOverride(URI.create(aws.getEndpoint()));
        }
        return builder.build();
    }

    @Override
    public OrganizationsClient organizations(AwsCredentialsProvider credentials) {
        var builder = OrganizationsClient.builder()
                .httpClient(httpClient)
                .region(hasEndpoint() ? Region.of(aws.getRegion()) : Region.AWS_GLOBAL)
                .credentialsProvider(credentials);
        if (hasEndpoint()) {
            builder.endpointOverride(URI.create(aws.getEndpoint()));
        }
        return builder.build();
    }

    private boolean hasEndpoint() {
        return aws.getEndpoint() != null && !aws.getEndpoint().isBlank();
    }
}
