package com.anthem.acctctl.gateway.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.context.annotation.Profile;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;

/**
 * AWS Configuration for Local Development.
 *
 * Uses LocalStack test credentials. Client endpoints follow
 * {@code acctctl.aws.endpoint}, which the local and docker profiles point at
 * LocalStack.
 */
@Configuration
@Profile({"local", "docker"})
public class LocalAwsConfiguration {

    @Bean
    @Primary
    public AwsCredentialsProvider localCredentials() {
        return StaticCredentialsProvider.create(
                AwsBasicCredentials.create("test", "test"));
    }
}
