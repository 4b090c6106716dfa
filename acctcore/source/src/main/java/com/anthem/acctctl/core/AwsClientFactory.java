package com.anthem.acctctl.core;

import com.anthem.acctctl.core.org.AccountDirectory;
import com.anthem.acctctl.core.org.OrganizationsAccountDirectory;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.services.iam.IamClient;
import software.amazon.awssdk.services.organizations.OrganizationsClient;

/**
 * Creates AWS service clients bound to a specific credentials provider.
 */
public interface AwsClientFactory {

    IamClient iam(AwsCredentialsProvider credentials);

    OrganizationsClient organizations(AwsCredentialsProvider credentials);

    default AccountDirectory directory(AwsCredentialsProvider credentials) {
        return new OrganizationsAccountDirectory(organizations(credentials));
    }
}
