package com.anthem.acctctl.core.creds;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CallerIdentityTest {

    private static CallerIdentity ident(String arn, String userId) {
        return CallerIdentity.builder().arn(Arn.parse(arn)).account("000000000000").userId(userId).build();
    }

    @Test
    void sessionName_shouldUseAssumedRoleSession() {
        assertEquals("bob@example.com",
                ident("arn:aws:sts::000000000000:assumed-role/dev/bob@example.com", "AROAID:bob@example.com")
                        .sessionName());
    }

    @Test
    void sessionName_shouldUseIamUserName() {
        assertEquals("carol", ident("arn:aws:iam::000000000000:user/team/carol", "AIDAID").sessionName());
    }

    @Test
    void sessionName_shouldUseFixedNameForRoot() {
        assertEquals(CallerIdentity.ROOT_SESSION_NAME,
                ident("arn:aws:iam::000000000000:root", "000000000000").sessionName());
    }

    @Test
    void sessionName_shouldFallBackToUserId() {
        assertEquals("AIDAFED", ident("arn:aws:sts::000000000000:federated-user/x", "AIDAFED").sessionName());
    }

    @Test
    void partition_shouldComeFromArn() {
        assertEquals("aws-us-gov", ident("arn:aws-us-gov:iam::000000000000:user/dave", "AIDA").partition());
        assertEquals("aws", new CallerIdentity().partition());
    }
}
