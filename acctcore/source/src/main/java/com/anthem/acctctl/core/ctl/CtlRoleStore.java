package com.anthem.acctctl.core.ctl;

import com.anthem.acctctl.core.exception.AcctCtlException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.iam.IamClient;
import software.amazon.awssdk.services.iam.model.CreateRoleRequest;
import software.amazon.awssdk.services.iam.model.DeleteRoleRequest;
import software.amazon.awssdk.services.iam.model.GetRoleRequest;
import software.amazon.awssdk.services.iam.model.NoSuchEntityException;
import software.amazon.awssdk.services.iam.model.Role;
import software.amazon.awssdk.services.iam.model.UpdateRoleDescriptionRequest;

/**
 * Persists account control records in the description of a well-known IAM
 * role inside each managed account. The role's trust policy denies all
 * principals, so it grants no access by itself.
 *
 * IAM offers no compare-and-swap, so writes are only verified by comparing
 * the echoed description with what was sent.
 */
public class CtlRoleStore {

    private static final Logger log = LoggerFactory.getLogger(CtlRoleStore.class);

    static final String DENY_ALL_POLICY = "{\"Version\":\"2012-10-17\",\"Statement\":[{"
            + "\"Effect\":\"Deny\",\"Principal\":{\"AWS\":\"*\"},\"Action\":\"sts:AssumeRole\"}]}";

    private final String roleName;
    private final String path;

    public CtlRoleStore(String roleName, String path) {
        this.roleName = roleName;
        this.path = path;
    }

    public String getRoleName() {
        return roleName;
    }

    /**
     * Creates the control role in an unmanaged account.
     *
     * @throws software.amazon.awssdk.services.iam.model.EntityAlreadyExistsException if the role exists
     * @throws AcctCtlException of kind CTL_UPDATE if the stored value does not match
     */
    public void init(IamClient iam, Ctl ctl) {
        String enc = CtlCodec.encode(ctl);
        Role r = iam.createRole(CreateRoleRequest.builder()
                .roleName(roleName)
                .path(path)
                .description(enc)
                .assumeRolePolicyDocument(DENY_ALL_POLICY)
                .build()).role();
        // CreateRole does not always echo the description
        String echoed = r == null || r.description() == null ? enc : r.description();
        verify(enc, echoed);
        log.info("Created account control role: role={}", roleName);
    }

    /**
     * Reads the current control record.
     *
     * @throws AcctCtlException of kind NO_CTL if the role does not exist
     */
    public Ctl load(IamClient iam) {
        try {
            Role r = iam.getRole(GetRoleRequest.builder().roleName(roleName).build()).role();
            return CtlCodec.decode(r.description());
        } catch (NoSuchEntityException e) {
            throw AcctCtlException.noCtl();
        }
    }

    /**
     * Overwrites the control record.
     *
     * @throws AcctCtlException of kind NO_CTL if the role was deleted, or
     *                          CTL_UPDATE if the stored value does not match
     */
    public void store(IamClient iam, Ctl ctl) {
        String enc = CtlCodec.encode(ctl);
        Role r;
        try {
            r = iam.updateRoleDescription(UpdateRoleDescriptionRequest.builder()
                    .roleName(roleName)
                    .description(enc)
                    .build()).role();
        } catch (NoSuchEntityException e) {
            throw AcctCtlException.noCtl();
        }
        verify(enc, r != null ? r.description() : null);
    }

    /**
     * Deletes the control role, returning the account to the unmanaged state.
     *
     * @throws AcctCtlException of kind NO_CTL if the role does not exist
     */
    public void delete(IamClient iam) {
        try {
            iam.deleteRole(DeleteRoleRequest.builder().roleName(roleName).build());
            log.info("Deleted account control role: role={}", roleName);
        } catch (NoSuchEntityException e) {
            throw AcctCtlException.noCtl();
        }
    }

    private static void verify(String sent, String echoed) {
        if (!sent.equals(echoed)) {
            throw AcctCtlException.ctlUpdate();
        }
    }
}
