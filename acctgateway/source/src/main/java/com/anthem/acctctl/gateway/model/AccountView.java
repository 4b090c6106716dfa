package com.anthem.acctctl.gateway.model;

import com.anthem.acctctl.core.account.Account;
import com.anthem.acctctl.core.account.ControlState;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Account state as reported by the gateway operations.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AccountView {

    private String id;
    private String name;
    private ControlState state;
    private String owner;
    private String description;
    private List<String> tags;

    /**
     * Error of the last operation on this account, if any.
     */
    private String error;

    public static AccountView of(Account ac) {
        AccountView.AccountViewBuilder b = AccountView.builder()
                .id(ac.getId())
                .name(ac.getName())
                .state(ac.controlState());
        if (ac.isCtlValid()) {
            b.owner(ac.getCtl().getOwner())
                    .description(ac.getCtl().getDesc())
                    .tags(ac.getCtl().getTags());
        }
        if (ac.getErr() != null) {
            b.error(ac.getErr().getMessage());
        }
        return b.build();
    }

    public static List<AccountView> of(List<Account> acs) {
        return acs.stream().map(AccountView::of).toList();
    }
}
