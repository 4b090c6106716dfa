package com.anthem.acctctl.core.session;

import com.anthem.acctctl.core.account.AccountFlag;
import com.anthem.acctctl.core.ctl.Ctl;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SavedAccount {

    private String id;
    private String name;
    private Set<AccountFlag> flags;
    private Ctl ctl;
}
