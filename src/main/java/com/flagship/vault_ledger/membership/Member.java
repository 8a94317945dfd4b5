package com.flagship.vault_ledger.membership;

import lombok.Value;

@Value
public class Member {
    String userId;
    Role role;
}
