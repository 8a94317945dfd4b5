package com.flagship.vault_ledger.vault;

import com.flagship.vault_ledger.money.Currency;
import lombok.Value;

import java.util.UUID;

/**
 * Header of a vault: the container of a user's wallets and cash flows.
 */
@Value
public class Vault {
    UUID id;
    String name;
    String ownerUserId;
    Currency currency;

    public boolean isOwnedBy(String userId) {
        return ownerUserId.equals(userId);
    }
}
