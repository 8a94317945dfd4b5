package com.flagship.vault_ledger.query;

import lombok.Value;

import java.util.List;
import java.util.Optional;

@Value
public class TransactionPage {
    List<TransactionListItem> items;
    String nextCursor;

    public Optional<String> nextCursor() {
        return Optional.ofNullable(nextCursor);
    }

    public boolean hasMore() {
        return nextCursor != null;
    }
}
