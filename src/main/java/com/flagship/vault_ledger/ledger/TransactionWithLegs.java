package com.flagship.vault_ledger.ledger;

import lombok.Value;

import java.util.List;

@Value
public class TransactionWithLegs {
    LedgerTransaction transaction;
    List<Leg> legs;
}
