package com.flagship.vault_ledger.ledger;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.UUID;

/**
 * What a leg moves money on: either a wallet or a cash flow.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LegTarget {

    public enum Kind {
        WALLET("wallet"),
        FLOW("flow");

        private final String dbValue;

        Kind(String dbValue) {
            this.dbValue = dbValue;
        }

        public String dbValue() {
            return dbValue;
        }

        public static Kind fromDbValue(String value) {
            for (Kind kind : values()) {
                if (kind.dbValue.equals(value)) {
                    return kind;
                }
            }
            throw new IllegalStateException("Unknown leg target kind: " + value);
        }
    }

    Kind kind;
    UUID id;

    public static LegTarget wallet(UUID walletId) {
        return new LegTarget(Kind.WALLET, walletId);
    }

    public static LegTarget flow(UUID flowId) {
        return new LegTarget(Kind.FLOW, flowId);
    }

    public static LegTarget of(Kind kind, UUID id) {
        return new LegTarget(kind, id);
    }

    public boolean isWallet() {
        return kind == Kind.WALLET;
    }

    public boolean isFlow() {
        return kind == Kind.FLOW;
    }
}
