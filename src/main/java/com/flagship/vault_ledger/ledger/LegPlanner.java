package com.flagship.vault_ledger.ledger;

import com.flagship.vault_ledger.exception.LedgerException;

import java.util.List;
import java.util.UUID;

/**
 * Builds and checks the leg set of a transaction.
 *
 * Shapes by kind:
 * - income/refund: one wallet leg and one flow leg, both {@code +amount}
 * - expense: one wallet leg and one flow leg, both {@code -amount}
 * - transfers: two legs of the same target kind ({@code wallet} for
 *   transfer_wallet, {@code flow} for transfer_flow), one {@code -amount} and
 *   one {@code +amount}, on different targets
 */
public final class LegPlanner {

    private LegPlanner() {
        // Utility class
    }

    public static List<PlannedLeg> entryLegs(TransactionKind kind, long amountMinor, UUID walletId, UUID flowId) {
        long signed = kind.signedAmount(amountMinor);
        List<PlannedLeg> legs = List.of(
            new PlannedLeg(LegTarget.wallet(walletId), signed),
            new PlannedLeg(LegTarget.flow(flowId), signed));
        validateShape(kind, amountMinor, legs);
        return legs;
    }

    public static List<PlannedLeg> transferLegs(TransactionKind kind, long amountMinor, UUID fromId, UUID toId) {
        LegTarget.Kind targetKind = transferTargetKind(kind);
        List<PlannedLeg> legs = List.of(
            new PlannedLeg(LegTarget.of(targetKind, fromId), -amountMinor),
            new PlannedLeg(LegTarget.of(targetKind, toId), amountMinor));
        validateShape(kind, amountMinor, legs);
        return legs;
    }

    /**
     * Target kind moved by a transfer transaction.
     */
    public static LegTarget.Kind transferTargetKind(TransactionKind kind) {
        switch (kind) {
            case TRANSFER_WALLET:
                return LegTarget.Kind.WALLET;
            case TRANSFER_FLOW:
                return LegTarget.Kind.FLOW;
            default:
                throw LedgerException.invalidAmount("not a transfer: " + kind.dbValue());
        }
    }

    /**
     * @throws LedgerException INVALID_AMOUNT if the legs do not have the shape required by the kind
     */
    public static void validateShape(TransactionKind kind, long amountMinor, List<PlannedLeg> legs) {
        if (amountMinor <= 0) {
            throw LedgerException.invalidAmount("amount_minor must be > 0");
        }
        if (legs.isEmpty()) {
            throw LedgerException.invalidAmount("transaction must have legs");
        }
        for (PlannedLeg leg : legs) {
            if (leg.getAmountMinor() == 0) {
                throw LedgerException.invalidAmount("leg amount must be non-zero");
            }
        }
        if (legs.size() != 2) {
            throw LedgerException.invalidAmount("transaction must have exactly 2 legs");
        }

        PlannedLeg first = legs.get(0);
        PlannedLeg second = legs.get(1);

        if (kind.isTransfer()) {
            LegTarget.Kind targetKind = transferTargetKind(kind);
            if (first.getTarget().getKind() != targetKind || second.getTarget().getKind() != targetKind) {
                throw LedgerException.invalidAmount("transfer legs must target " + targetKind.dbValue() + "s");
            }
            if (first.getTarget().equals(second.getTarget())) {
                throw LedgerException.invalidAmount("transfer legs must target different " + targetKind.dbValue() + "s");
            }
            boolean opposite = (first.getAmountMinor() == -amountMinor && second.getAmountMinor() == amountMinor)
                || (first.getAmountMinor() == amountMinor && second.getAmountMinor() == -amountMinor);
            if (!opposite) {
                throw LedgerException.invalidAmount("transfer legs must be -amount and +amount");
            }
            return;
        }

        boolean oneWalletOneFlow = first.getTarget().getKind() != second.getTarget().getKind();
        if (!oneWalletOneFlow) {
            throw LedgerException.invalidAmount("transaction needs one wallet leg and one flow leg");
        }
        long expected = kind.signedAmount(amountMinor);
        if (first.getAmountMinor() != expected || second.getAmountMinor() != expected) {
            throw LedgerException.invalidAmount("legs must carry " + expected + " for " + kind.dbValue());
        }
    }
}
