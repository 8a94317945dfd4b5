package com.flagship.vault_ledger.ledger;

import com.flagship.vault_ledger.access.AccessControlService;
import com.flagship.vault_ledger.exception.LedgerException;
import com.flagship.vault_ledger.money.Currency;
import com.flagship.vault_ledger.money.Money;
import com.flagship.vault_ledger.observability.LedgerMdc;
import com.flagship.vault_ledger.observability.LedgerMetrics;
import com.flagship.vault_ledger.support.Texts;
import com.flagship.vault_ledger.vault.Vault;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Predicate;

/**
 * Service for posting, voiding and amending ledger transactions.
 *
 * This service enforces the core invariants:
 * 1. Every transaction has the leg shape required by its kind
 * 2. Wallet and flow balances move only through legs, and flow caps are
 *    checked on a preview before anything is written
 * 3. Currencies of the transaction and all targets match the vault
 * 4. A retried request with the same idempotency key never posts twice
 *
 * Each public method is one database transaction: read, validate, write.
 * Any failure rolls the whole operation back.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerService {

    private final AccessControlService access;
    private final TargetResolver targets;
    private final TransactionStore transactionStore;
    private final BalanceEngine balanceEngine;
    private final LedgerMetrics metrics;

    /**
     * Records money coming in: {@code +amount} on the wallet and on the flow.
     *
     * @param command the posting request
     * @return id of the new transaction, or of the existing one on an idempotent replay
     * @throws LedgerException on access, shape, currency or cap violations
     */
    @Transactional
    public UUID income(EntryCommand command) {
        return recordEntry(TransactionKind.INCOME, command);
    }

    /**
     * Records money going out: {@code -amount} on the wallet and on the flow.
     */
    @Transactional
    public UUID expense(EntryCommand command) {
        return recordEntry(TransactionKind.EXPENSE, command);
    }

    /**
     * Records money coming back for an earlier expense: {@code +amount} on
     * the wallet and on the flow.
     */
    @Transactional
    public UUID refund(EntryCommand command) {
        return recordEntry(TransactionKind.REFUND, command);
    }

    /**
     * Moves money from one wallet to another. Flows are untouched.
     *
     * @throws LedgerException INVALID_AMOUNT if both wallets are the same
     */
    @Transactional
    public UUID transferWallet(TransferCommand command) {
        requireDistinctEndpoints(command, "wallet");
        return LedgerMdc.withVault(command.getVaultId(), () -> {
            Vault vault = access.requireVaultWrite(command.getVaultId(), command.getUserId());
            requireVaultCurrency(vault, command.getCurrency());
            requirePositive(command.getAmountMinor());
            targets.requireWallet(vault, command.getFromId());
            targets.requireWallet(vault, command.getToId());

            List<PlannedLeg> legs = LegPlanner.transferLegs(
                TransactionKind.TRANSFER_WALLET, command.getAmountMinor(), command.getFromId(), command.getToId());
            return post(vault, transfer(TransactionKind.TRANSFER_WALLET, vault, command), legs);
        });
    }

    /**
     * Moves budget from one flow to another. Wallets are untouched.
     *
     * Allowed with vault write access, or with flow write access on both flows.
     */
    @Transactional
    public UUID transferFlow(TransferCommand command) {
        requireDistinctEndpoints(command, "flow");
        return LedgerMdc.withVault(command.getVaultId(), () -> {
            Vault vault = access.requireFlowsWrite(
                command.getVaultId(), List.of(command.getFromId(), command.getToId()), command.getUserId());
            requireVaultCurrency(vault, command.getCurrency());
            requirePositive(command.getAmountMinor());

            List<PlannedLeg> legs = LegPlanner.transferLegs(
                TransactionKind.TRANSFER_FLOW, command.getAmountMinor(), command.getFromId(), command.getToId());
            return post(vault, transfer(TransactionKind.TRANSFER_FLOW, vault, command), legs);
        });
    }

    /**
     * Voids a transaction: every leg is reversed and the transaction is
     * marked, never deleted.
     *
     * @throws LedgerException KEY_NOT_FOUND if the transaction is not in the vault,
     *         INVALID_AMOUNT if it is already voided
     */
    @Transactional
    public void voidTransaction(UUID vaultId, UUID transactionId, String userId) {
        LedgerMdc.withVault(vaultId, () -> LedgerMdc.withTransaction(transactionId, () -> {
            Vault vault = access.requireVaultWrite(vaultId, userId);
            LedgerTransaction tx = lockTransaction(vault, transactionId);
            if (tx.isVoided()) {
                throw LedgerException.invalidAmount("transaction already voided");
            }

            List<BalanceUpdate> updates = new ArrayList<>();
            for (Leg leg : transactionStore.findLegs(transactionId)) {
                updates.add(BalanceUpdate.reverse(leg.getTarget(), leg.getAmountMinor()));
            }
            BalancePreview preview = balanceEngine.preview(vault, updates);

            transactionStore.markVoided(transactionId, now(), userId);
            balanceEngine.persist(preview);

            metrics.recordTransactionVoided(tx.getKind().dbValue());
            log.info("Transaction voided: kind={}, amount={}, by={}",
                tx.getKind().dbValue(), tx.getAmountMinor(), userId);
            return null;
        }));
    }

    /**
     * Amends amount, metadata and (kind dependent) targets of a transaction.
     *
     * Each leg change is applied as a delta {@code old -> new}; moving a leg
     * to another target withdraws it from the old one and deposits it on the
     * new one. Caps and currencies are re-validated before any write.
     *
     * @throws LedgerException INVALID_AMOUNT for a voided transaction, a
     *         non-positive amount or retargeting fields that do not fit the kind
     */
    @Transactional
    public void updateTransaction(UpdateTransactionCommand command) {
        LedgerMdc.withVault(command.getVaultId(), () -> LedgerMdc.withTransaction(command.getTransactionId(), () -> {
            Vault vault = access.requireVaultWrite(command.getVaultId(), command.getUserId());
            LedgerTransaction tx = lockTransaction(vault, command.getTransactionId());
            if (tx.isVoided()) {
                throw LedgerException.invalidAmount("cannot update a voided transaction");
            }
            TransactionKind kind = tx.getKind();
            validateUpdateFields(kind, command);

            long newAmount = command.getAmountMinor() != null ? command.getAmountMinor() : tx.getAmountMinor();
            if (newAmount <= 0) {
                throw LedgerException.invalidAmount("amount_minor must be > 0");
            }
            Instant newOccurredAt = command.getOccurredAt() != null
                ? command.getOccurredAt().truncatedTo(ChronoUnit.MICROS)
                : tx.getOccurredAt();
            String newCategory = Texts.patch(tx.getCategory(), command.getCategory());
            String newNote = Texts.patch(tx.getNote(), command.getNote());

            List<Leg> legs = transactionStore.findLegs(tx.getId());
            LegRewrite rewrite = new LegRewrite();

            if (kind.isTransfer()) {
                LegTarget.Kind targetKind = LegPlanner.transferTargetKind(kind);
                Leg fromLeg = singleLeg(legs, leg -> leg.getAmountMinor() < 0, "from");
                Leg toLeg = singleLeg(legs, leg -> leg.getAmountMinor() > 0, "to");
                UUID fromOverride = kind == TransactionKind.TRANSFER_WALLET ? command.getFromWalletId() : command.getFromFlowId();
                UUID toOverride = kind == TransactionKind.TRANSFER_WALLET ? command.getToWalletId() : command.getToFlowId();
                UUID newFrom = fromOverride != null ? fromOverride : fromLeg.getTarget().getId();
                UUID newTo = toOverride != null ? toOverride : toLeg.getTarget().getId();
                if (newFrom.equals(newTo)) {
                    String name = targetKind.dbValue();
                    throw LedgerException.invalidAmount("from_" + name + "_id and to_" + name + "_id must differ");
                }
                requireTargetInVault(vault, LegTarget.of(targetKind, newFrom));
                requireTargetInVault(vault, LegTarget.of(targetKind, newTo));

                rewrite.move(fromLeg, LegTarget.of(targetKind, newFrom), -newAmount);
                rewrite.move(toLeg, LegTarget.of(targetKind, newTo), newAmount);
            } else {
                Leg walletLeg = singleLeg(legs, leg -> leg.getTarget().isWallet(), "wallet");
                Leg flowLeg = singleLeg(legs, leg -> leg.getTarget().isFlow(), "flow");
                UUID newWalletId = command.getWalletId() != null ? command.getWalletId() : walletLeg.getTarget().getId();
                UUID newFlowId = command.getFlowId() != null ? command.getFlowId() : flowLeg.getTarget().getId();
                targets.requireWallet(vault, newWalletId);
                targets.requireFlow(vault, newFlowId);

                long signed = kind.signedAmount(newAmount);
                rewrite.move(walletLeg, LegTarget.wallet(newWalletId), signed);
                rewrite.move(flowLeg, LegTarget.flow(newFlowId), signed);
            }
            LegPlanner.validateShape(kind, newAmount, rewrite.plannedLegs());

            BalancePreview preview = balanceEngine.preview(vault, rewrite.balanceUpdates);

            transactionStore.updateHeader(tx.getId(), newAmount, newCategory, newNote, newOccurredAt);
            for (int i = 0; i < rewrite.legIds.size(); i++) {
                PlannedLeg planned = rewrite.planned.get(i);
                transactionStore.updateLeg(rewrite.legIds.get(i), planned.getTarget(), planned.getAmountMinor());
            }
            balanceEngine.persist(preview);

            metrics.recordTransactionUpdated(kind.dbValue());
            log.info("Transaction updated: kind={}, amount={}->{}, by={}",
                kind.dbValue(), tx.getAmountMinor(), newAmount, command.getUserId());
            return null;
        }));
    }

    /**
     * Returns a transaction with its legs (ordered by leg id).
     *
     * @throws LedgerException FORBIDDEN if the caller is neither owner nor
     *         member of the vault, KEY_NOT_FOUND if the transaction is not in it
     */
    @Transactional(readOnly = true)
    public TransactionWithLegs transactionWithLegs(UUID vaultId, UUID transactionId, String userId) {
        Vault vault = access.requireVaultReadOrForbidden(vaultId, userId);
        LedgerTransaction tx = transactionStore.findById(transactionId)
            .filter(found -> found.getVaultId().equals(vault.getId()))
            .orElseThrow(() -> LedgerException.keyNotFound("transaction not exists"));
        return new TransactionWithLegs(tx, transactionStore.findLegs(transactionId));
    }

    private UUID recordEntry(TransactionKind kind, EntryCommand command) {
        return LedgerMdc.withVault(command.getVaultId(), () -> {
            Vault vault = access.requireVaultWrite(command.getVaultId(), command.getUserId());
            requireVaultCurrency(vault, command.getCurrency());
            requirePositive(command.getAmountMinor());

            UUID flowId = targets.resolveFlowId(vault, command.getFlowId());
            UUID walletId = targets.resolveWalletId(vault, command.getWalletId());
            UUID refundedId = resolveRefunded(kind, vault, command.getRefundedTransactionId());

            List<PlannedLeg> legs = LegPlanner.entryLegs(kind, command.getAmountMinor(), walletId, flowId);
            LedgerTransaction tx = LedgerTransaction.builder()
                .id(UUID.randomUUID())
                .vaultId(vault.getId())
                .kind(kind)
                .occurredAt(occurredAtOrNow(command.getOccurredAt()))
                .amountMinor(command.getAmountMinor())
                .currency(vault.getCurrency())
                .category(Texts.normalizeOptional(command.getCategory()))
                .note(Texts.normalizeOptional(command.getNote()))
                .createdBy(command.getUserId())
                .refundedTransactionId(refundedId)
                .idempotencyKey(Texts.normalizeOptional(command.getIdempotencyKey()))
                .build();
            return post(vault, tx, legs);
        });
    }

    /**
     * Persists a transaction and its legs and applies the balance changes.
     *
     * With an idempotency key the existing transaction is returned instead,
     * either found up front or, when a concurrent request wins the unique
     * index, re-read after the insert is skipped.
     */
    private UUID post(Vault vault, LedgerTransaction tx, List<PlannedLeg> legs) {
        String key = tx.getIdempotencyKey();
        if (key != null) {
            Optional<UUID> existing = transactionStore.findIdByIdempotencyKey(vault.getId(), tx.getCreatedBy(), key);
            if (existing.isPresent()) {
                metrics.recordIdempotencyHit();
                log.info("Idempotency key already used, returning existing transaction {}", existing.get());
                return existing.get();
            }
            metrics.recordIdempotencyMiss();
        }

        List<BalanceUpdate> updates = new ArrayList<>();
        for (PlannedLeg leg : legs) {
            updates.add(BalanceUpdate.create(leg.getTarget(), leg.getAmountMinor()));
        }
        BalancePreview preview = balanceEngine.preview(vault, updates);

        if (!transactionStore.insertIfAbsent(tx)) {
            UUID winner = transactionStore.findIdByIdempotencyKey(vault.getId(), tx.getCreatedBy(), key)
                .orElseThrow(() -> new IllegalStateException(
                    "Transaction insert skipped but no row holds idempotency key " + key));
            metrics.recordIdempotencyHit();
            log.info("Concurrent request with the same idempotency key won, returning transaction {}", winner);
            return winner;
        }

        for (PlannedLeg leg : legs) {
            transactionStore.insertLeg(new Leg(
                UUID.randomUUID(), tx.getId(), leg.getTarget(), leg.getAmountMinor(), vault.getCurrency(), tx.getCreatedBy()));
        }
        balanceEngine.persist(preview);

        metrics.recordTransactionCreated(tx.getKind().dbValue());
        LedgerMdc.withTransaction(tx.getId(), () -> {
            log.info("Transaction posted: kind={}, amount={}, by={}",
                tx.getKind().dbValue(), Money.formatMinor(tx.getAmountMinor(), vault.getCurrency()), tx.getCreatedBy());
            return null;
        });
        return tx.getId();
    }

    private LedgerTransaction transfer(TransactionKind kind, Vault vault, TransferCommand command) {
        return LedgerTransaction.builder()
            .id(UUID.randomUUID())
            .vaultId(vault.getId())
            .kind(kind)
            .occurredAt(occurredAtOrNow(command.getOccurredAt()))
            .amountMinor(command.getAmountMinor())
            .currency(vault.getCurrency())
            .note(Texts.normalizeOptional(command.getNote()))
            .createdBy(command.getUserId())
            .idempotencyKey(Texts.normalizeOptional(command.getIdempotencyKey()))
            .build();
    }

    private UUID resolveRefunded(TransactionKind kind, Vault vault, UUID refundedTransactionId) {
        if (refundedTransactionId == null) {
            return null;
        }
        if (kind != TransactionKind.REFUND) {
            throw LedgerException.invalidAmount("refunded_transaction_id is only valid for refunds");
        }
        transactionStore.findById(refundedTransactionId)
            .filter(found -> found.getVaultId().equals(vault.getId()))
            .orElseThrow(() -> LedgerException.keyNotFound("transaction not exists"));
        return refundedTransactionId;
    }

    private LedgerTransaction lockTransaction(Vault vault, UUID transactionId) {
        return transactionStore.findByIdForUpdate(transactionId)
            .filter(found -> found.getVaultId().equals(vault.getId()))
            .orElseThrow(() -> LedgerException.keyNotFound("transaction not exists"));
    }

    private void requireTargetInVault(Vault vault, LegTarget target) {
        if (target.isWallet()) {
            targets.requireWallet(vault, target.getId());
        } else {
            targets.requireFlow(vault, target.getId());
        }
    }

    /**
     * Rejects retargeting fields that do not apply to the kind, instead of
     * silently ignoring them.
     */
    static void validateUpdateFields(TransactionKind kind, UpdateTransactionCommand command) {
        boolean entryFields = command.getWalletId() != null || command.getFlowId() != null;
        boolean walletTransferFields = command.getFromWalletId() != null || command.getToWalletId() != null;
        boolean flowTransferFields = command.getFromFlowId() != null || command.getToFlowId() != null;

        switch (kind) {
            case INCOME:
            case EXPENSE:
            case REFUND:
                if (walletTransferFields || flowTransferFields) {
                    throw LedgerException.invalidAmount("invalid update: unexpected transfer fields");
                }
                break;
            case TRANSFER_WALLET:
                if (entryFields || flowTransferFields) {
                    throw LedgerException.invalidAmount("invalid update: unexpected wallet/flow fields");
                }
                break;
            case TRANSFER_FLOW:
                if (entryFields || walletTransferFields) {
                    throw LedgerException.invalidAmount("invalid update: unexpected wallet fields");
                }
                break;
            default:
                throw new IllegalStateException("Unknown transaction kind: " + kind);
        }
    }

    private static void requireDistinctEndpoints(TransferCommand command, String what) {
        if (command.getFromId() == null || command.getToId() == null) {
            throw LedgerException.invalidAmount("from_" + what + "_id and to_" + what + "_id are required");
        }
        if (command.getFromId().equals(command.getToId())) {
            throw LedgerException.invalidAmount("from_" + what + "_id and to_" + what + "_id must differ");
        }
    }

    private static void requireVaultCurrency(Vault vault, Currency requested) {
        if (requested != null && requested != vault.getCurrency()) {
            throw LedgerException.currencyMismatch(
                "vault currency is " + vault.getCurrency().code() + ", got " + requested.code());
        }
    }

    private static void requirePositive(long amountMinor) {
        if (amountMinor <= 0) {
            throw LedgerException.invalidAmount("amount_minor must be > 0");
        }
    }

    private static Leg singleLeg(List<Leg> legs, Predicate<Leg> filter, String role) {
        List<Leg> matching = legs.stream().filter(filter).toList();
        if (matching.size() != 1) {
            throw new IllegalStateException("Expected exactly one " + role + " leg, found " + matching.size());
        }
        return matching.get(0);
    }

    private static Instant occurredAtOrNow(Instant occurredAt) {
        return (occurredAt != null ? occurredAt : Instant.now()).truncatedTo(ChronoUnit.MICROS);
    }

    private static Instant now() {
        return Instant.now().truncatedTo(ChronoUnit.MICROS);
    }

    /**
     * Collects the new target/amount of each leg and the balance updates
     * that move it there.
     */
    private static final class LegRewrite {
        private final List<UUID> legIds = new ArrayList<>();
        private final List<PlannedLeg> planned = new ArrayList<>();
        private final List<BalanceUpdate> balanceUpdates = new ArrayList<>();

        void move(Leg leg, LegTarget newTarget, long newAmount) {
            if (leg.getTarget().equals(newTarget)) {
                balanceUpdates.add(new BalanceUpdate(newTarget, leg.getAmountMinor(), newAmount));
            } else {
                balanceUpdates.add(new BalanceUpdate(leg.getTarget(), leg.getAmountMinor(), 0L));
                balanceUpdates.add(new BalanceUpdate(newTarget, 0L, newAmount));
            }
            legIds.add(leg.getId());
            planned.add(new PlannedLeg(newTarget, newAmount));
        }

        List<PlannedLeg> plannedLegs() {
            return planned;
        }
    }
}
