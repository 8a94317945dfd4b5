package com.flagship.vault_ledger.query;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.vault_ledger.exception.LedgerException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Instant;
import java.util.Base64;
import java.util.UUID;

/**
 * Encodes page cursors as URL-safe base64 (no padding) over a small JSON
 * document: {@code {"occurred_at": ..., "transaction_id": ...}}.
 *
 * Clients must treat the token as opaque.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CursorCodec {

    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    private final ObjectMapper objectMapper;

    public String encode(Cursor cursor) {
        CursorPayload payload = new CursorPayload(cursor.getOccurredAt(), cursor.getTransactionId().toString());
        try {
            return ENCODER.encodeToString(objectMapper.writeValueAsBytes(payload));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize cursor", e);
        }
    }

    /**
     * @throws LedgerException INVALID_AMOUNT("invalid cursor") for any malformed token
     */
    public Cursor decode(String token) {
        try {
            CursorPayload payload = objectMapper.readValue(DECODER.decode(token), CursorPayload.class);
            if (payload == null || payload.occurredAt == null || payload.transactionId == null) {
                throw LedgerException.invalidAmount("invalid cursor");
            }
            return new Cursor(payload.occurredAt, UUID.fromString(payload.transactionId));
        } catch (IllegalArgumentException | IOException e) {
            log.debug("Rejected cursor {}: {}", token, e.getMessage());
            throw LedgerException.invalidAmount("invalid cursor");
        }
    }

    static final class CursorPayload {
        @JsonProperty("occurred_at")
        final Instant occurredAt;

        @JsonProperty("transaction_id")
        final String transactionId;

        @JsonCreator
        CursorPayload(@JsonProperty("occurred_at") Instant occurredAt,
                      @JsonProperty("transaction_id") String transactionId) {
            this.occurredAt = occurredAt;
            this.transactionId = transactionId;
        }
    }
}
