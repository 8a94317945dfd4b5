package com.flagship.vault_ledger.query;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.vault_ledger.config.JacksonConfig;
import com.flagship.vault_ledger.exception.ErrorKind;
import com.flagship.vault_ledger.exception.LedgerException;
import com.flagship.vault_ledger.ledger.TransactionKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Base64;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for page cursors and listing filters.
 */
class CursorCodecTest {

    private final ObjectMapper objectMapper = new JacksonConfig().objectMapper();
    private final CursorCodec codec = new CursorCodec(objectMapper);

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    @Test
    @DisplayName("Cursor token is URL-safe base64 over the last row's position")
    void testCursorToken() {
        printTestHeader("Cursor Token");

        // Given: the position of a row
        Cursor cursor = new Cursor(Instant.parse("2025-03-01T10:15:30.123456Z"), UUID.randomUUID());

        // When: encoding it
        String token = codec.encode(cursor);
        printOutput("Token", token);

        // Then: the token has no padding or URL-unsafe characters and decodes to the same position
        assertFalse(token.contains("="));
        assertFalse(token.contains("+"));
        assertFalse(token.contains("/"));
        String json = new String(Base64.getUrlDecoder().decode(token), StandardCharsets.UTF_8);
        printOutput("JSON", json);
        assertTrue(json.contains("\"occurred_at\""));
        assertTrue(json.contains("\"transaction_id\":\"" + cursor.getTransactionId() + "\""));
        assertEquals(cursor, codec.decode(token));
    }

    @Test
    @DisplayName("Malformed tokens are rejected, never treated as an empty page")
    void testMalformedCursor() {
        printTestHeader("Malformed Cursor");

        String notJson = Base64.getUrlEncoder().withoutPadding()
            .encodeToString("hello".getBytes(StandardCharsets.UTF_8));
        String badId = Base64.getUrlEncoder().withoutPadding().encodeToString(
            "{\"occurred_at\":\"2025-03-01T10:15:30Z\",\"transaction_id\":\"nope\"}".getBytes(StandardCharsets.UTF_8));
        String missingField = Base64.getUrlEncoder().withoutPadding().encodeToString(
            "{\"transaction_id\":\"6f1c1d7e-2f55-4a3b-9c86-3f0f0b1a4e11\"}".getBytes(StandardCharsets.UTF_8));
        String jsonNull = Base64.getUrlEncoder().withoutPadding()
            .encodeToString("null".getBytes(StandardCharsets.UTF_8));

        for (String token : new String[] {"%%%", notJson, badId, missingField, jsonNull}) {
            LedgerException e = assertThrows(LedgerException.class, () -> codec.decode(token));
            printOutput("Rejected", token + " -> " + e.getMessage());
            assertEquals(ErrorKind.INVALID_AMOUNT, e.getKind());
            assertEquals("invalid cursor", e.getDetail());
        }
    }

    @Test
    @DisplayName("Filter rejects an empty time window and an empty kind list")
    void testFilterValidation() {
        printTestHeader("Filter Validation");

        Instant t = Instant.parse("2025-01-01T00:00:00Z");
        LedgerException range = assertThrows(LedgerException.class,
            () -> TransactionFilter.builder().from(t).to(t).build().validate());
        assertEquals("invalid range: from must be < to", range.getDetail());

        LedgerException kinds = assertThrows(LedgerException.class,
            () -> TransactionFilter.builder().kinds(Set.of()).build().validate());
        assertEquals("kinds must not be empty", kinds.getDetail());

        assertDoesNotThrow(() -> TransactionFilter.builder()
            .from(t).to(t.plusSeconds(1)).kinds(Set.of(TransactionKind.INCOME)).build().validate());
        assertDoesNotThrow(() -> TransactionFilter.NONE.validate());
        assertFalse(TransactionFilter.NONE.isIncludeVoided());
        assertFalse(TransactionFilter.NONE.isIncludeTransfers());
    }
}
