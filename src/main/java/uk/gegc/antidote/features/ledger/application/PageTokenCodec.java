package uk.gegc.antidote.features.ledger.application;

import uk.gegc.antidote.features.ledger.domain.model.CreditTransaction;
import uk.gegc.antidote.shared.exception.InvalidInputException;

import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.Base64;
import java.util.UUID;

/**
 * Opaque keyset cursor for transaction listings: the {@code (createdAt, id)} of the last entry returned.
 */
public final class PageTokenCodec {

    private static final String SEPARATOR = "|";

    private PageTokenCodec() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public record Cursor(LocalDateTime createdAt, UUID id) {
    }

    public static String encode(CreditTransaction last) {
        String raw = last.getCreatedAt().toString() + SEPARATOR + last.getId();
        return Base64.getUrlEncoder().withoutPadding().encodeToString(raw.getBytes(StandardCharsets.UTF_8));
    }

    public static Cursor decode(String token) {
        try {
            String raw = new String(Base64.getUrlDecoder().decode(token), StandardCharsets.UTF_8);
            int separator = raw.indexOf(SEPARATOR);
            if (separator < 0) {
                throw new InvalidInputException("Malformed page token");
            }
            return new Cursor(
                    LocalDateTime.parse(raw.substring(0, separator)),
                    UUID.fromString(raw.substring(separator + 1)));
        } catch (IllegalArgumentException | DateTimeParseException e) {
            throw new InvalidInputException("Malformed page token");
        }
    }
}
