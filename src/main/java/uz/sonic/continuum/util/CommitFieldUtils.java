package uz.sonic.continuum.util;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uz.sonic.continuum.model.GitProvider;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

public final class CommitFieldUtils {

    private static final Logger log = LoggerFactory.getLogger(CommitFieldUtils.class);

    private static final List<DateTimeFormatter> FALLBACK_FORMATS = List.of(
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ssZ"),
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ssXXX"),
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss Z")
    );

    private CommitFieldUtils() {
    }

    public record Author(String name, String email) {
        public static final Author EMPTY = new Author("", "");

        public boolean hasEmail() {
            return email != null && !email.isBlank();
        }
    }

    public static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }

    public static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    public static String branchFromRef(String ref) {
        if (ref.startsWith("refs/heads/")) {
            return ref.substring("refs/heads/".length());
        }
        if (ref.startsWith("refs/")) {
            return ref.substring("refs/".length());
        }
        return ref;
    }

    /**
     * Parses a commit timestamp. Never fails: an unreadable value falls back to the current time.
     */
    public static OffsetDateTime parseTimestamp(String value, GitProvider provider, Clock clock) {
        if (value == null || value.isBlank()) {
            log.warn("Missing commit timestamp from {}, using current time", provider.id());
            return OffsetDateTime.now(clock);
        }
        String trimmed = value.strip();
        Optional<OffsetDateTime> parsed = tryParse(() -> OffsetDateTime.parse(trimmed))
                .or(() -> tryParse(() -> LocalDateTime.parse(trimmed).atOffset(ZoneOffset.UTC)))
                .or(() -> FALLBACK_FORMATS.stream()
                        .map(format -> tryParse(() -> OffsetDateTime.parse(trimmed, format)))
                        .flatMap(Optional::stream)
                        .findFirst());
        return parsed.orElseGet(() -> {
            log.warn("Could not parse timestamp '{}' from {}, using current time", trimmed, provider.id());
            return OffsetDateTime.now(clock);
        });
    }

    private static Optional<OffsetDateTime> tryParse(Supplier<OffsetDateTime> parser) {
        try {
            return Optional.of(parser.get());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /**
     * Splits a raw git identity of the form {@code Name <email>}. Without angle brackets the whole
     * string is taken as the name.
     */
    public static Author parseRawAuthor(String raw) {
        if (raw == null || raw.isBlank()) {
            return Author.EMPTY;
        }
        int open = raw.lastIndexOf('<');
        int close = raw.lastIndexOf('>');
        if (open < 0 || close < open) {
            return new Author(raw.strip(), "");
        }
        return new Author(raw.substring(0, open).strip(), raw.substring(open + 1, close).strip());
    }

    public static Author authorFromNode(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Author.EMPTY;
        }
        return new Author(text(node, "name"), text(node, "email"));
    }

    public static String text(JsonNode node, String field) {
        if (node == null) {
            return "";
        }
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : "";
    }
}
