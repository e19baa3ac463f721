package org.learningjava.facevec.domain.service.store;

import org.learningjava.facevec.domain.error.InvalidIdentifierException;

import java.util.Locale;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Document id validation. Accepts the canonical 8-4-4-4-12 form and the
 * 32-hex-digit simple form; both normalize to canonical lower case.
 */
public final class Identifiers {

    private static final Pattern CANONICAL =
            Pattern.compile("^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");
    private static final Pattern SIMPLE = Pattern.compile("^[0-9a-fA-F]{32}$");

    private Identifiers() {}

    public static UUID parse(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidIdentifierException(value);
        }
        String trimmed = value.trim();
        if (SIMPLE.matcher(trimmed).matches()) {
            trimmed = trimmed.substring(0, 8) + "-" + trimmed.substring(8, 12) + "-" + trimmed.substring(12, 16)
                    + "-" + trimmed.substring(16, 20) + "-" + trimmed.substring(20);
        } else if (!CANONICAL.matcher(trimmed).matches()) {
            throw new InvalidIdentifierException(value);
        }
        return UUID.fromString(trimmed);
    }

    public static String canonical(String value) {
        return parse(value).toString().toLowerCase(Locale.ROOT);
    }
}
