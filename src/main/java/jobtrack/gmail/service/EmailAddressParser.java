package jobtrack.gmail.service;

import jobtrack.gmail.dto.ParsedAddress;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parses RFC 5322 style address headers such as {@code "Jane Doe" <jane@acme.io>}.
 */
public final class EmailAddressParser {
    private static final Pattern VALID_EMAIL = Pattern.compile("^[^@\\s<>\"]+@[^@\\s<>\"]+\\.[^@\\s<>\".]+$");
    // commas inside quoted display names do not separate addresses
    private static final Pattern LIST_SEPARATOR = Pattern.compile(",(?=(?:[^\"]*\"[^\"]*\")*[^\"]*$)");

    private EmailAddressParser() {
    }

    public static Optional<ParsedAddress> parse(String header) {
        if (header == null || header.isBlank()) {
            return Optional.empty();
        }
        String value = header.trim();
        String name = "";
        String email;

        int open = value.lastIndexOf('<');
        int close = value.lastIndexOf('>');
        if (open >= 0 && close > open) {
            email = value.substring(open + 1, close).trim();
            name = stripQuotes(value.substring(0, open).trim());
        } else {
            email = value;
        }

        email = email.toLowerCase(Locale.ROOT);
        if (!VALID_EMAIL.matcher(email).matches()) {
            return Optional.empty();
        }
        String domain = email.substring(email.indexOf('@') + 1);
        return Optional.of(new ParsedAddress(email, name, domain));
    }

    /**
     * Parses a comma separated header, silently dropping entries without a valid address.
     */
    public static List<ParsedAddress> parseList(String header) {
        List<ParsedAddress> addresses = new ArrayList<>();
        if (header == null || header.isBlank()) {
            return addresses;
        }
        for (String part : LIST_SEPARATOR.split(header)) {
            parse(part).ifPresent(addresses::add);
        }
        return addresses;
    }

    private static String stripQuotes(String name) {
        String stripped = name;
        if (stripped.length() >= 2 && stripped.startsWith("\"") && stripped.endsWith("\"")) {
            stripped = stripped.substring(1, stripped.length() - 1);
        }
        return stripped.trim();
    }
}
