package com.gearcheck.matching;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Canonicalizes raw augment lists into order-independent sets of lower-cased descriptions.
 *
 * Accepted forms:
 *   Accuracy+5; Store TP+3              -> inventory table (semicolon separated)
 *   {"Accuracy+5", 'Store TP+3'}        -> script block (comma separated, quoted)
 *
 * Rules:
 *   - One outer pair of braces is removed.
 *   - Any semicolon selects semicolon splitting, otherwise unquoted commas split.
 *   - In comma mode a double quote opens a quoted run anywhere, a single quote only at the
 *     start of a segment, so apostrophes inside names stay literal. Inside a quoted run a
 *     doubled quote is an escaped quote.
 *   - Segments are trimmed, lose one leading and one trailing quote, have doubled quotes
 *     collapsed and whitespace runs reduced to one space. Empty segments and "System:"
 *     segments are dropped.
 */
public final class AugmentNormalizer {

    public static final String SYSTEM_PREFIX = "System:";

    private AugmentNormalizer() {
    }

    public static Set<String> normalize(String raw) {
        if (raw == null) {
            return Collections.emptySet();
        }
        String text = raw.trim();
        if (text.length() >= 2 && text.charAt(0) == '{' && text.charAt(text.length() - 1) == '}') {
            text = text.substring(1, text.length() - 1);
        }
        if (text.isBlank()) {
            return Collections.emptySet();
        }

        List<String> segments = text.indexOf(';') >= 0
            ? Arrays.asList(text.split(";", -1))
            : splitOnCommas(text);

        Set<String> normalized = new LinkedHashSet<>();
        for (String segment : segments) {
            String value = clean(segment);
            if (value.isEmpty() || value.startsWith(SYSTEM_PREFIX)) {
                continue;
            }
            normalized.add(value.toLowerCase(Locale.ROOT));
        }
        return Collections.unmodifiableSet(normalized);
    }

    /**
     * Canonical text form of a normalized set. {@code normalize(serialize(normalize(s)))}
     * equals {@code normalize(s)}.
     */
    public static String serialize(Set<String> augments) {
        if (augments == null || augments.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (String augment : augments) {
            if (!first) {
                sb.append(',');
            }
            sb.append('"').append(augment.replace("\"", "\"\"")).append('"');
            first = false;
        }
        return sb.append('}').toString();
    }

    static List<String> splitOnCommas(String text) {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean segmentStart = true;
        char quote = 0;
        int length = text.length();
        for (int i = 0; i < length; i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                current.append(c);
                if (c == quote) {
                    if (i + 1 < length && text.charAt(i + 1) == quote) {
                        current.append(quote);
                        i++;
                    } else {
                        quote = 0;
                    }
                }
                continue;
            }
            if (c == ',') {
                parts.add(current.toString());
                current.setLength(0);
                segmentStart = true;
                continue;
            }
            if (c == '"' || (segmentStart && c == '\'')) {
                quote = c;
                segmentStart = false;
            } else if (!Character.isWhitespace(c)) {
                segmentStart = false;
            }
            current.append(c);
        }
        parts.add(current.toString());
        return parts;
    }

    private static String clean(String segment) {
        String value = segment.trim();
        if (!value.isEmpty() && isQuote(value.charAt(0))) {
            value = value.substring(1);
        }
        if (!value.isEmpty() && isQuote(value.charAt(value.length() - 1))) {
            value = value.substring(0, value.length() - 1);
        }
        value = value.replace("\"\"", "\"");
        return value.trim().replaceAll("\\s+", " ");
    }

    private static boolean isQuote(char c) {
        return c == '"' || c == '\'';
    }
}
