package com.gearcheck.matching;

import java.util.ArrayList;
import java.util.List;

/**
 * Single-pass scanner that turns script text into {@link ScriptToken}s.
 *
 * Rules:
 *   - Identifiers are [A-Za-z_][A-Za-z0-9_]*.
 *   - Strings use ' or " and end at the matching quote on the same line; a backslash escapes
 *     the next character. A quote with no closing partner on its line is emitted as OTHER and
 *     scanning resumes right after it.
 *   - '=' is ASSIGN only when it is not part of ==, ~=, <= or >=.
 *   - Whitespace is skipped; everything else is a one-character OTHER token.
 *
 * No comment, number or long-string syntax is recognized. After one failed search for a
 * closing quote, later quotes of the same kind before that line end fail without rescanning,
 * so scanning stays linear in the text length.
 */
public final class ScriptTokenizer {

    private ScriptTokenizer() {
    }

    public static List<ScriptToken> tokenize(String text) {
        List<ScriptToken> tokens = new ArrayList<>();
        if (text == null) {
            return tokens;
        }
        int length = text.length();
        // per quote kind: position before which no closing partner exists
        int noDoubleCloseBefore = -1;
        int noSingleCloseBefore = -1;
        int i = 0;
        while (i < length) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (isIdentifierStart(c)) {
                int start = i;
                while (i < length && isIdentifierPart(text.charAt(i))) {
                    i++;
                }
                tokens.add(new ScriptToken(ScriptToken.Type.IDENTIFIER, text.substring(start, i), start, i));
            } else if (c == '"' || c == '\'') {
                int knownOpenUntil = c == '"' ? noDoubleCloseBefore : noSingleCloseBefore;
                int close = i < knownOpenUntil ? -1 : findClosingQuote(text, i);
                if (close < -1) {
                    if (c == '"') {
                        noDoubleCloseBefore = -close - 2;
                    } else {
                        noSingleCloseBefore = -close - 2;
                    }
                }
                if (close < 0) {
                    tokens.add(new ScriptToken(ScriptToken.Type.OTHER, String.valueOf(c), i, i + 1));
                    i++;
                } else {
                    tokens.add(new ScriptToken(ScriptToken.Type.STRING, text.substring(i + 1, close), i, close + 1));
                    i = close + 1;
                }
            } else if (c == '=') {
                if (i + 1 < length && text.charAt(i + 1) == '=') {
                    tokens.add(new ScriptToken(ScriptToken.Type.OTHER, "==", i, i + 2));
                    i += 2;
                } else {
                    tokens.add(new ScriptToken(ScriptToken.Type.ASSIGN, "=", i, i + 1));
                    i++;
                }
            } else if ((c == '~' || c == '<' || c == '>') && i + 1 < length && text.charAt(i + 1) == '=') {
                tokens.add(new ScriptToken(ScriptToken.Type.OTHER, text.substring(i, i + 2), i, i + 2));
                i += 2;
            } else {
                tokens.add(new ScriptToken(typeOf(c), String.valueOf(c), i, i + 1));
                i++;
            }
        }
        return tokens;
    }

    /**
     * Index of the closing quote, or {@code -(stop + 2)} where stop is the line end (or text
     * length) at which the search gave up.
     */
    private static int findClosingQuote(String text, int open) {
        char quote = text.charAt(open);
        int i = open + 1;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == quote) {
                return i;
            }
            if (c == '\n' || c == '\r') {
                return -(i + 2);
            }
            i++;
        }
        return -(text.length() + 2);
    }

    private static ScriptToken.Type typeOf(char c) {
        switch (c) {
            case '{':
                return ScriptToken.Type.OPEN_BRACE;
            case '}':
                return ScriptToken.Type.CLOSE_BRACE;
            case ',':
                return ScriptToken.Type.COMMA;
            default:
                return ScriptToken.Type.OTHER;
        }
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || (c >= '0' && c <= '9');
    }
}
