package com.gearcheck.matching;

/**
 * One lexical unit of script text. Offsets index into the scanned text, end exclusive.
 */
public final class ScriptToken {

    public enum Type {
        IDENTIFIER,
        STRING,
        ASSIGN,
        OPEN_BRACE,
        CLOSE_BRACE,
        COMMA,
        OTHER
    }

    private final Type type;
    private final String text;
    private final int start;
    private final int end;

    public ScriptToken(Type type, String text, int start, int end) {
        this.type = type;
        this.text = text;
        this.start = start;
        this.end = end;
    }

    public Type getType() {
        return type;
    }

    /** Identifier or operator text; for strings, the content between the quotes. */
    public String getText() {
        return text;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public boolean is(Type expected) {
        return type == expected;
    }

    public boolean isIdentifier(String word) {
        return type == Type.IDENTIFIER && text.equalsIgnoreCase(word);
    }

    @Override
    public String toString() {
        return type + "(" + text + ")";
    }
}
