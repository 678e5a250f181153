package com.cywriter;

/**
 * Quoting of string and bytes literals, following Python's {@code repr()} conventions: single
 * quotes unless the value contains a single quote and no double quote, backslash escapes for
 * the quote, backslash, tab, newline and carriage return, and hex escapes for anything that
 * is not printable.
 */
public final class StringLiterals {

    private StringLiterals() {
        // Utility class
    }

    public static String quote(String value) {
        return quote("", value);
    }

    /**
     * @param prefix literal prefix, e.g. {@code "u"}; empty for a plain string
     */
    public static String quote(String prefix, String value) {
        char quote = chooseQuote(value.indexOf('\'') >= 0, value.indexOf('"') >= 0);
        StringBuilder sb = new StringBuilder(value.length() + prefix.length() + 2);
        sb.append(prefix).append(quote);
        int i = 0;
        while (i < value.length()) {
            int cp = value.codePointAt(i);
            i += Character.charCount(cp);
            if (!appendCommonEscape(sb, cp, quote)) {
                if (isPrintable(cp)) {
                    sb.appendCodePoint(cp);
                } else if (cp < 0x100) {
                    sb.append(String.format("\\x%02x", cp));
                } else if (cp < 0x10000) {
                    sb.append(String.format("\\u%04x", cp));
                } else {
                    sb.append(String.format("\\U%08x", cp));
                }
            }
        }
        return sb.append(quote).toString();
    }

    public static String quoteBytes(byte[] value) {
        boolean hasSingle = false;
        boolean hasDouble = false;
        for (byte b : value) {
            hasSingle |= b == '\'';
            hasDouble |= b == '"';
        }
        char quote = chooseQuote(hasSingle, hasDouble);
        StringBuilder sb = new StringBuilder(value.length + 3);
        sb.append('b').append(quote);
        for (byte b : value) {
            int c = b & 0xff;
            if (!appendCommonEscape(sb, c, quote)) {
                if (c >= 0x20 && c < 0x7f) {
                    sb.append((char) c);
                } else {
                    sb.append(String.format("\\x%02x", c));
                }
            }
        }
        return sb.append(quote).toString();
    }

    private static char chooseQuote(boolean hasSingle, boolean hasDouble) {
        return hasSingle && !hasDouble ? '"' : '\'';
    }

    private static boolean appendCommonEscape(StringBuilder sb, int c, char quote) {
        switch (c) {
            case '\\' -> sb.append("\\\\");
            case '\t' -> sb.append("\\t");
            case '\n' -> sb.append("\\n");
            case '\r' -> sb.append("\\r");
            default -> {
                if (c != quote) {
                    return false;
                }
                sb.append('\\').append(quote);
            }
        }
        return true;
    }

    private static boolean isPrintable(int cp) {
        if (cp == ' ') {
            return true;
        }
        switch (Character.getType(cp)) {
            case Character.CONTROL:
            case Character.FORMAT:
            case Character.SURROGATE:
            case Character.PRIVATE_USE:
            case Character.UNASSIGNED:
            case Character.LINE_SEPARATOR:
            case Character.PARAGRAPH_SEPARATOR:
            case Character.SPACE_SEPARATOR:
                return false;
            default:
                return true;
        }
    }
}
