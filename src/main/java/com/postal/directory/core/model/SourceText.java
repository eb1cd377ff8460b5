package com.postal.directory.core.model;

/**
 * Whitespace and case rules for text decoded from eDNE files.
 *
 * <p>Whitespace here is wider than {@link String#trim()} and
 * {@link String#isBlank()}: it also covers NO-BREAK SPACE (U+00A0) and
 * NEXT LINE (U+0085), both single bytes in ISO-8859-1. Case folding and digit
 * checks are ASCII only.</p>
 */
public final class SourceText {

    private SourceText() {
    }

    public static boolean isSpace(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c) || c == '\u0085';
    }

    public static boolean isBlank(String text) {
        return text == null || strip(text).isEmpty();
    }

    /**
     * Removes leading and trailing whitespace; null becomes the empty string.
     */
    public static String strip(String text) {
        if (text == null) {
            return "";
        }
        int start = 0;
        int end = text.length();
        while (start < end && isSpace(text.charAt(start))) {
            start++;
        }
        while (end > start && isSpace(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(start, end);
    }

    public static String toAsciiUpperCase(String text) {
        char[] chars = text.toCharArray();
        for (int i = 0; i < chars.length; i++) {
            if (chars[i] >= 'a' && chars[i] <= 'z') {
                chars[i] = (char) (chars[i] - ('a' - 'A'));
            }
        }
        return new String(chars);
    }

    /**
     * Returns true when {@code text} is non-empty and made only of {@code 0-9}.
     */
    public static boolean isAsciiDigits(String text) {
        if (text.isEmpty()) {
            return false;
        }
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }
}
