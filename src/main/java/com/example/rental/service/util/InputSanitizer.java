package com.example.rental.service.util;

public final class InputSanitizer {
    private InputSanitizer() {}

    public static final int MAX_LENGTH = 500;
    public static final int MIN_NAME_LENGTH = 2;
    public static final int MAX_NAME_LENGTH = 150;

    /** Strips control characters, escapes {@code < > " '}, collapses whitespace, truncates. */
    public static String sanitize(String input) {
        if (input == null) return "";
        StringBuilder sb = new StringBuilder(input.length());
        input.codePoints().forEach(cp -> {
            if (Character.isWhitespace(cp)) {
                sb.append(' ');
            } else if (!Character.isISOControl(cp)) {
                switch (cp) {
                    case '<' -> sb.append("&lt;");
                    case '>' -> sb.append("&gt;");
                    case '"' -> sb.append("&quot;");
                    case '\'' -> sb.append("&#39;");
                    default -> sb.appendCodePoint(cp);
                }
            }
        });
        String collapsed = sb.toString().replaceAll(" {2,}", " ").trim();
        return collapsed.length() > MAX_LENGTH ? collapsed.substring(0, MAX_LENGTH) : collapsed;
    }

    public static boolean isValidName(String sanitized) {
        int length = sanitized == null ? 0 : sanitized.codePointCount(0, sanitized.length());
        return length >= MIN_NAME_LENGTH && length <= MAX_NAME_LENGTH;
    }
}
