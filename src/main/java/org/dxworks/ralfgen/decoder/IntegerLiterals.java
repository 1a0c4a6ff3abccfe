package org.dxworks.ralfgen.decoder;

import java.math.BigInteger;
import java.util.Locale;
import java.util.Optional;

/**
 * Parses integer literals the way register sheets write them: {@code 0x1F}, {@code 0b101},
 * {@code 0o17}, {@code 017} (octal), {@code 31}, with an optional sign and single underscores
 * between digits ({@code 0xFFFF_0000}).
 */
public final class IntegerLiterals {

    private IntegerLiterals() {}

    public static Optional<BigInteger> parse(String text) {
        if (text == null) return Optional.empty();
        String s = text.trim();
        if (s.isEmpty()) return Optional.empty();

        boolean negative = false;
        char first = s.charAt(0);
        if (first == '+' || first == '-') {
            negative = first == '-';
            s = s.substring(1);
        }

        int radix = 10;
        String lower = s.toLowerCase(Locale.ROOT);
        if (lower.startsWith("0x")) {
            radix = 16;
            s = s.substring(2);
        } else if (lower.startsWith("0b")) {
            radix = 2;
            s = s.substring(2);
        } else if (lower.startsWith("0o")) {
            radix = 8;
            s = s.substring(2);
        } else if (s.length() > 1 && s.charAt(0) == '0') {
            radix = 8;
            s = s.substring(1);
        }

        String digits = stripSeparators(s, radix);
        if (digits == null) return Optional.empty();

        BigInteger value = new BigInteger(digits, radix);
        return Optional.of(negative ? value.negate() : value);
    }

    /**
     * Returns the digits without underscores, or null if the text is not a valid digit run.
     */
    private static String stripSeparators(String s, int radix) {
        if (s.isEmpty()) return null;
        StringBuilder digits = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '_') {
                boolean betweenDigits = i > 0 && i < s.length() - 1 && s.charAt(i - 1) != '_';
                if (!betweenDigits) return null;
                continue;
            }
            if (Character.digit(c, radix) < 0) return null;
            digits.append(c);
        }
        return digits.toString();
    }
}
