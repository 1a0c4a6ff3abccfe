package org.dxworks.ralfgen.decoder;

import java.math.BigInteger;
import java.util.Locale;
import java.util.Optional;

public final class ResetValueDecoder {

    private ResetValueDecoder() {}

    /**
     * Malformed values are treated as "no reset".
     */
    public static Optional<BigInteger> decode(String cell) {
        return IntegerLiterals.parse(cell);
    }

    /**
     * Truncates {@code value} to {@code width} bits and renders it as {@code <width>'h<HEX>}.
     * Widths of zero or less have no representable reset.
     */
    public static Optional<String> toLiteral(BigInteger value, int width) {
        if (width <= 0) {
            return Optional.empty();
        }
        BigInteger masked = value;
        if (value.signum() < 0 || value.bitLength() > width) {
            masked = value.and(BigInteger.ONE.shiftLeft(width).subtract(BigInteger.ONE));
        }
        String hex = masked.toString(16).toUpperCase(Locale.ROOT);
        return Optional.of(width + "'h" + hex);
    }
}
