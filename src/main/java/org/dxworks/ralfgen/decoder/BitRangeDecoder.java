package org.dxworks.ralfgen.decoder;

import org.dxworks.ralfgen.model.BitRange;

import java.util.Optional;

/**
 * Decodes the Bit column: {@code "7:0"} is bits 7 down to 0, {@code "3"} is the single bit 3.
 * An empty or non-numeric cell, or a span whose width does not fit an int, yields no range and the
 * row contributes no field.
 */
public final class BitRangeDecoder {

    private BitRangeDecoder() {}

    public static Optional<BitRange> decode(String cell) {
        if (cell == null || cell.isBlank()) {
            return Optional.empty();
        }

        String text = cell.trim();
        int colon = text.indexOf(':');
        try {
            if (colon >= 0) {
                int high = Integer.parseInt(text.substring(0, colon).trim());
                int low = Integer.parseInt(text.substring(colon + 1).trim());
                return widthFitsInt(high, low) ? Optional.of(new BitRange(high, low)) : Optional.empty();
            }
            int bit = Integer.parseInt(text);
            return Optional.of(new BitRange(bit, bit));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static boolean widthFitsInt(int high, int low) {
        try {
            Math.addExact(Math.subtractExact(high, low), 1);
            return true;
        } catch (ArithmeticException e) {
            return false;
        }
    }
}
