package org.dxworks.ralfgen.model;

/**
 * A decoded {@code high:low} bit span. No ordering between the two ends is enforced.
 */
public final class BitRange {

    private final int high;
    private final int low;

    public BitRange(int high, int low) {
        this.high = high;
        this.low = low;
    }

    public int getHigh() {
        return high;
    }

    public int getLow() {
        return low;
    }

    public int getWidth() {
        return high - low + 1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BitRange)) return false;
        BitRange other = (BitRange) o;
        return high == other.high && low == other.low;
    }

    @Override
    public int hashCode() {
        return 31 * high + low;
    }

    @Override
    public String toString() {
        return high + ":" + low;
    }
}
