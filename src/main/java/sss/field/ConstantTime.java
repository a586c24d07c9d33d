package sss.field;

/**
 * Comparison and selection on byte values without branching on the values themselves.
 */
public final class ConstantTime {

    private ConstantTime() {}

    /**
     * Returns 1 if x == y and 0 otherwise
     * @param x Value in [0, 255]
     * @param y Value in [0, 255]
     * @return 1 or 0
     * @throws IllegalArgumentException When x or y is not a uint8 value
     */
    public static int byteEq(int x, int y) {
        if (((~0xFF & x) | (~0xFF & y)) != 0)
            throw new IllegalArgumentException("Not uint8 values passed");
        // (x ^ y) - 1 is negative only when x ^ y == 0
        return ((x ^ y) - 1) >>> 31;
    }

    /**
     * Returns x if v == 1 and y if v == 0
     * @param v Selector, 0 or 1
     * @param x Value returned when v == 1
     * @param y Value returned when v == 0
     * @return x or y
     * @throws IllegalStateException When v is neither 0 nor 1
     */
    public static int select(int v, int x, int y) {
        if (v != 0 && v != 1)
            throw new IllegalStateException("Undefined behavior");
        return ~(v - 1) & x | (v - 1) & y;
    }
}
