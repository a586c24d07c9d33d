package sss.field;

/**
 * Logarithm and exponential tables of GF(2^8) with reduction polynomial x^8 + x^4 + x^3 + x + 1
 * and generator 0x03.
 */
public final class GF256Tables {
    static final int SIZE = 256;
    static final int ORDER = 255;
    private static final int REDUCTION_POLYNOMIAL = 0x11B;

    private static final int[] exp = new int[SIZE];
    private static final int[] log = new int[SIZE];

    static {
        int x = 1;
        for (int i = 0; i < ORDER; i++) {
            exp[i] = x;
            log[x] = i;
            // x * 3 = (x * 2) ^ x
            int doubled = x << 1;
            if ((doubled & SIZE) != 0)
                doubled ^= REDUCTION_POLYNOMIAL;
            x = doubled ^ x;
        }
        exp[ORDER] = exp[0];

        for (int i = 1; i < SIZE; i++) {
            if (exp[log[i]] != i)
                throw new IllegalStateException("exp[log[" + i + "]] != " + i + ", log[" + i + "] = " + log[i]);
        }
    }

    private GF256Tables() {}

    /**
     * Returns the field element whose discrete logarithm is {@code i mod 255}
     * @param i Index in [0, 255]
     * @return Field element
     */
    public static int exp(int i) {
        return exp[i];
    }

    /**
     * Returns the discrete logarithm of a field element. The value for 0 is meaningless.
     * @param element Field element in [0, 255]
     * @return Logarithm in [0, 254]
     */
    public static int log(int element) {
        return log[element];
    }
}
