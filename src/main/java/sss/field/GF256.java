package sss.field;

/**
 * Arithmetic in GF(2^8). Multiplication and division handle zero operands through
 * {@link ConstantTime} so that secret coefficients do not select a code path.
 */
public final class GF256 {

    private GF256() {}

    /**
     * Adds two field elements. Also used for subtraction.
     */
    public static int add(int a, int b) {
        return a ^ b;
    }

    /**
     * Multiplies two field elements
     * @param a Field element in [0, 255]
     * @param b Field element in [0, 255]
     * @return a * b
     */
    public static int mult(int a, int b) {
        int sum = (GF256Tables.log(a) + GF256Tables.log(b)) % GF256Tables.ORDER;
        int result = GF256Tables.exp(sum);

        result = ConstantTime.select(ConstantTime.byteEq(a, 0), 0, result);
        return ConstantTime.select(ConstantTime.byteEq(b, 0), 0, result);
    }

    /**
     * Divides two field elements
     * @param a Dividend in [0, 255]
     * @param b Divisor in [1, 255]
     * @return a / b
     * @throws ArithmeticException When b is zero
     */
    public static int div(int a, int b) {
        if (b == 0) // only reachable with duplicate x coordinates
            throw new ArithmeticException("Divide by zero");

        int diff = ((GF256Tables.log(a) - GF256Tables.log(b)) + GF256Tables.ORDER) % GF256Tables.ORDER;
        int result = GF256Tables.exp(diff);

        return ConstantTime.select(ConstantTime.byteEq(a, 0), 0, result);
    }
}
