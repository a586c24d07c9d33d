package sss.polynomial;

import org.bouncycastle.util.Arrays;
import sss.field.GF256;

import java.security.SecureRandom;

/**
 * Represents polynomial over GF(2^8). Coefficients are stored from the constant term upwards,
 * i.e., coefficients[0] is the constant and coefficients[degree] the highest-degree coefficient.
 */
public class Polynomial {
    private static final int FIELD_SIZE = 256;

    private final int[] polynomial;
    private final int degree;

    /**
     * Generates polynomial of type a_degree*x^degree + ... + a_1*x + constant
     * @param constant Constant term of this polynomial, in [0, 255]
     * @param degree Degree of the polynomial
     * @param rndGenerator Random generator to generate degree coefficients
     */
    public Polynomial(int constant, int degree, SecureRandom rndGenerator) {
        if (degree < 0)
            throw new IllegalArgumentException("Degree cannot be negative");
        this.polynomial = new int[degree + 1];
        this.polynomial[0] = checkElement(constant);
        for (int i = 1; i <= degree; i++) {
            this.polynomial[i] = rndGenerator.nextInt(FIELD_SIZE);
        }
        this.degree = degree;
    }

    /**
     * Creates polynomial coefficients[degree]*x^degree + ... + coefficients[1]*x + coefficients[0]
     * @param coefficients Coefficients of this polynomial, constant term first
     */
    public Polynomial(int[] coefficients) {
        if (coefficients == null || coefficients.length == 0)
            throw new IllegalArgumentException("Polynomial must have at least one coefficient");
        this.polynomial = Arrays.copyOf(coefficients, coefficients.length);
        for (int coefficient : polynomial) {
            checkElement(coefficient);
        }
        this.degree = coefficients.length - 1;
    }

    /**
     * This method uses Horner's method to evaluate polynomial at x.
     * @param x X value
     * @return Polynomial evaluated at x
     */
    public int evaluateAt(int x) {
        if (x == 0)
            return polynomial[0];
        int b = polynomial[degree];
        for (int i = degree - 1; i >= 0; i--) {
            b = GF256.add(GF256.mult(b, x), polynomial[i]);
        }
        return b;
    }

    public int getDegree() {
        return degree;
    }

    public int getConstant() {
        return polynomial[0];
    }

    public int[] getCoefficients() {
        return Arrays.copyOf(polynomial, polynomial.length);
    }

    /**
     * Overwrites all coefficients with zeros. The polynomial must not be evaluated afterwards.
     */
    public void clear() {
        Arrays.clear(polynomial);
    }

    private static int checkElement(int value) {
        if (value < 0 || value >= FIELD_SIZE)
            throw new IllegalArgumentException("Coefficient " + value + " is not a field element");
        return value;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int t = degree; t > 0; t--) {
            if (polynomial[t] == 0)
                continue;
            sb.append(polynomial[t]);
            sb.append("x^");
            sb.append(t);
            sb.append(" + ");
        }
        sb.append(polynomial[0]);
        return sb.toString();
    }
}
