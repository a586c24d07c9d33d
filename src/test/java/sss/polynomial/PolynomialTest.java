package sss.polynomial;

import org.junit.Test;
import sss.field.GF256;

import java.security.SecureRandom;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

public class PolynomialTest {
    private final SecureRandom rndGenerator = new SecureRandom();

    @Test
    public void testRandomPolynomial() {
        Polynomial polynomial = new Polynomial(42, 2, rndGenerator);
        assertEquals(42, polynomial.getConstant());
        assertEquals(2, polynomial.getDegree());
        assertEquals(3, polynomial.getCoefficients().length);
        for (int coefficient : polynomial.getCoefficients()) {
            assertEquals(coefficient, coefficient & 0xFF);
        }
    }

    @Test
    public void testEvaluateAtZeroReturnsConstant() {
        for (int degree = 0; degree < 10; degree++) {
            for (int constant = 0; constant < 256; constant += 17) {
                Polynomial polynomial = new Polynomial(constant, degree, rndGenerator);
                assertEquals(constant, polynomial.evaluateAt(0));
            }
        }
    }

    @Test
    public void testEvaluateDegreeOne() {
        Polynomial polynomial = new Polynomial(42, 1, rndGenerator);
        int expected = GF256.add(42, GF256.mult(1, polynomial.getCoefficients()[1]));
        assertEquals(expected, polynomial.evaluateAt(1));
    }

    @Test
    public void testHorner() {
        // 3x^2 + 2x + 1 at x = 2: 3*4 + 2*2 + 1 = 12 ^ 4 ^ 1
        Polynomial polynomial = new Polynomial(new int[] {1, 2, 3});
        assertEquals(9, polynomial.evaluateAt(2));
        assertEquals(1 ^ 2 ^ 3, polynomial.evaluateAt(1));
    }

    @Test
    public void testCoefficientsAreCopied() {
        int[] coefficients = {7, 8};
        Polynomial polynomial = new Polynomial(coefficients);
        coefficients[0] = 0;
        polynomial.getCoefficients()[1] = 0;
        assertArrayEquals(new int[] {7, 8}, polynomial.getCoefficients());
    }

    @Test
    public void testClear() {
        Polynomial polynomial = new Polynomial(new int[] {7, 8, 9});
        polynomial.clear();
        assertArrayEquals(new int[3], polynomial.getCoefficients());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsNonFieldCoefficient() {
        new Polynomial(new int[] {1, 256});
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsNonFieldConstant() {
        new Polynomial(-1, 2, rndGenerator);
    }

    @Test
    public void testToString() {
        assertEquals("3x^2 + 1", new Polynomial(new int[] {1, 0, 3}).toString());
    }
}
