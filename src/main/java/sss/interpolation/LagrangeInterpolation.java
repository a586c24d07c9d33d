package sss.interpolation;

import sss.field.GF256;

/**
 * This class implements Lagrange Interpolation equations.
 * All the computations are done in GF(2^8), where subtraction is the same as addition.
 */
public class LagrangeInterpolation implements InterpolationStrategy {

    /**
     * Interpolates a polynomial F and returns value y of point (x,y) on F
     * @param x Value of x
     * @param xSamples X coordinates of the samples, pairwise distinct
     * @param ySamples Y coordinates of the samples
     * @return Value y
     * @throws ArithmeticException When two samples have the same x coordinate
     */
    @Override
    public int interpolateAt(int x, int[] xSamples, int[] ySamples) {
        if (xSamples.length != ySamples.length)
            throw new IllegalArgumentException("Number of x and y samples differs");
        int result = 0;

        for (int i = 0; i < xSamples.length; i++) {
            int basis = 1;
            for (int j = 0; j < xSamples.length; j++) {
                if (i == j)
                    continue;
                int numerator = GF256.add(x, xSamples[j]);
                int denominator = GF256.add(xSamples[i], xSamples[j]);
                basis = GF256.mult(basis, GF256.div(numerator, denominator));
            }
            result = GF256.add(result, GF256.mult(ySamples[i], basis));
        }

        return result;
    }
}
