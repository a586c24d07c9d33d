package sss.interpolation;

/**
 * Exposes methods that can be invoked to compute a point on a polynomial given samples of it
 */
public interface InterpolationStrategy {

    /**
     * This method interpolates polynomial of degree xSamples.length - 1 and returns value evaluated at x.
     * @param x Value of x
     * @param xSamples X coordinates of the samples, pairwise distinct
     * @param ySamples Y coordinates of the samples
     * @return Value of y
     */
    int interpolateAt(int x, int[] xSamples, int[] ySamples);
}
