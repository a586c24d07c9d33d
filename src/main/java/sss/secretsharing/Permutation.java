package sss.secretsharing;

import java.security.SecureRandom;

/**
 * Random permutations used to assign x coordinates to shares
 */
public final class Permutation {

    private Permutation() {}

    /**
     * Returns a uniformly random permutation of the integers in [0, n), built with the
     * inside-out Fisher-Yates shuffle.
     * @param n Size of the permutation
     * @param rndGenerator Generator used to pick swap positions
     * @return Permutation of [0, n)
     */
    public static int[] perm(int n, SecureRandom rndGenerator) {
        if (n < 0)
            throw new IllegalArgumentException("Permutation size cannot be negative");
        int[] m = new int[n];
        for (int i = 0; i < n; i++) {
            int j = rndGenerator.nextInt(i + 1);
            m[i] = m[j];
            m[j] = i;
        }
        return m;
    }
}
