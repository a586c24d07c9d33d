package sss.secretsharing;

import org.bouncycastle.util.Arrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sss.interpolation.InterpolationStrategy;
import sss.interpolation.LagrangeInterpolation;
import sss.polynomial.Polynomial;

import java.security.SecureRandom;

/**
 * Implements Shamir's Secret Sharing scheme over GF(2^8).
 * Each byte of the secret is the constant term of its own random polynomial, so a share is one byte
 * longer than the secret: the evaluations of every polynomial followed by the x coordinate.
 * <p>
 * Instances hold no mutable state besides the random generator and can be shared between threads.
 */
public class ShamirSecretSharing {
    public static final int MAX_PARTS = 255;

    private final Logger logger = LoggerFactory.getLogger("sss");
    private final SecureRandom rndGenerator;
    private final InterpolationStrategy interpolationStrategy;

    public ShamirSecretSharing() {
        this(new SecureRandom());
    }

    public ShamirSecretSharing(SecureRandom rndGenerator) {
        if (rndGenerator == null)
            throw new IllegalArgumentException("Random generator cannot be null!");
        this.rndGenerator = rndGenerator;
        this.interpolationStrategy = new LagrangeInterpolation();
    }

    /**
     * Returns polynomial interpolation strategy used to recover secret bytes from shares
     * @return Interpolation strategy
     */
    public InterpolationStrategy getInterpolationStrategy() {
        return interpolationStrategy;
    }

    /**
     * Splits a secret into parts shares, any threshold of which reconstruct it
     * @param secret Secret data
     * @param parts Number of shares to generate, in [threshold, 255]
     * @param threshold Number of shares needed to reconstruct the secret, in [2, 255]
     * @return Shares, each laid out as {y_0, ..., y_n-1, x}
     * @throws IllegalArgumentException When parameters are out of range or the secret is empty
     */
    public byte[][] split(byte[] secret, int parts, int threshold) {
        validateParameters(parts, threshold);
        if (secret == null || secret.length == 0)
            throw new IllegalArgumentException("Cannot split an empty secret");

        logger.debug("Splitting secret of {} bytes into {} parts with threshold {}", secret.length,
                parts, threshold);

        int[] xCoordinates = Permutation.perm(MAX_PARTS, rndGenerator);

        byte[][] out = new byte[parts][secret.length + 1];
        for (int i = 0; i < parts; i++) {
            // permutation values are in [0, 254]
            out[i][secret.length] = (byte) (xCoordinates[i] + 1);
        }

        for (int idx = 0; idx < secret.length; idx++) {
            Polynomial polynomial = new Polynomial(secret[idx] & 0xFF, threshold - 1, rndGenerator);
            for (int i = 0; i < parts; i++) {
                out[i][idx] = (byte) polynomial.evaluateAt(xCoordinates[i] + 1);
            }
            polynomial.clear();
        }
        Arrays.clear(xCoordinates);

        return out;
    }

    /**
     * Same as {@link #split(byte[], int, int)}, with each share wrapped in {@link Share}
     */
    public Share[] splitShares(byte[] secret, int parts, int threshold) {
        byte[][] raw = split(secret, parts, threshold);
        Share[] shares = new Share[raw.length];
        for (int i = 0; i < raw.length; i++) {
            shares[i] = new Share(raw[i]);
            Arrays.clear(raw[i]);
        }
        return shares;
    }

    /**
     * Combines shares to reconstruct the secret. Any subset of at least threshold shares of the same
     * split, in any order, gives the same result.
     * @param parts Shares
     * @return Reconstructed secret
     * @throws IllegalArgumentException When fewer than two shares are given or their lengths are invalid
     * @throws IllegalStateException When two shares have the same x coordinate
     */
    public byte[] reconstruct(byte[][] parts) {
        if (parts == null || parts.length < 2)
            throw new IllegalArgumentException("Less than two parts cannot be used to reconstruct the secret");

        int partLength = parts[0].length;
        if (partLength < 2)
            throw new IllegalArgumentException("Parts must be at least two bytes");
        for (byte[] part : parts) {
            if (part.length != partLength)
                throw new IllegalArgumentException("All parts must be the same length");
        }

        logger.debug("Reconstructing secret of {} bytes from {} parts", partLength - 1, parts.length);

        int[] xSamples = new int[parts.length];
        int[] ySamples = new int[parts.length];
        boolean[] seen = new boolean[256];
        for (int i = 0; i < parts.length; i++) {
            int x = parts[i][partLength - 1] & 0xFF;
            if (seen[x])
                throw new IllegalStateException("Duplicate part detected");
            seen[x] = true;
            xSamples[i] = x;
        }

        byte[] secret = new byte[partLength - 1];
        for (int idx = 0; idx < secret.length; idx++) {
            for (int i = 0; i < parts.length; i++) {
                ySamples[i] = parts[i][idx] & 0xFF;
            }
            secret[idx] = (byte) interpolationStrategy.interpolateAt(0, xSamples, ySamples);
        }
        Arrays.clear(ySamples);

        return secret;
    }

    /**
     * Same as {@link #reconstruct(byte[][])} for wrapped shares
     */
    public byte[] reconstruct(Share... shares) {
        if (shares == null)
            return reconstruct((byte[][]) null);
        byte[][] raw = new byte[shares.length][];
        for (int i = 0; i < shares.length; i++) {
            raw[i] = shares[i].toByteArray();
        }
        try {
            return reconstruct(raw);
        } finally {
            for (byte[] part : raw) {
                Arrays.clear(part);
            }
        }
    }

    /**
     * Checks the share count and threshold, throwing the same errors as split
     * @param parts Number of shares
     * @param threshold Number of shares needed to reconstruct
     */
    public static void validateParameters(int parts, int threshold) {
        if (threshold < 2)
            throw new IllegalArgumentException("Threshold must be at least 2");
        if (threshold > MAX_PARTS)
            throw new IllegalArgumentException("Threshold cannot exceed 255");
        if (parts < threshold)
            throw new IllegalArgumentException("Parts cannot be less than threshold");
        if (parts > MAX_PARTS)
            throw new IllegalArgumentException("Parts cannot exceed 255");
    }
}
