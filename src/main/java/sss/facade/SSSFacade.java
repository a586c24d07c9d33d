package sss.facade;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sss.Constants;
import sss.secretsharing.ShamirSecretSharing;
import sss.secretsharing.Share;

import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Properties;

/**
 * This class exposes methods to share a secret and reconstruct it back using a fixed number of
 * shares and threshold, read from properties.
 */
public final class SSSFacade extends ShamirSecretSharing {
    private static final Logger logger = LoggerFactory.getLogger("sss");

    private final int threshold;
    private final int parts;

    /**
     * Creates object of this class
     * @param properties Properties containing values for tags contained in the {@link Constants} class
     * @throws SecretSharingException When the configured random generator algorithm is unavailable
     */
    public SSSFacade(Properties properties) throws SecretSharingException {
        super(createRandomGenerator(properties));
        this.threshold = readInt(properties, Constants.TAG_THRESHOLD);
        this.parts = readInt(properties, Constants.TAG_PARTS);
        validateParameters(parts, threshold);
        logger.info("Secret sharing configured with {} parts and threshold {}", parts, threshold);
    }

    public int getThreshold() {
        return threshold;
    }

    public int getParts() {
        return parts;
    }

    /**
     * Computes shares of the secret with the configured number of parts and threshold
     * @param secret Secret data
     * @return Shares of the secret
     */
    public Share[] share(byte[] secret) {
        return splitShares(secret, parts, threshold);
    }

    /**
     * Combines shares to reconstruct the secret
     * @param shares At least threshold shares of the same secret
     * @return Reconstructed secret
     */
    public byte[] combine(Share... shares) {
        if (shares != null && shares.length >= 2 && shares.length < threshold)
            logger.warn("Combining {} shares, fewer than threshold {}; result will not be the secret",
                    shares.length, threshold);
        return reconstruct(shares);
    }

    private static SecureRandom createRandomGenerator(Properties properties) throws SecretSharingException {
        if (properties == null)
            throw new IllegalArgumentException("Properties cannot be null!");
        String algorithm = properties.getProperty(Constants.TAG_RANDOM_ALGORITHM);
        if (algorithm == null || algorithm.isEmpty())
            return new SecureRandom();
        try {
            return SecureRandom.getInstance(algorithm);
        } catch (NoSuchAlgorithmException e) {
            throw new SecretSharingException("Failed to initialize random generator " + algorithm, e);
        }
    }

    private static int readInt(Properties properties, String tag) {
        String value = properties.getProperty(tag);
        if (value == null)
            throw new IllegalArgumentException("Property " + tag + " is missing");
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property " + tag + " has invalid value", e);
        }
    }
}
