package sss.secretsharing;

import org.bouncycastle.util.Arrays;

/**
 * Stores one share of a secret in its raw layout {y_0, ..., y_n-1, x}, where x is the
 * shareholder's x coordinate.
 */
public final class Share {
    private final byte[] encoded;

    /**
     * Wraps a share produced by {@link ShamirSecretSharing#split(byte[], int, int)}
     * @param encoded Share bytes, copied
     */
    public Share(byte[] encoded) {
        if (encoded == null || encoded.length < 2)
            throw new IllegalArgumentException("Parts must be at least two bytes");
        this.encoded = Arrays.clone(encoded);
    }

    /**
     * Returns the x coordinate, in [1, 255], at which this share's polynomials were evaluated
     */
    public int getShareholder() {
        return encoded[encoded.length - 1] & 0xFF;
    }

    /**
     * Returns the polynomial evaluations, one per secret byte
     */
    public byte[] getValues() {
        return Arrays.copyOf(encoded, encoded.length - 1);
    }

    public int getSecretLength() {
        return encoded.length - 1;
    }

    public byte[] toByteArray() {
        return Arrays.clone(encoded);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Share share = (Share) o;
        return Arrays.constantTimeAreEqual(encoded, share.encoded);
    }

    @Override
    public int hashCode() {
        return getShareholder();
    }

    @Override
    public String toString() {
        return "Share(" + getShareholder() + ", " + getSecretLength() + " bytes)";
    }
}
