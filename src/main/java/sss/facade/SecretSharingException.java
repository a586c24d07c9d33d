package sss.facade;

/**
 * Thrown when the secret sharing facade cannot be set up, e.g., when the configured random
 * generator algorithm is not available.
 */
public class SecretSharingException extends Exception {
	private static final long serialVersionUID = 1L;

	public SecretSharingException(String msg, Throwable cause) {
		super(msg, cause);
	}
}
