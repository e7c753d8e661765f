package jws;

/**
 * Signature verification failed. The message must not be trusted.
 *
 * Raised for every failure cause: wrong key, tampered message, malformed
 * signature bytes, unusable key type, or a failure declared by a custom algorithm.
 */
public class SignatureVerificationException extends JwsException {

    private final String reason;

    public SignatureVerificationException(String reason) {
        super(reason);
        this.reason = reason;
    }

    public SignatureVerificationException(String reason, Throwable cause) {
        super(reason, cause);
        this.reason = reason;
    }

    public String reason() {
        return reason;
    }
}
