package jws;

/**
 * Root of every failure raised by the signing core.
 * Unchecked: callers that must distinguish cases catch the subclasses.
 */
public class JwsException extends RuntimeException {

    public JwsException(String message) {
        super(message);
    }

    public JwsException(String message, Throwable cause) {
        super(message, cause);
    }
}
