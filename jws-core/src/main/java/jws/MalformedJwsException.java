package jws;

/**
 * A compact serialization could not be split or decoded.
 */
public class MalformedJwsException extends JwsException {

    public MalformedJwsException(String message) {
        super(message);
    }

    public MalformedJwsException(String message, Throwable cause) {
        super(message, cause);
    }
}
