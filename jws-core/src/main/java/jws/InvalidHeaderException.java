package jws;

/**
 * The header cannot be used: {@code alg} is missing or not a string.
 */
public class InvalidHeaderException extends JwsException {

    public InvalidHeaderException(String message) {
        super(message);
    }
}
