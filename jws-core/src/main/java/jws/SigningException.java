package jws;

/**
 * The chosen algorithm could not produce a signature with the supplied key.
 */
public class SigningException extends JwsException {

    public SigningException(String message, Throwable cause) {
        super(message, cause);
    }
}
