package jws.codec;

/**
 * Serialization or transport decoding failed.
 */
public class CodecException extends RuntimeException {

    public CodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
