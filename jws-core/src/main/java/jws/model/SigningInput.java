package jws.model;

import java.nio.charset.StandardCharsets;

/**
 * The exact bytes that get signed: {@code base64url(header) "." base64url(payload)}.
 */
public record SigningInput(String encodedHeader, String encodedPayload) {

    public String value() {
        return encodedHeader + "." + encodedPayload;
    }

    public byte[] bytes() {
        return value().getBytes(StandardCharsets.US_ASCII);
    }

    @Override
    public String toString() {
        return value();
    }
}
