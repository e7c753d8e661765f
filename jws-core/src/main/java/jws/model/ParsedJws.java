package jws.model;

import java.util.Map;

/**
 * A decoded compact serialization.
 *
 * @param signingInput the segments exactly as received; verification runs over these
 */
public record ParsedJws(
        Map<String, Object> header,
        Map<String, Object> payload,
        byte[] signature,
        SigningInput signingInput
) {

    public String algorithm() {
        return HeaderParams.algorithm(header);
    }
}
