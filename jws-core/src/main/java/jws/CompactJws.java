package jws;

import jws.codec.Codec;
import jws.codec.CodecException;
import jws.crypto.SigningAlgorithm;
import jws.model.ParsedJws;
import jws.model.SigningInput;

import java.util.Map;
import java.util.regex.Pattern;

/**
 * The compact form {@code header.payload.signature}, each segment base64url
 * without padding.
 */
public class CompactJws {

    private static final Pattern SEGMENT = Pattern.compile("[A-Za-z0-9_-]*");

    private final Jws jws;
    private final Codec codec;

    public CompactJws() {
        this(JwsSettings.defaults());
    }

    public CompactJws(JwsSettings settings) {
        this.jws = new Jws(settings);
        this.codec = settings.codec();
    }

    /** Sign and assemble the compact string. */
    public String serialize(Map<String, ?> header, Map<String, ?> payload, Object key) {
        SigningAlgorithm algorithm = jws.resolve(header);
        SigningInput input = jws.signingInput(header, payload);
        byte[] signature = jws.sign(algorithm, input, key);
        return input.value() + "." + codec.encode(signature);
    }

    /**
     * Split and decode without verifying. The result must not be trusted
     * until {@link #verify} succeeds.
     *
     * @throws MalformedJwsException if the text is not a three-segment compact JWS of JSON objects
     */
    public ParsedJws parse(String compact) {
        if (compact == null) {
            throw new MalformedJwsException("Compact JWS is null");
        }
        String[] parts = compact.split("\\.", -1);
        if (parts.length != 3) {
            throw new MalformedJwsException("Compact JWS must have 3 segments, found " + parts.length);
        }
        if (parts[0].isEmpty()) {
            throw new MalformedJwsException("Compact JWS header segment is empty");
        }
        for (String part : parts) {
            if (!SEGMENT.matcher(part).matches()) {
                throw new MalformedJwsException("Compact JWS segment is not unpadded base64url");
            }
        }
        try {
            Map<String, Object> header = codec.parse(decodeSegment(parts[0]));
            Map<String, Object> payload = codec.parse(decodeSegment(parts[1]));
            byte[] signature = decodeSegment(parts[2]);
            return new ParsedJws(header, payload, signature, new SigningInput(parts[0], parts[1]));
        } catch (CodecException e) {
            throw new MalformedJwsException("Compact JWS could not be decoded: " + e.getMessage(), e);
        }
    }

    // one text per byte string: unused trailing bits must be zero
    private byte[] decodeSegment(String segment) {
        byte[] decoded = codec.decode(segment);
        if (!codec.encode(decoded).equals(segment)) {
            throw new MalformedJwsException("Compact JWS segment is not canonical base64url");
        }
        return decoded;
    }

    /**
     * Parse and verify. The signature is checked over the segments as received.
     *
     * @return the verified content
     * @throws SignatureVerificationException if the signature does not validate
     */
    public ParsedJws verify(String compact, Object key) {
        ParsedJws parsed = parse(compact);
        SigningAlgorithm algorithm = jws.resolve(parsed.header());
        jws.verify(parsed.header(), algorithm, parsed.signingInput(), parsed.signature(), key);
        return parsed;
    }
}
