package jws.codec;

import java.util.Map;

/**
 * JSON and transport encoding used to build signing input and compact form.
 * Implementations must be deterministic: equal maps canonicalize to equal bytes.
 */
public interface Codec {

    /** Serialize a mapping to canonical JSON bytes. */
    byte[] canonicalize(Map<String, ?> value);

    /** Parse JSON bytes that must hold a single object. */
    Map<String, Object> parse(byte[] json);

    /** base64url without padding. */
    String encode(byte[] data);

    byte[] decode(String text);
}
