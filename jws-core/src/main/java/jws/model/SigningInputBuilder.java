package jws.model;

import jws.codec.Codec;

import java.util.Map;
import java.util.Objects;

/**
 * Builds {@link SigningInput} from a header and payload.
 * Codec failures propagate as thrown.
 */
public class SigningInputBuilder {

    private final Codec codec;

    public SigningInputBuilder(Codec codec) {
        this.codec = codec;
    }

    public SigningInput build(Map<String, ?> header, Map<String, ?> payload) {
        Objects.requireNonNull(payload, "payload");
        return new SigningInput(
                codec.encode(codec.canonicalize(header)),
                codec.encode(codec.canonicalize(payload)));
    }
}
