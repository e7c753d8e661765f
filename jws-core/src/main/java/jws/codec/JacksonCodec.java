package jws.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.util.Base64;
import java.util.Map;

/**
 * Jackson-backed {@link Codec}.
 *
 * Values are first copied into plain maps and lists, then written with
 * entries sorted by key at every depth, so the same header or payload
 * always yields the same bytes whatever map implementation (or comparator)
 * the caller used.
 */
public class JacksonCodec implements Codec {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    private final ObjectMapper objectMapper;

    public JacksonCodec() {
        this(new ObjectMapper());
    }

    /** The mapper is copied; the caller's instance is left untouched. */
    public JacksonCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    }

    @Override
    public byte[] canonicalize(Map<String, ?> value) {
        try {
            // a SortedMap is written in its own order, so never hand the caller's map to the writer
            Map<String, Object> plain = objectMapper.convertValue(value, MAP_TYPE);
            return objectMapper.writeValueAsBytes(plain);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new CodecException("Value cannot be serialized to JSON", e);
        }
    }

    @Override
    public Map<String, Object> parse(byte[] json) {
        try {
            Map<String, Object> parsed = objectMapper.readValue(json, MAP_TYPE);
            if (parsed == null) {
                throw new CodecException("JSON is null, expected an object", null);
            }
            return parsed;
        } catch (IOException e) {
            throw new CodecException("JSON is not an object", e);
        }
    }

    @Override
    public String encode(byte[] data) {
        return ENCODER.encodeToString(data);
    }

    @Override
    public byte[] decode(String text) {
        try {
            return DECODER.decode(text);
        } catch (IllegalArgumentException e) {
            throw new CodecException("Invalid base64url text", e);
        }
    }
}
