package jws;

import jws.codec.Codec;
import jws.codec.JacksonCodec;
import jws.registry.AlgorithmRegistry;

import java.util.Arrays;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable configuration for {@link Jws} and {@link CompactJws}.
 *
 * @param registry           where algorithm identifiers are resolved
 * @param codec              JSON and base64url encoding for the signing input
 * @param acceptedAlgorithms identifiers allowed in headers; empty accepts anything the registry resolves
 */
public record JwsSettings(
        AlgorithmRegistry registry,
        Codec codec,
        Set<String> acceptedAlgorithms
) {

    public JwsSettings {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(codec, "codec");
        acceptedAlgorithms = Set.copyOf(acceptedAlgorithms);
    }

    /** Global registry, Jackson codec, every resolvable algorithm accepted. */
    public static JwsSettings defaults() {
        return new JwsSettings(AlgorithmRegistry.global(), new JacksonCodec(), Set.of());
    }

    public JwsSettings withRegistry(AlgorithmRegistry registry) {
        return new JwsSettings(registry, codec, acceptedAlgorithms);
    }

    public JwsSettings withCodec(Codec codec) {
        return new JwsSettings(registry, codec, acceptedAlgorithms);
    }

    /** Pin the identifiers a header may name, e.g. only {@code RS256} for a known issuer. */
    public JwsSettings withAcceptedAlgorithms(String... identifiers) {
        return new JwsSettings(registry, codec, Set.copyOf(Arrays.asList(identifiers)));
    }

    public boolean accepts(String identifier) {
        return acceptedAlgorithms.isEmpty() || acceptedAlgorithms.contains(identifier);
    }
}
