package jws.registry;

import jws.crypto.EcCurve;
import jws.crypto.EcdsaAlgorithm;
import jws.crypto.HmacAlgorithm;
import jws.crypto.RsaAlgorithm;
import jws.crypto.Sha2;
import jws.crypto.SigningAlgorithm;

import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * The closed set of algorithms every registry knows, looked up by exact identifier.
 */
public enum BuiltInAlgorithm {

    HS256(new HmacAlgorithm(Sha2.SHA_256)),
    HS384(new HmacAlgorithm(Sha2.SHA_384)),
    HS512(new HmacAlgorithm(Sha2.SHA_512)),

    RS256(new RsaAlgorithm(Sha2.SHA_256)),
    RS384(new RsaAlgorithm(Sha2.SHA_384)),
    RS512(new RsaAlgorithm(Sha2.SHA_512)),

    ES256(new EcdsaAlgorithm(EcCurve.P_256)),
    ES384(new EcdsaAlgorithm(EcCurve.P_384)),
    ES512(new EcdsaAlgorithm(EcCurve.P_521));

    private static final Map<String, BuiltInAlgorithm> BY_IDENTIFIER = Stream.of(values())
            .collect(Collectors.toUnmodifiableMap(BuiltInAlgorithm::identifier, Function.identity()));

    private final SigningAlgorithm algorithm;

    BuiltInAlgorithm(SigningAlgorithm algorithm) {
        this.algorithm = algorithm;
    }

    /** The {@code alg} header value, e.g. {@code HS256}. */
    public String identifier() {
        return name();
    }

    public SigningAlgorithm algorithm() {
        return algorithm;
    }

    /** Case-sensitive: {@code hs256} is not {@code HS256}. */
    public static Optional<BuiltInAlgorithm> forIdentifier(String identifier) {
        return Optional.ofNullable(BY_IDENTIFIER.get(identifier));
    }
}
