package jws;

import jws.crypto.SigningAlgorithm;
import jws.model.HeaderParams;
import jws.model.SigningInput;
import jws.model.SigningInputBuilder;
import jws.registry.AlgorithmBinding;
import jws.registry.AlgorithmFactory;
import jws.registry.AlgorithmRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Signs and verifies a header and payload with the algorithm the header names.
 *
 * <pre>{@code
 * Jws jws = new Jws();
 * byte[] sig = jws.sign(Map.of("alg", "HS256"), Map.of("claim", "x"), "secret");
 * jws.verify(Map.of("alg", "HS256"), Map.of("claim", "x"), sig, "secret");
 * }</pre>
 *
 * Verification reports failure by throwing {@link SignatureVerificationException};
 * there is no boolean result to forget to check.
 */
public class Jws {

    private static final Logger log = LoggerFactory.getLogger(Jws.class);

    private final JwsSettings settings;
    private final SigningInputBuilder inputBuilder;

    public Jws() {
        this(JwsSettings.defaults());
    }

    public Jws(JwsSettings settings) {
        this.settings = settings;
        this.inputBuilder = new SigningInputBuilder(settings.codec());
    }

    public JwsSettings settings() {
        return settings;
    }

    /** Register a custom algorithm binding in the {@link AlgorithmRegistry#global() global} registry. */
    public static AlgorithmBinding register(String regex, AlgorithmFactory factory) {
        return AlgorithmRegistry.global().register(regex, factory);
    }

    /**
     * Sign the header and payload.
     *
     * @return raw signature bytes, not transport encoded
     * @throws InvalidHeaderException           if {@code alg} is missing or not a string
     * @throws AlgorithmNotAcceptedException    if {@code alg} is outside the accepted set
     * @throws AlgorithmNotImplementedException if no binding matches {@code alg}
     * @throws SigningException                 if the algorithm cannot sign with this key
     */
    public byte[] sign(Map<String, ?> header, Map<String, ?> payload, Object key) {
        SigningAlgorithm algorithm = resolve(header);
        return sign(algorithm, inputBuilder.build(header, payload), key);
    }

    /**
     * Verify a signature over the header and payload.
     *
     * @throws SignatureVerificationException   if the signature does not validate, for any reason
     * @throws InvalidHeaderException           if {@code alg} is missing or not a string
     * @throws AlgorithmNotAcceptedException    if {@code alg} is outside the accepted set
     * @throws AlgorithmNotImplementedException if no binding matches {@code alg}
     */
    public void verify(Map<String, ?> header, Map<String, ?> payload, byte[] signature, Object key) {
        SigningAlgorithm algorithm = resolve(header);
        verify(header, algorithm, inputBuilder.build(header, payload), signature, key);
    }

    SigningAlgorithm resolve(Map<String, ?> header) {
        String identifier = HeaderParams.algorithm(header);
        if (!settings.accepts(identifier)) {
            log.debug("Rejected alg={} outside accepted set {}", identifier, settings.acceptedAlgorithms());
            throw new AlgorithmNotAcceptedException(identifier, settings.acceptedAlgorithms());
        }
        return settings.registry().resolve(identifier);
    }

    SigningInput signingInput(Map<String, ?> header, Map<String, ?> payload) {
        return inputBuilder.build(header, payload);
    }

    byte[] sign(SigningAlgorithm algorithm, SigningInput input, Object key) {
        try {
            return algorithm.sign(input.bytes(), key);
        } catch (JwsException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SigningException(algorithm.algorithmName() + " signing failed: " + e.getMessage(), e);
        }
    }

    void verify(Map<String, ?> header, SigningAlgorithm algorithm, SigningInput input, byte[] signature, Object key) {
        if (signature == null) {
            throw new SignatureVerificationException("Could not validate signature: no signature supplied");
        }
        try {
            algorithm.verify(input.bytes(), signature, key);
        } catch (SignatureVerificationException e) {
            log.debug("Signature rejected alg={} reason={}", header.get(HeaderParams.ALG), e.reason());
            throw e;
        } catch (RuntimeException e) {
            log.debug("Signature rejected alg={} by {}", header.get(HeaderParams.ALG), e.getClass().getSimpleName());
            throw new SignatureVerificationException("Could not validate signature: " + e.getMessage(), e);
        }
    }
}
