package jws.registry;

import jws.crypto.SigningAlgorithm;

import java.util.Map;

/**
 * Builds an algorithm from the named groups captured when a binding's pattern
 * matched the identifier. A factory that cannot honour the captured parameters
 * should throw {@link jws.AlgorithmNotImplementedException}.
 */
@FunctionalInterface
public interface AlgorithmFactory {

    SigningAlgorithm create(Map<String, String> groups);
}
