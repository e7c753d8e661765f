package jws.crypto;

/**
 * A concrete signature scheme bound to its parameters (hash, curve).
 * Each built-in variant implements this, as does every custom algorithm
 * reachable through a registry binding.
 *
 * Implementations hold no mutable state and may be shared between threads.
 */
public interface SigningAlgorithm {

    /** Human-readable scheme name, e.g. {@code HMAC-SHA-256}. */
    String algorithmName();

    /**
     * Sign the message.
     *
     * @param key algorithm-dependent key material
     * @return raw signature bytes
     */
    byte[] sign(byte[] message, Object key);

    /**
     * Verify a signature over the message.
     *
     * @throws jws.SignatureVerificationException if the signature does not validate
     */
    void verify(byte[] message, byte[] signature, Object key);
}
