package jws.crypto;

import jws.SignatureVerificationException;
import jws.SigningException;

import java.security.GeneralSecurityException;
import java.security.Key;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.Signature;
import java.security.interfaces.RSAKey;

/**
 * RSASSA-PKCS1-v1_5 with a SHA-2 hash (RS256 / RS384 / RS512).
 */
public class RsaAlgorithm implements SigningAlgorithm {

    /** Keys below this modulus size are refused on both paths. */
    public static final int MIN_KEY_BITS = 2048;

    private final Sha2 hash;

    public RsaAlgorithm(Sha2 hash) {
        this.hash = hash;
    }

    public Sha2 hash() {
        return hash;
    }

    @Override
    public String algorithmName() {
        return "RSA-PKCS1-" + hash.algorithmName();
    }

    @Override
    public byte[] sign(byte[] message, Object key) {
        try {
            PrivateKey privateKey = KeyInputs.privateKey(key, RSAKey.class, "RSA");
            requireKeySize(privateKey);
            Signature sig = Signature.getInstance(hash.rsaSignatureAlgorithm());
            sig.initSign(privateKey);
            sig.update(message);
            return sig.sign();
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new SigningException(algorithmName() + " signing failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void verify(byte[] message, byte[] signature, Object key) {
        boolean valid;
        try {
            PublicKey publicKey = KeyInputs.publicKey(key, RSAKey.class, "RSA");
            requireKeySize(publicKey);
            Signature sig = Signature.getInstance(hash.rsaSignatureAlgorithm());
            sig.initVerify(publicKey);
            sig.update(message);
            valid = sig.verify(signature);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new SignatureVerificationException("Could not validate signature: " + e.getMessage(), e);
        }
        if (!valid) {
            throw new SignatureVerificationException("Could not validate signature");
        }
    }

    private static void requireKeySize(Key key) {
        int bits = ((RSAKey) key).getModulus().bitLength();
        if (bits < MIN_KEY_BITS) {
            throw new IllegalArgumentException("RSA key of " + bits + " bits is below the " + MIN_KEY_BITS + " bit minimum");
        }
    }
}
