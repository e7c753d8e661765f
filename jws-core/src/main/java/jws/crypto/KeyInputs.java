package jws.crypto;

import org.bouncycastle.util.io.pem.PemObject;
import org.bouncycastle.util.io.pem.PemReader;

import javax.crypto.SecretKey;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.Key;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;

/**
 * Coerces the opaque key a caller passes into the form a variant needs.
 * Every rejection is an {@link IllegalArgumentException} naming what was expected.
 */
final class KeyInputs {

    private KeyInputs() {}

    /** Shared secret for HMAC: raw bytes, text (UTF-8) or a {@link SecretKey}. */
    static byte[] secret(Object key) {
        if (key instanceof byte[] bytes) {
            return bytes;
        }
        if (key instanceof CharSequence text) {
            return text.toString().getBytes(StandardCharsets.UTF_8);
        }
        if (key instanceof SecretKey secretKey && secretKey.getEncoded() != null) {
            return secretKey.getEncoded();
        }
        throw new IllegalArgumentException("HMAC key must be byte[], a string or a SecretKey, got " + describe(key));
    }

    /**
     * Private key of the given type from a {@link PrivateKey}, a {@link KeyPair}
     * or a PEM {@code PRIVATE KEY} (PKCS#8) block.
     */
    static PrivateKey privateKey(Object key, Class<?> keyType, String keyAlgorithm) {
        Key resolved;
        if (key instanceof KeyPair pair) {
            resolved = pair.getPrivate();
        } else if (key instanceof CharSequence pem) {
            resolved = readPem(pem.toString(), keyAlgorithm);
        } else if (key instanceof Key k) {
            resolved = k;
        } else {
            throw new IllegalArgumentException(keyAlgorithm + " signing requires a private key, got " + describe(key));
        }
        if (!(resolved instanceof PrivateKey privateKey) || !keyType.isInstance(resolved)) {
            throw new IllegalArgumentException(keyAlgorithm + " signing requires an " + keyAlgorithm
                    + " private key, got " + describe(resolved));
        }
        return privateKey;
    }

    /**
     * Public key of the given type from a {@link PublicKey}, a {@link KeyPair}
     * or a PEM {@code PUBLIC KEY} (X.509 SubjectPublicKeyInfo) block.
     */
    static PublicKey publicKey(Object key, Class<?> keyType, String keyAlgorithm) {
        Key resolved;
        if (key instanceof KeyPair pair) {
            resolved = pair.getPublic();
        } else if (key instanceof CharSequence pem) {
            resolved = readPem(pem.toString(), keyAlgorithm);
        } else if (key instanceof Key k) {
            resolved = k;
        } else {
            throw new IllegalArgumentException(keyAlgorithm + " verification requires a public key, got " + describe(key));
        }
        if (!(resolved instanceof PublicKey publicKey) || !keyType.isInstance(resolved)) {
            throw new IllegalArgumentException(keyAlgorithm + " verification requires an " + keyAlgorithm
                    + " public key, got " + describe(resolved));
        }
        return publicKey;
    }

    private static Key readPem(String pem, String keyAlgorithm) {
        PemObject object;
        try (PemReader reader = new PemReader(new StringReader(pem))) {
            object = reader.readPemObject();
        } catch (IOException e) {
            throw new IllegalArgumentException("Unreadable PEM key", e);
        }
        if (object == null) {
            throw new IllegalArgumentException("Key text holds no PEM block");
        }
        try {
            KeyFactory kf = KeyFactory.getInstance(keyAlgorithm);
            switch (object.getType()) {
                case "PUBLIC KEY":
                    return kf.generatePublic(new X509EncodedKeySpec(object.getContent()));
                case "PRIVATE KEY":
                    return kf.generatePrivate(new PKCS8EncodedKeySpec(object.getContent()));
                default:
                    throw new IllegalArgumentException("Unsupported PEM block " + object.getType()
                            + ", expected PUBLIC KEY or PRIVATE KEY");
            }
        } catch (GeneralSecurityException e) {
            throw new IllegalArgumentException("PEM block is not a valid " + keyAlgorithm + " key", e);
        }
    }

    private static String describe(Object key) {
        return key == null ? "null" : key.getClass().getName();
    }
}
