package jws.crypto;

import org.bouncycastle.crypto.Digest;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.digests.SHA384Digest;
import org.bouncycastle.crypto.digests.SHA512Digest;

import java.util.function.Supplier;

/**
 * SHA-2 family members used by the built-in algorithms, with the JCA
 * names each variant needs.
 */
public enum Sha2 {

    SHA_256(256, SHA256Digest::new),
    SHA_384(384, SHA384Digest::new),
    SHA_512(512, SHA512Digest::new);

    private final int bits;
    private final Supplier<Digest> digestFactory;

    Sha2(int bits, Supplier<Digest> digestFactory) {
        this.bits = bits;
        this.digestFactory = digestFactory;
    }

    public int bits() {
        return bits;
    }

    /** e.g. {@code SHA-256} */
    public String algorithmName() {
        return "SHA-" + bits;
    }

    public String rsaSignatureAlgorithm() {
        return "SHA" + bits + "withRSA";
    }

    /** A fresh BouncyCastle digest; digests are stateful, never share one. */
    public Digest newDigest() {
        return digestFactory.get();
    }

    public byte[] hash(byte[] data) {
        Digest digest = newDigest();
        digest.update(data, 0, data.length);
        byte[] out = new byte[digest.getDigestSize()];
        digest.doFinal(out, 0);
        return out;
    }

    public static Sha2 ofBits(int bits) {
        for (Sha2 sha : values()) {
            if (sha.bits == bits) {
                return sha;
            }
        }
        throw new IllegalArgumentException("Supported hash sizes: 256, 384, 512 (given " + bits + ")");
    }
}
