package jws.crypto;

import jws.SignatureVerificationException;
import jws.SigningException;
import org.bouncycastle.crypto.macs.HMac;
import org.bouncycastle.crypto.params.KeyParameter;
import org.bouncycastle.util.Arrays;

/**
 * HMAC with a SHA-2 hash (HS256 / HS384 / HS512).
 * The key is a shared secret; see {@link KeyInputs#secret}. Any length is
 * usable, the empty secret included.
 */
public class HmacAlgorithm implements SigningAlgorithm {

    private final Sha2 hash;

    public HmacAlgorithm(Sha2 hash) {
        this.hash = hash;
    }

    public Sha2 hash() {
        return hash;
    }

    @Override
    public String algorithmName() {
        return "HMAC-" + hash.algorithmName();
    }

    @Override
    public byte[] sign(byte[] message, Object key) {
        try {
            HMac mac = new HMac(hash.newDigest());
            mac.init(new KeyParameter(KeyInputs.secret(key)));
            mac.update(message, 0, message.length);
            byte[] out = new byte[mac.getMacSize()];
            mac.doFinal(out, 0);
            return out;
        } catch (IllegalArgumentException e) {
            throw new SigningException(algorithmName() + " signing failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void verify(byte[] message, byte[] signature, Object key) {
        byte[] expected;
        try {
            expected = sign(message, key);
        } catch (SigningException e) {
            throw new SignatureVerificationException("Could not validate signature: unusable key", e);
        }
        if (!digestsMatch(expected, signature)) {
            throw new SignatureVerificationException("Could not validate signature");
        }
    }

    /**
     * Constant-time comparison: every byte is examined whatever the position
     * of the first difference.
     */
    static boolean digestsMatch(byte[] expected, byte[] supplied) {
        return Arrays.constantTimeAreEqual(expected, supplied);
    }
}
