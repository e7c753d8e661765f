package jws.crypto;

import jws.SignatureVerificationException;
import jws.SigningException;
import org.bouncycastle.crypto.params.ECDomainParameters;
import org.bouncycastle.crypto.params.ECPrivateKeyParameters;
import org.bouncycastle.crypto.params.ECPublicKeyParameters;
import org.bouncycastle.crypto.signers.ECDSASigner;
import org.bouncycastle.crypto.signers.HMacDSAKCalculator;
import org.bouncycastle.jcajce.provider.asymmetric.util.ECUtil;
import org.bouncycastle.util.Arrays;
import org.bouncycastle.util.BigIntegers;

import java.math.BigInteger;
import java.security.InvalidKeyException;
import java.security.interfaces.ECKey;

/**
 * ECDSA over a NIST curve (ES256 / ES384 / ES512), via the BouncyCastle
 * lightweight API.
 *
 * Nonces are derived deterministically per RFC 6979, so signing the same
 * input with the same key yields the same signature and needs no random
 * source. Signatures use the JWS layout: R and S as fixed-length unsigned
 * big-endian integers, concatenated.
 */
public class EcdsaAlgorithm implements SigningAlgorithm {

    private final EcCurve curve;

    public EcdsaAlgorithm(EcCurve curve) {
        this.curve = curve;
    }

    public EcCurve curve() {
        return curve;
    }

    @Override
    public String algorithmName() {
        return "ECDSA-" + curve.displayName() + "-" + curve.hash().algorithmName();
    }

    @Override
    public byte[] sign(byte[] message, Object key) {
        try {
            ECPrivateKeyParameters params = (ECPrivateKeyParameters) ECUtil.generatePrivateKeyParameter(
                    KeyInputs.privateKey(key, ECKey.class, "EC"));
            requireCurve(params.getParameters());

            ECDSASigner signer = new ECDSASigner(new HMacDSAKCalculator(curve.hash().newDigest()));
            signer.init(true, params);
            BigInteger[] rs = signer.generateSignature(curve.hash().hash(message));

            int len = curve.coordinateBytes();
            return Arrays.concatenate(
                    BigIntegers.asUnsignedByteArray(len, rs[0]),
                    BigIntegers.asUnsignedByteArray(len, rs[1]));
        } catch (InvalidKeyException | IllegalArgumentException e) {
            throw new SigningException(algorithmName() + " signing failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void verify(byte[] message, byte[] signature, Object key) {
        int len = curve.coordinateBytes();
        if (signature == null || signature.length != 2 * len) {
            throw new SignatureVerificationException("Could not validate signature: expected "
                    + (2 * len) + " bytes for " + curve.displayName());
        }
        ECPublicKeyParameters params;
        try {
            params = (ECPublicKeyParameters) ECUtil.generatePublicKeyParameter(
                    KeyInputs.publicKey(key, ECKey.class, "EC"));
            requireCurve(params.getParameters());
        } catch (InvalidKeyException | IllegalArgumentException e) {
            throw new SignatureVerificationException("Could not validate signature: " + e.getMessage(), e);
        }

        BigInteger r = new BigInteger(1, Arrays.copyOfRange(signature, 0, len));
        BigInteger s = new BigInteger(1, Arrays.copyOfRange(signature, len, 2 * len));

        ECDSASigner verifier = new ECDSASigner();
        verifier.init(false, params);
        if (!verifier.verifySignature(curve.hash().hash(message), r, s)) {
            throw new SignatureVerificationException("Could not validate signature");
        }
    }

    private void requireCurve(ECDomainParameters keyParams) {
        if (!keyParams.getCurve().equals(curve.parameters().getCurve())) {
            throw new IllegalArgumentException("Key is not on curve " + curve.displayName());
        }
    }
}
