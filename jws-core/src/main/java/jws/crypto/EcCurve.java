package jws.crypto;

import org.bouncycastle.asn1.x9.ECNamedCurveTable;
import org.bouncycastle.asn1.x9.X9ECParameters;

/**
 * NIST curves paired with the hash of matching strength.
 * The pairing is fixed here so no identifier can combine a curve with a weaker hash.
 */
public enum EcCurve {

    P_256("P-256", "secp256r1", Sha2.SHA_256, 32),
    P_384("P-384", "secp384r1", Sha2.SHA_384, 48),
    P_521("P-521", "secp521r1", Sha2.SHA_512, 66);

    private final String displayName;
    private final String curveName;
    private final Sha2 hash;
    private final int coordinateBytes;

    EcCurve(String displayName, String curveName, Sha2 hash, int coordinateBytes) {
        this.displayName = displayName;
        this.curveName = curveName;
        this.hash = hash;
        this.coordinateBytes = coordinateBytes;
    }

    public String displayName() {
        return displayName;
    }

    /** SEC name, as accepted by {@code ECGenParameterSpec}. */
    public String curveName() {
        return curveName;
    }

    public Sha2 hash() {
        return hash;
    }

    /** Length of each of R and S in a JWS signature. */
    public int coordinateBytes() {
        return coordinateBytes;
    }

    public X9ECParameters parameters() {
        return ECNamedCurveTable.getByName(curveName);
    }
}
