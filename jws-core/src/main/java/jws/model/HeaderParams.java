package jws.model;

import jws.InvalidHeaderException;

import java.util.List;
import java.util.Map;

/**
 * Registered header parameter names and {@code alg} extraction.
 */
public final class HeaderParams {

    private HeaderParams() {}

    /** Signing algorithm. Required. */
    public static final String ALG = "alg";
    /** Type of the signed content. */
    public static final String TYP = "typ";
    /** JSON Web Key Set URL. */
    public static final String JKU = "jku";
    /** Key id, a hint for which key to use. */
    public static final String KID = "kid";
    /** X.509 certificate (chain) URL. */
    public static final String X5U = "x5u";
    /** X.509 certificate thumbprint. */
    public static final String X5T = "x5t";

    public static final List<String> RESERVED = List.of(ALG, TYP, JKU, KID, X5U, X5T);

    /**
     * Read the algorithm identifier from a header.
     *
     * @throws InvalidHeaderException if {@code alg} is absent or not a string
     */
    public static String algorithm(Map<String, ?> header) {
        if (header == null || !header.containsKey(ALG)) {
            throw new InvalidHeaderException("JWS header must have an alg parameter");
        }
        Object alg = header.get(ALG);
        if (!(alg instanceof String s)) {
            throw new InvalidHeaderException("JWS header alg must be a string, got "
                    + (alg == null ? "null" : alg.getClass().getSimpleName()));
        }
        return s;
    }
}
