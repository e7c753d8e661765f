package jws;

import jws.codec.CodecException;
import jws.crypto.EcCurve;
import jws.registry.AlgorithmRegistry;
import jws.registry.BuiltInAlgorithm;
import jws.registry.RepeatedHmacAlgorithm;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.security.KeyPair;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JwsTest {

    private static final Map<String, Object> PAYLOAD = Map.of(
            "claim", "x",
            "iat", 1654908327,
            "roles", List.of("reader", "writer"));

    /** Signing key and a different verification key per built-in. */
    private static final Map<BuiltInAlgorithm, Object[]> KEYS = new EnumMap<>(BuiltInAlgorithm.class);

    private final Jws jws = new Jws();

    @BeforeAll
    static void generateKeys() {
        KeyPair rsa = TestKeys.rsa(2048);
        KeyPair otherRsa = TestKeys.rsa(2048);
        for (BuiltInAlgorithm alg : BuiltInAlgorithm.values()) {
            switch (alg) {
                case HS256, HS384, HS512 ->
                        KEYS.put(alg, new Object[]{"secret", "secret", "badsecret"});
                case RS256, RS384, RS512 ->
                        KEYS.put(alg, new Object[]{rsa.getPrivate(), rsa.getPublic(), otherRsa.getPublic()});
                default -> {
                    EcCurve curve = switch (alg) {
                        case ES256 -> EcCurve.P_256;
                        case ES384 -> EcCurve.P_384;
                        default -> EcCurve.P_521;
                    };
                    KeyPair ec = TestKeys.ec(curve);
                    KEYS.put(alg, new Object[]{ec.getPrivate(), ec.getPublic(), TestKeys.ec(curve).getPublic()});
                }
            }
        }
    }

    private static Map<String, Object> header(String alg) {
        Map<String, Object> header = new LinkedHashMap<>();
        header.put("alg", alg);
        header.put("typ", "JWT");
        return header;
    }

    @Test
    void hs256Scenario() {
        Map<String, Object> header = Map.of("alg", "HS256");
        Map<String, Object> payload = Map.of("claim", "x");

        byte[] sig = jws.sign(header, payload, "secret");

        assertThatCode(() -> jws.verify(header, payload, sig, "secret")).doesNotThrowAnyException();
        assertThatThrownBy(() -> jws.verify(header, payload, sig, "badsecret"))
                .isInstanceOf(SignatureVerificationException.class);
    }

    @Test
    void hs256SignatureIsTheMacOfTheCanonicalInput() {
        byte[] sig = jws.sign(Map.of("alg", "HS256"), Map.of("claim", "x"), "secret");

        assertThat(java.util.Base64.getUrlEncoder().withoutPadding().encodeToString(sig))
                .isEqualTo("big5eOJ0_QTxqYEp61TzEPxeeBBkn1D5Xy_o2huTAtU");
    }

    @ParameterizedTest
    @EnumSource(BuiltInAlgorithm.class)
    void signThenVerifySucceeds(BuiltInAlgorithm alg) {
        Object[] keys = KEYS.get(alg);
        byte[] sig = jws.sign(header(alg.identifier()), PAYLOAD, keys[0]);

        assertThatCode(() -> jws.verify(header(alg.identifier()), PAYLOAD, sig, keys[1]))
                .doesNotThrowAnyException();
    }

    @ParameterizedTest
    @EnumSource(BuiltInAlgorithm.class)
    void verifyWithAnotherKeyFails(BuiltInAlgorithm alg) {
        Object[] keys = KEYS.get(alg);
        byte[] sig = jws.sign(header(alg.identifier()), PAYLOAD, keys[0]);

        assertThatThrownBy(() -> jws.verify(header(alg.identifier()), PAYLOAD, sig, keys[2]))
                .isInstanceOf(SignatureVerificationException.class);
    }

    @ParameterizedTest
    @EnumSource(BuiltInAlgorithm.class)
    void flippingAnySignatureBitFails(BuiltInAlgorithm alg) {
        Object[] keys = KEYS.get(alg);
        Map<String, Object> header = header(alg.identifier());
        byte[] sig = jws.sign(header, PAYLOAD, keys[0]);

        for (int bit = 0; bit < sig.length * 8; bit++) {
            byte[] flipped = sig.clone();
            flipped[bit / 8] ^= (byte) (1 << (bit % 8));

            assertThatThrownBy(() -> jws.verify(header, PAYLOAD, flipped, keys[1]))
                    .as("%s bit %d", alg, bit)
                    .isInstanceOf(SignatureVerificationException.class);
        }
    }

    @ParameterizedTest
    @EnumSource(BuiltInAlgorithm.class)
    void tamperedPayloadOrHeaderFails(BuiltInAlgorithm alg) {
        Object[] keys = KEYS.get(alg);
        byte[] sig = jws.sign(header(alg.identifier()), PAYLOAD, keys[0]);

        Map<String, Object> tamperedPayload = new HashMap<>(PAYLOAD);
        tamperedPayload.put("claim", "y");
        Map<String, Object> tamperedHeader = header(alg.identifier());
        tamperedHeader.put("kid", "other");

        assertThatThrownBy(() -> jws.verify(header(alg.identifier()), tamperedPayload, sig, keys[1]))
                .isInstanceOf(SignatureVerificationException.class);
        assertThatThrownBy(() -> jws.verify(tamperedHeader, PAYLOAD, sig, keys[1]))
                .isInstanceOf(SignatureVerificationException.class);
    }

    @ParameterizedTest
    @ValueSource(strings = {"none", "HS1024", "hs256", "RS128"})
    void unknownAlgorithmCarriesIdentifierOnBothPaths(String alg) {
        Map<String, Object> header = Map.of("alg", alg);

        assertThatThrownBy(() -> jws.sign(header, PAYLOAD, "secret"))
                .isInstanceOfSatisfying(AlgorithmNotImplementedException.class,
                        e -> assertThat(e.identifier()).isEqualTo(alg));
        assertThatThrownBy(() -> jws.verify(header, PAYLOAD, new byte[32], "secret"))
                .isInstanceOfSatisfying(AlgorithmNotImplementedException.class,
                        e -> assertThat(e.identifier()).isEqualTo(alg));
    }

    @Test
    void missingOrNonStringAlgIsInvalidHeader() {
        assertThatThrownBy(() -> jws.sign(Map.of("typ", "JWT"), PAYLOAD, "secret"))
                .isInstanceOf(InvalidHeaderException.class);
        assertThatThrownBy(() -> jws.verify(Map.of("alg", List.of("HS256")), PAYLOAD, new byte[32], "secret"))
                .isInstanceOf(InvalidHeaderException.class);
    }

    @Test
    void customAlgorithmIsDispatchedThroughRegisteredBinding() {
        AlgorithmRegistry registry = new AlgorithmRegistry();
        RepeatedHmacAlgorithm[] built = new RepeatedHmacAlgorithm[1];
        registry.register("F(?<x>\\d)U(?<y>\\d{2})", groups -> {
            built[0] = RepeatedHmacAlgorithm.fromGroups(groups);
            return built[0];
        });
        Jws custom = new Jws(JwsSettings.defaults().withRegistry(registry));
        Map<String, Object> header = Map.of("alg", "F7U12");

        byte[] sig = custom.sign(header, PAYLOAD, "secret");

        assertThat(built[0].calls).hasValue(1);
        assertThat(built[0].rounds()).isEqualTo(7);
        assertThat(sig).hasSize(12);
        assertThatCode(() -> custom.verify(header, PAYLOAD, sig, "secret")).doesNotThrowAnyException();
        assertThatThrownBy(() -> custom.verify(header, PAYLOAD, sig, "badsecret"))
                .isInstanceOf(SignatureVerificationException.class);
    }

    @Test
    void customAlgorithmFailuresBecomeTypedErrors() {
        AlgorithmRegistry registry = new AlgorithmRegistry();
        registry.register("BROKEN", groups -> new RepeatedHmacAlgorithm(1, 8) {
            @Override
            public byte[] sign(byte[] message, Object key) {
                throw new IllegalStateException("hardware token unplugged");
            }
        });
        Jws custom = new Jws(JwsSettings.defaults().withRegistry(registry));
        Map<String, Object> header = Map.of("alg", "BROKEN");

        assertThatThrownBy(() -> custom.sign(header, PAYLOAD, "secret"))
                .isInstanceOf(SigningException.class)
                .hasMessageContaining("hardware token unplugged");
        assertThatThrownBy(() -> custom.verify(header, PAYLOAD, new byte[8], "secret"))
                .isInstanceOf(SignatureVerificationException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void staticRegisterTargetsGlobalRegistry() {
        Jws.register("GLOBAL-(?<x>\\d)U(?<y>\\d{2})", RepeatedHmacAlgorithm.FACTORY);

        byte[] sig = jws.sign(Map.of("alg", "GLOBAL-3U16"), PAYLOAD, "k");

        assertThat(sig).hasSize(16);
        assertThat(AlgorithmRegistry.global().isSupported("GLOBAL-3U16")).isTrue();
    }

    @Test
    void acceptedAlgorithmsPinTheHeader() {
        KeyPair rsa = TestKeys.rsa(2048);
        Jws pinned = new Jws(JwsSettings.defaults().withAcceptedAlgorithms("RS256"));
        byte[] publicKeyAsSecret = rsa.getPublic().getEncoded();

        // the classic substitution: HMAC keyed with the verifier's RSA public key
        byte[] forged = jws.sign(Map.of("alg", "HS256"), PAYLOAD, publicKeyAsSecret);

        assertThatThrownBy(() -> pinned.verify(Map.of("alg", "HS256"), PAYLOAD, forged, publicKeyAsSecret))
                .isInstanceOfSatisfying(AlgorithmNotAcceptedException.class,
                        e -> assertThat(e.identifier()).isEqualTo("HS256"));

        byte[] sig = pinned.sign(Map.of("alg", "RS256"), PAYLOAD, rsa.getPrivate());
        assertThatCode(() -> pinned.verify(Map.of("alg", "RS256"), PAYLOAD, sig, rsa.getPublic()))
                .doesNotThrowAnyException();
    }

    @Test
    void nullSignatureIsAVerificationFailure() {
        assertThatThrownBy(() -> jws.verify(Map.of("alg", "HS256"), PAYLOAD, null, "secret"))
                .isInstanceOf(SignatureVerificationException.class);
    }

    @Test
    void wrongKeyTypeOnSignIsSigningException() {
        assertThatThrownBy(() -> jws.sign(Map.of("alg", "RS256"), PAYLOAD, "secret"))
                .isInstanceOf(SigningException.class);
    }

    @Test
    void unserializablePayloadPropagatesCodecException() {
        assertThatThrownBy(() -> jws.sign(Map.of("alg", "HS256"), Map.of("x", new Object()), "secret"))
                .isExactlyInstanceOf(CodecException.class);
    }

    @Test
    void headerIsNotMutated() {
        Map<String, Object> header = header("HS256");
        Map<String, Object> before = new HashMap<>(header);

        jws.sign(header, PAYLOAD, "secret");

        assertThat(header).isEqualTo(before);
    }
}
