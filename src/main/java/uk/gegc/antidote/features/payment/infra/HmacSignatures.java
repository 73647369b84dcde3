package uk.gegc.antidote.features.payment.infra;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.Locale;

/**
 * HMAC-SHA256 signing as used by the payment processor: lowercase hex over UTF-8 input.
 */
public final class HmacSignatures {

    private static final String ALGORITHM = "HmacSHA256";

    private HmacSignatures() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static String sign(String secret, String data) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(data.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 unavailable", e);
        }
    }

    /**
     * Constant-time comparison of an expected and a provided hex signature.
     */
    public static boolean matches(String secret, String data, String providedSignature) {
        if (secret == null || secret.isEmpty() || data == null || providedSignature == null) {
            return false;
        }
        byte[] expected = sign(secret, data).getBytes(StandardCharsets.UTF_8);
        byte[] provided = providedSignature.trim().toLowerCase(Locale.ROOT).getBytes(StandardCharsets.UTF_8);
        return MessageDigest.isEqual(expected, provided);
    }
}
