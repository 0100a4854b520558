package com.imperium.identitygate.auth;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.imperium.identitygate.model.identity.VerifiedIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.util.Arrays;
import java.util.Base64;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * HS256 JWT 本地校验：header.payload.signature 三段，HMAC-SHA256(secret, header + "." + payload)。
 * <p>
 * 校验顺序：段数 → 签名（对 base64url 文本做常量时间比较）→ payload 解码 → exp → iss → aud → sub。
 * 任一不满足即返回 empty。
 */
public class Hs256TokenVerifier implements TokenVerifier {

    private static final Logger log = LoggerFactory.getLogger(Hs256TokenVerifier.class);

    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final TypeReference<Map<String, Object>> CLAIMS_TYPE = new TypeReference<>() {
    };
    private static final Base64.Decoder URL_DECODER = Base64.getUrlDecoder();
    private static final Base64.Encoder URL_ENCODER = Base64.getUrlEncoder().withoutPadding();

    private final byte[] secret;
    private final String issuer;
    private final String audience;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public Hs256TokenVerifier(String secret, String issuer, String audience, ObjectMapper objectMapper, Clock clock) {
        if (secret == null || secret.isEmpty()) {
            throw new IllegalArgumentException("jwt-hs256 verification requires a secret");
        }
        this.secret = secret.getBytes(StandardCharsets.UTF_8);
        this.issuer = blankToNull(issuer);
        this.audience = blankToNull(audience);
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public VerificationMode mode() {
        return VerificationMode.JWT_HS256;
    }

    @Override
    public Optional<VerifiedIdentity> verify(String token) {
        if (token == null || token.isBlank()) {
            return reject("empty token");
        }
        String[] parts = token.trim().split("\\.", -1);
        if (parts.length != 3) {
            return reject("expected 3 segments, got " + parts.length);
        }

        // 比较 base64url 文本：解码会忽略末字符未用的低位
        byte[] expected = URL_ENCODER.encodeToString(sign(parts[0] + "." + parts[1]))
                .getBytes(StandardCharsets.US_ASCII);
        byte[] supplied = parts[2].getBytes(StandardCharsets.US_ASCII);
        if (!MessageDigest.isEqual(supplied, expected)) {
            return reject("signature mismatch");
        }

        Map<String, Object> claims;
        try {
            claims = objectMapper.readValue(URL_DECODER.decode(parts[1]), CLAIMS_TYPE);
        } catch (IllegalArgumentException | IOException e) {
            return reject("payload is not a JSON object");
        }
        if (claims == null) {
            return reject("payload is not a JSON object");
        }

        Object exp = claims.get("exp");
        if (exp != null) {
            if (!(exp instanceof Number expSeconds)) {
                return reject("exp is not numeric");
            }
            // 严格小于：exp 恰好等于当前秒仍视为有效
            if (expSeconds.doubleValue() < clock.instant().getEpochSecond()) {
                return reject("token expired");
            }
        }

        if (issuer != null && !issuer.equals(claims.get("iss"))) {
            return reject("issuer mismatch");
        }

        if (audience != null && !audienceMatches(claims.get("aud"))) {
            return reject("audience mismatch");
        }

        String subject = text(claims, "sub");
        if (subject == null) {
            return reject("missing sub");
        }

        String[] nameParts = splitName(text(claims, "name"));
        String firstName = text(claims, "given_name");
        if (firstName == null && nameParts.length > 0) {
            firstName = nameParts[0];
        }
        String lastName = text(claims, "family_name");
        if (lastName == null && nameParts.length > 1) {
            lastName = String.join(" ", Arrays.copyOfRange(nameParts, 1, nameParts.length));
        }

        return Optional.of(new VerifiedIdentity(subject, firstName, lastName, text(claims, "email"), claims));
    }

    private boolean audienceMatches(Object aud) {
        if (aud instanceof Collection<?> values) {
            return values.contains(audience);
        }
        return audience.equals(aud);
    }

    private byte[] sign(String signingInput) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(secret, HMAC_ALGORITHM));
            return mac.doFinal(signingInput.getBytes(StandardCharsets.US_ASCII));
        } catch (GeneralSecurityException e) {
            // HmacSHA256 是 JDK 必备算法，走到这里说明运行环境本身有问题
            throw new IllegalStateException("HmacSHA256 unavailable", e);
        }
    }

    private static String[] splitName(String name) {
        if (name == null) {
            return new String[0];
        }
        return name.trim().split("\\s+");
    }

    private static String text(Map<String, Object> claims, String key) {
        Object v = claims.get(key);
        if (v instanceof String s && !s.isBlank()) {
            return s;
        }
        return null;
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }

    private static Optional<VerifiedIdentity> reject(String reason) {
        log.debug("HS256 token rejected: {}", reason);
        return Optional.empty();
    }
}
