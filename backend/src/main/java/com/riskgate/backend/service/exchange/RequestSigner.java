package com.riskgate.backend.service.exchange;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * HMAC-SHA256 signing of exchange query strings. Parameters are sorted by name,
 * URL-encoded and joined as {@code k=v&k=v}; the signature covers exactly that string.
 */
public class RequestSigner {

    private static final String ALGORITHM = "HmacSHA256";

    private final String secret;

    public RequestSigner(String secret) {
        this.secret = secret == null ? "" : secret;
    }

    public String canonicalQuery(Map<String, String> params) {
        return new TreeMap<>(params).entrySet().stream()
                .map(entry -> entry.getKey() + "=" + URLEncoder.encode(entry.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
    }

    public String sign(String payload) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            byte[] hash = mac.doFinal(payload.getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder();
            for (byte b : hash) {
                String h = Integer.toHexString(0xff & b);
                if (h.length() == 1) hex.append('0');
                hex.append(h);
            }
            return hex.toString();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Unable to sign exchange request", e);
        }
    }
}
