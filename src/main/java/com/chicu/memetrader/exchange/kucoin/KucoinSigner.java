package com.chicu.memetrader.exchange.kucoin;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Подпись приватных запросов KuCoin:
 * KC-API-SIGN = base64(HMAC-SHA256(secret, timestamp + METHOD + endpoint + body)).
 */
public class KucoinSigner {

    private final String secret;

    public KucoinSigner(String secret) {
        this.secret = secret;
    }

    public String sign(long timestampMs, String method, String endpoint, String body) {
        String prehash = timestampMs + method.toUpperCase() + endpoint + (body == null ? "" : body);
        return hmacBase64(prehash);
    }

    /**
     * Для ключей v2 passphrase передаётся подписанной тем же секретом.
     */
    public String passphrase(String passphrase, int keyVersion) {
        return keyVersion >= 2 ? hmacBase64(passphrase) : passphrase;
    }

    private String hmacBase64(String data) {
        try {
            Mac m = Mac.getInstance("HmacSHA256");
            m.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
            return Base64.getEncoder().encodeToString(m.doFinal(data.getBytes(StandardCharsets.UTF_8)));
        } catch (Exception e) {
            throw new IllegalStateException("Ошибка подписи KuCoin", e);
        }
    }
}
