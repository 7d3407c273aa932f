package com.tradeiq.signing.service;

import com.tradeiq.signing.exception.EncodingException;
import com.tradeiq.signing.exception.InvalidInputException;
import com.tradeiq.signing.model.CanonicalHeader;
import com.tradeiq.signing.model.SharedSecret;
import com.tradeiq.signing.model.Signature;
import com.tradeiq.signing.model.SignatureRequest;
import com.tradeiq.signing.model.SigningTrace;
import com.tradeiq.signing.util.PercentEncoder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Webull OpenAPI 請求簽名
 *
 * 演算法（必須與官方文件範例逐 byte 相同）：
 * <ol>
 *   <li>query 參數 + 6 個簽名 header 合併成一個 map（header 後放，同名時覆蓋 query）</li>
 *   <li>依 key 排序，組成 str1 = k1=v1&amp;k2=v2...</li>
 *   <li>str2 = body 的 MD5，大寫 hex（空 body 也要算）</li>
 *   <li>str3 = uriPath + "&amp;" + str1 + "&amp;" + str2</li>
 *   <li>整串 str3 做嚴格 percent-encoding</li>
 *   <li>HMAC key = secret + "&amp;"</li>
 *   <li>HMAC-SHA1 後 Base64 即為簽名</li>
 * </ol>
 *
 * 無狀態、不讀時鐘、不產生亂數，可被任意 thread 同時呼叫。
 * secret 與 HMAC key 不會出現在任何 log。
 */
@Slf4j
@Component
public class WebullRequestSigner {

    private static final String HMAC_ALGORITHM = "HmacSHA1";
    private static final String DIGEST_ALGORITHM = "MD5";
    private static final String SEPARATOR = "&";

    public Signature sign(SignatureRequest request, SharedSecret secret) {
        return trace(request, secret).signature();
    }

    /**
     * 與 {@link #sign} 相同的計算，但保留每一步的中間字串
     */
    public SigningTrace trace(SignatureRequest request, SharedSecret secret) {
        validate(request);
        if (secret == null) {
            throw new InvalidInputException("app secret is required");
        }

        String str1 = canonicalQuery(request);
        String str2 = bodyDigest(request.getBody());
        String str3 = request.getUriPath() + SEPARATOR + str1 + SEPARATOR + str2;
        String encoded = PercentEncoder.encode(str3);
        Signature signature = new Signature(hmacSha1Base64(secret, encoded));

        log.debug("Webull 請求已簽名: path={}, params={}, bodyBytes={}",
                request.getUriPath(), request.getQueryParameters().size(), request.getBodyLength());
        return new SigningTrace(str1, str2, str3, encoded, signature);
    }

    /**
     * 重新計算簽名並以固定時間比對
     *
     * @return expected 為 null / 空白時回傳 false，不拋例外
     */
    public boolean verify(SignatureRequest request, SharedSecret secret, String expected) {
        if (expected == null || expected.isBlank()) {
            return false;
        }
        String actual = sign(request, secret).value();
        return MessageDigest.isEqual(
                actual.getBytes(StandardCharsets.UTF_8),
                expected.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * str1：query 參數與簽名 header 合併、排序後以 &amp; 串接
     */
    String canonicalQuery(SignatureRequest request) {
        Map<String, String> params = new LinkedHashMap<>(request.getQueryParameters());
        for (CanonicalHeader header : CanonicalHeader.values()) {
            params.put(header.getHeaderName(), header.valueOf(request));
        }

        // key 唯一，String 自然排序即 code point 排序
        return new TreeMap<>(params).entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(SEPARATOR));
    }

    /**
     * str2：body MD5，大寫 hex
     */
    String bodyDigest(byte[] body) {
        try {
            MessageDigest md5 = MessageDigest.getInstance(DIGEST_ALGORITHM);
            return HexFormat.of().withUpperCase().formatHex(md5.digest(body));
        } catch (NoSuchAlgorithmException e) {
            throw new EncodingException("MD5 digest unavailable", e);
        }
    }

    private String hmacSha1Base64(SharedSecret secret, String message) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(secret.hmacKey(), HMAC_ALGORITHM));
            byte[] tag = mac.doFinal(message.getBytes(StandardCharsets.UTF_8));
            return Base64.getEncoder().encodeToString(tag);
        } catch (GeneralSecurityException e) {
            throw new EncodingException("Failed to compute HMAC-SHA1 signature", e);
        }
    }

    private void validate(SignatureRequest request) {
        if (request == null) {
            throw new InvalidInputException("signature request is required");
        }
        String path = request.getUriPath();
        if (path == null || path.isEmpty()) {
            throw new InvalidInputException("uri path is required");
        }
        if (!path.startsWith("/")) {
            throw new InvalidInputException("uri path must start with '/': " + path);
        }
        if (path.indexOf('?') >= 0 || path.indexOf('#') >= 0) {
            throw new InvalidInputException("uri path must not contain a query string or fragment: " + path);
        }
        for (Map.Entry<String, String> e : request.getQueryParameters().entrySet()) {
            if (e.getKey() == null || e.getKey().isEmpty()) {
                throw new InvalidInputException("query parameter name must not be empty");
            }
            if (e.getValue() == null) {
                throw new InvalidInputException("query parameter " + e.getKey() + " has no value");
            }
        }
        requireCanonicalHeaders(request);
    }

    static void requireCanonicalHeaders(SignatureRequest request) {
        for (CanonicalHeader header : CanonicalHeader.values()) {
            String value = header.valueOf(request);
            if (value == null || value.isEmpty()) {
                throw new InvalidInputException("header " + header.getHeaderName() + " is required");
            }
        }
    }
}
