package com.tradeiq.signing.model;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 一次 Webull API 呼叫的簽名輸入（不可變）
 *
 * 每次對外呼叫由 API client 建立一個，簽完即丟棄。
 * timestamp / nonce 由呼叫端產生，signer 本身不讀時鐘也不產生亂數。
 *
 * query 參數與 body 可省略，分別視為空 map 與空 byte 陣列。
 */
@Getter
public final class SignatureRequest {

    /** 必須以 / 開頭，不含 scheme / host / query */
    private final String uriPath;

    /** 參數名稱區分大小寫，值一律為字串（"123" 不會被轉成數字） */
    private final Map<String, String> queryParameters;

    /** ISO-8601 UTC，例如 2022-01-04T03:55:31Z */
    private final String timestamp;
    private final String nonce;
    private final String appKey;
    private final String algorithmId;
    private final String signatureVersion;
    private final String host;

    @Getter(AccessLevel.NONE)
    private final byte[] body;

    @Builder(toBuilder = true)
    private SignatureRequest(String uriPath,
                             Map<String, String> queryParameters,
                             String timestamp,
                             String nonce,
                             String appKey,
                             String algorithmId,
                             String signatureVersion,
                             String host,
                             byte[] body) {
        this.uriPath = uriPath;
        this.queryParameters = queryParameters == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(queryParameters));
        this.timestamp = timestamp;
        this.nonce = nonce;
        this.appKey = appKey;
        this.algorithmId = algorithmId;
        this.signatureVersion = signatureVersion;
        this.host = host;
        this.body = body == null ? new byte[0] : body.clone();
    }

    /**
     * 回傳 body 的副本
     */
    public byte[] getBody() {
        return body.clone();
    }

    public int getBodyLength() {
        return body.length;
    }

    public static class SignatureRequestBuilder {

        /**
         * 以 UTF-8 編碼 JSON 字串作為 body，null 視為空 body
         */
        public SignatureRequestBuilder body(String json) {
            this.body = json == null ? null : json.getBytes(StandardCharsets.UTF_8);
            return this;
        }

        public SignatureRequestBuilder body(byte[] body) {
            this.body = body;
            return this;
        }
    }
}
