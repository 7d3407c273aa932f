package com.tradeiq.signing.model;

import com.tradeiq.signing.exception.InvalidInputException;

import java.nio.charset.StandardCharsets;

/**
 * Webull App Secret 包裝
 *
 * 原始值只會以 HMAC key 的形式離開這個類別；toString 一律遮罩，避免誤寫進 log。
 */
public final class SharedSecret {

    private static final String KEY_SUFFIX = "&";

    private final String value;

    private SharedSecret(String value) {
        this.value = value;
    }

    public static SharedSecret of(String value) {
        if (value == null || value.isEmpty()) {
            throw new InvalidInputException("app secret is required");
        }
        return new SharedSecret(value);
    }

    /**
     * HMAC key = secret + "&"（結尾的 & 是 key 的一部分）
     */
    public byte[] hmacKey() {
        return (value + KEY_SUFFIX).getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return "SharedSecret[****]";
    }
}
