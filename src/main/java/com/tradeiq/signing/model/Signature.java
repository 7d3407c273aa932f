package com.tradeiq.signing.model;

/**
 * 簽名結果：HMAC-SHA1 tag 的 Base64（標準字元集、含 padding）
 */
public record Signature(String value) {

    @Override
    public String toString() {
        return value;
    }
}
