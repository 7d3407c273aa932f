package com.tradeiq.signing.model;

/**
 * 單次簽名的中間產物，用於對照官方範例逐步驗證
 *
 * 不包含 secret 與 HMAC key。
 *
 * @param canonicalQuery str1：排序後的 key=value&amp;...
 * @param bodyDigest     str2：body MD5 大寫 hex
 * @param stringToSign   str3：path&amp;str1&amp;str2
 * @param encoded        str3 percent-encode 後的字串（HMAC 的 message）
 * @param signature      最終簽名
 */
public record SigningTrace(
        String canonicalQuery,
        String bodyDigest,
        String stringToSign,
        String encoded,
        Signature signature
) {
}
