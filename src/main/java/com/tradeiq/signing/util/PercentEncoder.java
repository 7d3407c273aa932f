package com.tradeiq.signing.util;

import com.tradeiq.signing.exception.EncodingException;

import java.net.URLEncoder;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * 嚴格 percent-encoding 工具
 *
 * 只保留 RFC 3986 unreserved 字元 [A-Za-z0-9._~-]，其餘一律轉成 %XX（大寫 hex，UTF-8 bytes）。
 * 與 URL path 編碼不同：/ 與 &amp; 也必須被編碼，因為這裡編碼的是整串待簽字串。
 *
 * URLEncoder 是 form 編碼：空白會變 +、* 不編碼、~ 會被編碼，所以要補三個替換。
 * URLEncoder 遇到落單的 surrogate 會默默換成 ?，所以先用 REPORT 模式的 encoder 檢查一次。
 */
public final class PercentEncoder {

    private PercentEncoder() {}

    /**
     * @throws EncodingException 字串含無法以 UTF-8 表示的字元（落單的 surrogate）
     */
    public static String encode(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        requireEncodable(value);
        return URLEncoder.encode(value, StandardCharsets.UTF_8)
                .replace("+", "%20")
                .replace("*", "%2A")
                .replace("%7E", "~");
    }

    private static void requireEncodable(String value) {
        try {
            StandardCharsets.UTF_8.newEncoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .encode(CharBuffer.wrap(value));
        } catch (CharacterCodingException e) {
            throw new EncodingException("string to sign is not valid UTF-16 (unpaired surrogate)", e);
        }
    }
}
