package com.tradeiq.signing.model;

import java.util.Arrays;
import java.util.List;
import java.util.function.Function;

/**
 * 參與簽名的固定 header 集合（Webull OpenAPI 協議常數，不可設定）
 *
 * 宣告順序即為送出 header 時的順序；簽名時會再依 key 排序，所以順序不影響簽名結果。
 */
public enum CanonicalHeader {

    APP_KEY("x-app-key", SignatureRequest::getAppKey),
    SIGNATURE_ALGORITHM("x-signature-algorithm", SignatureRequest::getAlgorithmId),
    SIGNATURE_VERSION("x-signature-version", SignatureRequest::getSignatureVersion),
    SIGNATURE_NONCE("x-signature-nonce", SignatureRequest::getNonce),
    TIMESTAMP("x-timestamp", SignatureRequest::getTimestamp),
    HOST("host", SignatureRequest::getHost);

    /** 簽名結果放入的 header 名稱 */
    public static final String SIGNATURE_HEADER = "x-signature";

    private final String headerName;
    private final Function<SignatureRequest, String> valueReader;

    CanonicalHeader(String headerName, Function<SignatureRequest, String> valueReader) {
        this.headerName = headerName;
        this.valueReader = valueReader;
    }

    public String getHeaderName() {
        return headerName;
    }

    /**
     * 從請求取出此 header 的原始值（不 trim、不轉大小寫）
     */
    public String valueOf(SignatureRequest request) {
        return valueReader.apply(request);
    }

    public static List<String> names() {
        return Arrays.stream(values())
                .map(CanonicalHeader::getHeaderName)
                .toList();
    }
}
