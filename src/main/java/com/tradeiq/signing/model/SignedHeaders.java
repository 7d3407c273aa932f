package com.tradeiq.signing.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 要原封不動附加到對外請求的 header：6 個簽名 header + x-signature
 */
public record SignedHeaders(Map<String, String> headers) {

    public SignedHeaders {
        headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    public String get(String name) {
        return headers.get(name);
    }

    public String signature() {
        return headers.get(CanonicalHeader.SIGNATURE_HEADER);
    }
}
