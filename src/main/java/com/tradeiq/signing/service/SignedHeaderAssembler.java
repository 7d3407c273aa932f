package com.tradeiq.signing.service;

import com.tradeiq.signing.exception.InvalidInputException;
import com.tradeiq.signing.model.CanonicalHeader;
import com.tradeiq.signing.model.SharedSecret;
import com.tradeiq.signing.model.Signature;
import com.tradeiq.signing.model.SignatureRequest;
import com.tradeiq.signing.model.SignedHeaders;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 把簽名結果組成對外請求要帶的 header
 *
 * 純函式，不送出任何東西；header 值原樣帶出，不做 trim。
 */
@Component
@RequiredArgsConstructor
public class SignedHeaderAssembler {

    private final WebullRequestSigner signer;

    public SignedHeaders sign(SignatureRequest request, SharedSecret secret) {
        return assemble(request, signer.sign(request, secret));
    }

    public SignedHeaders assemble(SignatureRequest request, Signature signature) {
        if (request == null) {
            throw new InvalidInputException("signature request is required");
        }
        if (signature == null || signature.value() == null || signature.value().isEmpty()) {
            throw new InvalidInputException("signature is required");
        }
        WebullRequestSigner.requireCanonicalHeaders(request);

        Map<String, String> headers = new LinkedHashMap<>();
        for (CanonicalHeader header : CanonicalHeader.values()) {
            headers.put(header.getHeaderName(), header.valueOf(request));
        }
        headers.put(CanonicalHeader.SIGNATURE_HEADER, signature.value());
        return new SignedHeaders(headers);
    }
}
