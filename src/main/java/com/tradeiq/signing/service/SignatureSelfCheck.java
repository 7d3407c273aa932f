package com.tradeiq.signing.service;

import com.tradeiq.shared.config.WebullConfig;
import com.tradeiq.signing.model.SharedSecret;
import com.tradeiq.signing.model.SignatureRequest;
import com.tradeiq.signing.model.SigningTrace;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 以 Webull 官方文件的簽名範例驗證 signer
 *
 * 啟動完成後自動跑一次（webull.signature.self-check-on-startup），
 * 也可透過 /api/signature/self-check 手動觸發。
 * 範例中的 secret 是文件公開值，不是真實憑證。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SignatureSelfCheck {

    static final SignatureRequest DOCUMENTED_REQUEST = SignatureRequest.builder()
            .uriPath("/trade/place_order")
            .queryParameters(documentedQuery())
            .appKey("776da210ab4a452795d74e726ebd74b6")
            .timestamp("2022-01-04T03:55:31Z")
            .signatureVersion("1.0")
            .algorithmId("HMAC-SHA1")
            .nonce("48ef5afed43d4d91ae514aaeafbc29ba")
            .host("api.webull.com")
            .body("{\"k1\":123,\"k2\":\"this is the api request body\",\"k3\":true,\"k4\":{\"foo\":[1,2]}}")
            .build();

    static final String DOCUMENTED_SECRET = "0f50a2e853334a9aae1a783bee120c1f";

    static final String EXPECTED_STR1 = "a1=webull&a2=123&a3=xxx&host=api.webull.com&q1=yyy"
            + "&x-app-key=776da210ab4a452795d74e726ebd74b6&x-signature-algorithm=HMAC-SHA1"
            + "&x-signature-nonce=48ef5afed43d4d91ae514aaeafbc29ba&x-signature-version=1.0"
            + "&x-timestamp=2022-01-04T03:55:31Z";
    static final String EXPECTED_STR2 = "E296C96787E1A309691CEF3692F5EEDD";
    static final String EXPECTED_STR3 = "/trade/place_order&" + EXPECTED_STR1 + "&" + EXPECTED_STR2;
    static final String EXPECTED_ENCODED = "%2Ftrade%2Fplace_order%26a1%3Dwebull%26a2%3D123%26a3%3Dxxx"
            + "%26host%3Dapi.webull.com%26q1%3Dyyy%26x-app-key%3D776da210ab4a452795d74e726ebd74b6"
            + "%26x-signature-algorithm%3DHMAC-SHA1%26x-signature-nonce%3D48ef5afed43d4d91ae514aaeafbc29ba"
            + "%26x-signature-version%3D1.0%26x-timestamp%3D2022-01-04T03%3A55%3A31Z"
            + "%26E296C96787E1A309691CEF3692F5EEDD";
    static final String EXPECTED_SIGNATURE = "kvlS6opdZDhEBo5jq40nHYXaLvM=";

    private final WebullRequestSigner signer;
    private final WebullConfig webullConfig;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!webullConfig.getSignature().isSelfCheckOnStartup()) {
            log.debug("簽名自我檢查已停用");
            return;
        }
        run();
    }

    public SelfCheckResult run() {
        SigningTrace trace = signer.trace(DOCUMENTED_REQUEST, SharedSecret.of(DOCUMENTED_SECRET));

        Map<String, String[]> steps = new LinkedHashMap<>();
        steps.put("str1", new String[]{EXPECTED_STR1, trace.canonicalQuery()});
        steps.put("str2", new String[]{EXPECTED_STR2, trace.bodyDigest()});
        steps.put("str3", new String[]{EXPECTED_STR3, trace.stringToSign()});
        steps.put("encoded", new String[]{EXPECTED_ENCODED, trace.encoded()});
        steps.put("signature", new String[]{EXPECTED_SIGNATURE, trace.signature().value()});

        for (Map.Entry<String, String[]> step : steps.entrySet()) {
            String expected = step.getValue()[0];
            String actual = step.getValue()[1];
            if (!expected.equals(actual)) {
                log.error("Webull 簽名自我檢查失敗: step={}, expected={}, actual={}",
                        step.getKey(), expected, actual);
                return SelfCheckResult.fail(step.getKey());
            }
        }

        log.info("Webull 簽名自我檢查通過（官方文件範例）");
        return SelfCheckResult.pass();
    }

    private static Map<String, String> documentedQuery() {
        Map<String, String> query = new LinkedHashMap<>();
        query.put("a1", "webull");
        query.put("a2", "123");
        query.put("a3", "xxx");
        query.put("q1", "yyy");
        return query;
    }

    /**
     * @param passed     是否全部步驟一致
     * @param failedStep 第一個不一致的步驟名稱，通過時為 null
     */
    public record SelfCheckResult(boolean passed, String failedStep) {

        static SelfCheckResult pass() {
            return new SelfCheckResult(true, null);
        }

        static SelfCheckResult fail(String step) {
            return new SelfCheckResult(false, step);
        }
    }
}
