package com.tradeiq.webull.service;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.tradeiq.shared.config.WebullConfig;
import com.tradeiq.signing.model.SharedSecret;
import com.tradeiq.signing.model.SignatureRequest;
import com.tradeiq.signing.model.SignedHeaders;
import com.tradeiq.signing.service.SignedHeaderAssembler;
import lombok.extern.slf4j.Slf4j;
import okhttp3.*;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Webull OpenAPI 呼叫端
 *
 * 負責 signer 不管的部分：產生 x-timestamp / x-signature-nonce、
 * 從設定讀取 App Key / Secret、附上簽名 header 並透過 OkHttp 送出。
 *
 * 不做重試、不做限流；收到 HTTP 回應（含 4xx/5xx）直接回傳 body 由呼叫端判斷。
 */
@Slf4j
@Service
public class WebullApiClient {

    static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'").withZone(ZoneOffset.UTC);

    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final WebullConfig webullConfig;
    private final SignedHeaderAssembler headerAssembler;
    private final Clock clock;
    private final Gson gson = new Gson();

    public WebullApiClient(OkHttpClient httpClient, WebullConfig webullConfig,
                           SignedHeaderAssembler headerAssembler, Clock clock) {
        this.httpClient = httpClient;
        this.webullConfig = webullConfig;
        this.headerAssembler = headerAssembler;
        this.clock = clock;
    }

    // ==================== 帳戶相關 ====================

    public String getAccountList() {
        return get("/app/subscriptions/list", Map.of());
    }

    /**
     * 解析帳戶列表，回傳所有 account_id（第一個即預設帳戶）
     * ⚠️ 回應不是預期格式時拋出 RuntimeException，避免以空列表誤判為「沒有帳戶」
     */
    public List<String> getAccountIds() {
        String response = getAccountList();
        try {
            JsonArray accounts = gson.fromJson(response, JsonArray.class);
            List<String> ids = new ArrayList<>();
            for (JsonElement elem : accounts) {
                JsonObject account = elem.getAsJsonObject();
                if (account.has("account_id")) {
                    ids.add(account.get("account_id").getAsString());
                }
            }
            return ids;
        } catch (Exception e) {
            throw new RuntimeException("解析 Webull 帳戶列表失敗: " + response, e);
        }
    }

    public String getAccountBalance(String accountId) {
        if (accountId == null || accountId.isBlank()) {
            throw new IllegalArgumentException("accountId is required");
        }
        return get("/account/balance", Map.of("account_id", accountId));
    }

    // ==================== HTTP 請求方法 ====================

    public String get(String path, Map<String, String> query) {
        SignedHeaders headers = signedHeaders(path, query, null);
        Request request = new Request.Builder()
                .url(buildUrl(path, query))
                .get()
                .headers(toOkHttpHeaders(headers))
                .build();
        return executeRequest(request);
    }

    /**
     * 送出的 body bytes 與簽名時使用的 bytes 完全相同
     */
    public String post(String path, Map<String, String> query, String jsonBody) {
        byte[] body = jsonBody == null ? new byte[0] : jsonBody.getBytes(StandardCharsets.UTF_8);
        SignedHeaders headers = signedHeaders(path, query, body);
        Request request = new Request.Builder()
                .url(buildUrl(path, query))
                .post(RequestBody.create(body, JSON))
                .headers(toOkHttpHeaders(headers))
                .build();
        return executeRequest(request);
    }

    SignedHeaders signedHeaders(String path, Map<String, String> query, byte[] body) {
        if (!webullConfig.hasCredentials()) {
            throw new WebullNotConfiguredException();
        }
        SignatureRequest signatureRequest = SignatureRequest.builder()
                .uriPath(path)
                .queryParameters(query)
                .appKey(webullConfig.getAppKey())
                .algorithmId(webullConfig.getSignature().getAlgorithm())
                .signatureVersion(webullConfig.getSignature().getVersion())
                .nonce(newNonce())
                .timestamp(currentTimestamp())
                .host(webullConfig.getHost())
                .body(body)
                .build();
        return headerAssembler.sign(signatureRequest, SharedSecret.of(webullConfig.getAppSecret()));
    }

    String currentTimestamp() {
        return TIMESTAMP_FORMAT.format(clock.instant().truncatedTo(ChronoUnit.SECONDS));
    }

    private String newNonce() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    private HttpUrl buildUrl(String path, Map<String, String> query) {
        HttpUrl base = HttpUrl.parse(webullConfig.getBaseUrl() + path);
        if (base == null) {
            throw new IllegalArgumentException("Invalid Webull URL: " + webullConfig.getBaseUrl() + path);
        }
        HttpUrl.Builder builder = base.newBuilder();
        if (query != null) {
            query.forEach(builder::addQueryParameter);
        }
        return builder.build();
    }

    private Headers toOkHttpHeaders(SignedHeaders signedHeaders) {
        Headers.Builder builder = new Headers.Builder();
        signedHeaders.headers().forEach(builder::add);
        return builder.build();
    }

    private String executeRequest(Request request) {
        try (Response response = httpClient.newCall(request).execute()) {
            String body = response.body() != null ? response.body().string() : "";
            if (!response.isSuccessful()) {
                log.error("Webull API error: {} {} - {} - {}",
                        request.method(), request.url().encodedPath(), response.code(), body);
            }
            return body;
        } catch (IOException e) {
            log.error("HTTP request failed: {} {} - {}",
                    request.method(), request.url().encodedPath(), e.getMessage(), e);
            throw new WebullApiException("Webull API request failed", e);
        }
    }
}
