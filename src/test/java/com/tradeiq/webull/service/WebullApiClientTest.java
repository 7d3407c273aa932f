package com.tradeiq.webull.service;

import com.tradeiq.shared.config.WebullConfig;
import com.tradeiq.signing.model.SharedSecret;
import com.tradeiq.signing.model.SignatureRequest;
import com.tradeiq.signing.service.SignedHeaderAssembler;
import com.tradeiq.signing.service.WebullRequestSigner;
import okhttp3.*;
import okio.Buffer;
import org.junit.jupiter.api.*;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * WebullApiClient 單元測試
 *
 * 策略：mock OkHttpClient / Call，攔截送出的 Request，
 * 再用真實 signer 從 header 重算簽名，確認送出的內容與簽名一致。
 */
class WebullApiClientTest {

    private static final String APP_KEY = "776da210ab4a452795d74e726ebd74b6";
    private static final String APP_SECRET = "0f50a2e853334a9aae1a783bee120c1f";

    private OkHttpClient httpClient;
    private Call mockCall;
    private WebullRequestSigner signer;
    private WebullApiClient client;

    @BeforeEach
    void setUp() {
        httpClient = mock(OkHttpClient.class);
        mockCall = mock(Call.class);
        when(httpClient.newCall(any())).thenReturn(mockCall);

        signer = new WebullRequestSigner();
        Clock clock = Clock.fixed(Instant.parse("2022-01-04T03:55:31.789Z"), ZoneOffset.UTC);
        client = new WebullApiClient(httpClient, config(APP_KEY, APP_SECRET),
                new SignedHeaderAssembler(signer), clock);
    }

    // ========== helper ==========

    private WebullConfig config(String appKey, String appSecret) {
        return new WebullConfig("https://api.webull.com", "api.webull.com", appKey, appSecret,
                new WebullConfig.SignatureSettings("HMAC-SHA1", "1.0", false));
    }

    private Response buildResponse(int code, String body) {
        return new Response.Builder()
                .request(new Request.Builder().url("https://api.webull.com").build())
                .protocol(Protocol.HTTP_1_1)
                .code(code)
                .message("OK")
                .body(ResponseBody.create(body, MediaType.get("application/json")))
                .build();
    }

    private Request captureRequest() {
        ArgumentCaptor<Request> captor = ArgumentCaptor.forClass(Request.class);
        verify(httpClient).newCall(captor.capture());
        return captor.getValue();
    }

    /**
     * 依照送出的 header / URL / body 重建簽名輸入
     */
    private SignatureRequest rebuild(Request request, Map<String, String> query, byte[] body) {
        return SignatureRequest.builder()
                .uriPath(request.url().encodedPath())
                .queryParameters(query)
                .appKey(request.header("x-app-key"))
                .algorithmId(request.header("x-signature-algorithm"))
                .signatureVersion(request.header("x-signature-version"))
                .nonce(request.header("x-signature-nonce"))
                .timestamp(request.header("x-timestamp"))
                .host(request.header("host"))
                .body(body)
                .build();
    }

    @Nested
    @DisplayName("GET")
    class GetTests {

        @Test
        @DisplayName("帶上 6 個簽名 header + x-signature，簽名可被驗證")
        void signedHeadersAttached() throws Exception {
            when(mockCall.execute()).thenReturn(buildResponse(200, "{\"ok\":true}"));

            String result = client.getAccountBalance("ACC123");

            assertThat(result).isEqualTo("{\"ok\":true}");
            Request sent = captureRequest();
            assertThat(sent.method()).isEqualTo("GET");
            assertThat(sent.url().encodedPath()).isEqualTo("/account/balance");
            assertThat(sent.url().queryParameter("account_id")).isEqualTo("ACC123");
            assertThat(sent.header("x-app-key")).isEqualTo(APP_KEY);
            assertThat(sent.header("x-signature-algorithm")).isEqualTo("HMAC-SHA1");
            assertThat(sent.header("x-signature-version")).isEqualTo("1.0");
            assertThat(sent.header("host")).isEqualTo("api.webull.com");
            assertThat(sent.header("x-signature")).isNotBlank();

            SignatureRequest rebuilt = rebuild(sent, Map.of("account_id", "ACC123"), new byte[0]);
            assertThat(signer.verify(rebuilt, SharedSecret.of(APP_SECRET), sent.header("x-signature"))).isTrue();
        }

        @Test
        @DisplayName("x-timestamp 取自 Clock，截到秒，UTC Z 結尾")
        void timestampFromClock() throws Exception {
            when(mockCall.execute()).thenReturn(buildResponse(200, "[]"));

            client.getAccountList();

            assertThat(captureRequest().header("x-timestamp")).isEqualTo("2022-01-04T03:55:31Z");
        }

        @Test
        @DisplayName("nonce 為 32 位 hex，每次呼叫都不同")
        void nonceUniquePerCall() throws Exception {
            when(mockCall.execute())
                    .thenReturn(buildResponse(200, "[]"))
                    .thenReturn(buildResponse(200, "[]"));

            client.getAccountList();
            client.getAccountList();

            ArgumentCaptor<Request> captor = ArgumentCaptor.forClass(Request.class);
            verify(httpClient, times(2)).newCall(captor.capture());
            String first = captor.getAllValues().get(0).header("x-signature-nonce");
            String second = captor.getAllValues().get(1).header("x-signature-nonce");
            assertThat(first).matches("[0-9a-f]{32}");
            assertThat(second).matches("[0-9a-f]{32}");
            assertThat(first).isNotEqualTo(second);
        }

        @Test
        @DisplayName("帳戶列表 → 依序取出 account_id")
        void accountIdsParsed() throws Exception {
            when(mockCall.execute()).thenReturn(buildResponse(200,
                    "[{\"account_id\":\"A1\",\"account_type\":\"CASH\"},{\"account_id\":\"A2\"}]"));

            assertThat(client.getAccountIds()).containsExactly("A1", "A2");
            assertThat(captureRequest().url().encodedPath()).isEqualTo("/app/subscriptions/list");
        }

        @Test
        @DisplayName("帳戶列表回應不是陣列（例如 401 錯誤物件）→ RuntimeException")
        void accountIdsUnexpectedPayload() throws Exception {
            when(mockCall.execute()).thenReturn(buildResponse(401, "{\"error_code\":\"UNAUTHORIZED\"}"));

            assertThatThrownBy(() -> client.getAccountIds())
                    .isInstanceOf(RuntimeException.class)
                    .hasMessageContaining("UNAUTHORIZED");
        }

        @Test
        @DisplayName("空白 accountId → IllegalArgumentException，不送出請求")
        void blankAccountId() {
            assertThatThrownBy(() -> client.getAccountBalance(" "))
                    .isInstanceOf(IllegalArgumentException.class);
            verify(httpClient, never()).newCall(any());
        }
    }

    @Nested
    @DisplayName("POST")
    class PostTests {

        @Test
        @DisplayName("送出的 body 與簽名使用的 body 完全相同")
        void bodyMatchesSignedBody() throws Exception {
            when(mockCall.execute()).thenReturn(buildResponse(200, "{\"client_order_id\":\"abc\"}"));
            Map<String, String> query = new LinkedHashMap<>();
            query.put("a1", "webull");
            String json = "{\"k1\":123,\"k2\":\"this is the api request body\"}";

            client.post("/trade/place_order", query, json);

            Request sent = captureRequest();
            Buffer buffer = new Buffer();
            sent.body().writeTo(buffer);
            byte[] sentBody = buffer.readByteArray();

            assertThat(new String(sentBody)).isEqualTo(json);
            assertThat(sent.body().contentType().toString()).startsWith("application/json");
            SignatureRequest rebuilt = rebuild(sent, query, sentBody);
            assertThat(signer.verify(rebuilt, SharedSecret.of(APP_SECRET), sent.header("x-signature"))).isTrue();
        }
    }

    @Nested
    @DisplayName("錯誤處理")
    class ErrorTests {

        @Test
        @DisplayName("HTTP 401 → 回傳 body，不拋例外也不重試")
        void httpErrorReturnsBody() throws Exception {
            when(mockCall.execute()).thenReturn(buildResponse(401, "{\"error_code\":\"UNAUTHORIZED\"}"));

            String result = client.getAccountList();

            assertThat(result).contains("UNAUTHORIZED");
            verify(httpClient, times(1)).newCall(any());
        }

        @Test
        @DisplayName("IOException → WebullApiException")
        void ioExceptionWrapped() throws Exception {
            when(mockCall.execute()).thenThrow(new IOException("timeout"));

            assertThatThrownBy(() -> client.getAccountList())
                    .isInstanceOf(WebullApiException.class)
                    .hasCauseInstanceOf(IOException.class);
        }

        @Test
        @DisplayName("未設定 App Secret → WebullNotConfiguredException，不送出請求")
        void missingCredentials() {
            WebullApiClient unconfigured = new WebullApiClient(httpClient, config(APP_KEY, ""),
                    new SignedHeaderAssembler(signer), Clock.systemUTC());

            assertThatThrownBy(unconfigured::getAccountList)
                    .isInstanceOf(WebullNotConfiguredException.class)
                    .hasMessageContaining("credentials");
            verify(httpClient, never()).newCall(any());
        }
    }
}
