package com.tradeiq.shared.config;

import lombok.Getter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@Getter
@ConfigurationProperties(prefix = "webull")
public class WebullConfig {

    private final String baseUrl;
    private final String host;
    private final String appKey;
    private final String appSecret;
    private final SignatureSettings signature;

    public WebullConfig(
            @DefaultValue("https://api.webull.com") String baseUrl,
            @DefaultValue("api.webull.com") String host,
            String appKey,
            String appSecret,
            @DefaultValue SignatureSettings signature
    ) {
        this.baseUrl = baseUrl;
        this.host = host;
        this.appKey = appKey;
        this.appSecret = appSecret;
        this.signature = signature;
    }

    /**
     * App Key / App Secret 都有設定才視為可呼叫 API
     */
    public boolean hasCredentials() {
        return appKey != null && !appKey.isBlank()
                && appSecret != null && !appSecret.isBlank();
    }

    @Getter
    public static class SignatureSettings {
        private final String algorithm;
        private final String version;
        private final boolean selfCheckOnStartup;

        public SignatureSettings(
                @DefaultValue("HMAC-SHA1") String algorithm,
                @DefaultValue("1.0") String version,
                @DefaultValue("true") boolean selfCheckOnStartup
        ) {
            this.algorithm = algorithm;
            this.version = version;
            this.selfCheckOnStartup = selfCheckOnStartup;
        }
    }
}
