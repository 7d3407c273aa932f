package com.tradeiq.webull.service;

/**
 * Webull API 連線失敗（網路斷線、timeout 等 IOException）
 *
 * 收到 HTTP 回應（含 4xx/5xx）不屬於此例外，由呼叫端解析回應內容。
 */
public class WebullApiException extends RuntimeException {

    public WebullApiException(String message, Throwable cause) {
        super(message, cause);
    }
}
