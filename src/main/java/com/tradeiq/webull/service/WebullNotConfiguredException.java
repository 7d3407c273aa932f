package com.tradeiq.webull.service;

/**
 * 未設定 Webull App Key / App Secret，無法送出簽名請求
 *
 * 在任何網路 I/O 之前拋出。
 */
public class WebullNotConfiguredException extends IllegalStateException {

    public WebullNotConfiguredException() {
        super("Webull API credentials are not configured");
    }
}
