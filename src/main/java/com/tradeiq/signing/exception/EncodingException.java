package com.tradeiq.signing.exception;

/**
 * body / 簽名字串無法轉成 bytes，或 JDK 缺少 MD5 / HmacSHA1 實作
 */
public class EncodingException extends SigningException {

    public EncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
