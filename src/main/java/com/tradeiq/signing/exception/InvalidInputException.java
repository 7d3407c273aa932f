package com.tradeiq.signing.exception;

/**
 * 簽名輸入不合法：uri path 格式錯誤、缺少簽名 header 值、query 參數為 null 等
 */
public class InvalidInputException extends SigningException {

    public InvalidInputException(String message) {
        super(message);
    }
}
