package com.tradeiq.signing.exception;

/**
 * Webull 請求簽名失敗的共同父類別
 *
 * 簽名只有「完整成功」或「拋出例外」兩種結果，不會回傳部分簽名。
 * 訊息中不得包含 App Secret。
 */
public class SigningException extends RuntimeException {

    public SigningException(String message) {
        super(message);
    }

    public SigningException(String message, Throwable cause) {
        super(message, cause);
    }
}
