package com.tradeiq.shared.handler;

import com.tradeiq.shared.dto.ErrorResponse;
import com.tradeiq.signing.exception.InvalidInputException;
import com.tradeiq.signing.exception.SigningException;
import com.tradeiq.webull.service.WebullApiException;
import com.tradeiq.webull.service.WebullNotConfiguredException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 全域例外處理
 *
 * 簽名 / Webull 呼叫相關例外統一轉成 {@link ErrorResponse}。
 * 例外訊息本身不含 secret，可以直接回傳。
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(InvalidInputException.class)
    public ResponseEntity<ErrorResponse> handleInvalidInput(InvalidInputException e) {
        return ResponseEntity.badRequest()
                .body(new ErrorResponse("簽名參數錯誤", e.getMessage()));
    }

    @ExceptionHandler(SigningException.class)
    public ResponseEntity<ErrorResponse> handleSigning(SigningException e) {
        log.error("簽名失敗: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("簽名失敗", e.getMessage()));
    }

    @ExceptionHandler(WebullApiException.class)
    public ResponseEntity<ErrorResponse> handleWebullApi(WebullApiException e) {
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(new ErrorResponse("Webull API 無法連線", e.getMessage()));
    }

    @ExceptionHandler(WebullNotConfiguredException.class)
    public ResponseEntity<ErrorResponse> handleNotConfigured(WebullNotConfiguredException e) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ErrorResponse("Webull 憑證未設定", e.getMessage()));
    }
}
