package com.tradeiq.shared.handler;

import com.tradeiq.shared.dto.ErrorResponse;
import com.tradeiq.signing.exception.EncodingException;
import com.tradeiq.signing.exception.InvalidInputException;
import com.tradeiq.webull.service.WebullApiException;
import com.tradeiq.webull.service.WebullNotConfiguredException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.io.IOException;
import java.security.NoSuchAlgorithmException;

import static org.assertj.core.api.Assertions.*;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    @DisplayName("InvalidInputException → 400")
    void invalidInput() {
        ResponseEntity<ErrorResponse> response =
                handler.handleInvalidInput(new InvalidInputException("header x-timestamp is required"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().getMessage()).isEqualTo("header x-timestamp is required");
    }

    @Test
    @DisplayName("EncodingException → 500")
    void encoding() {
        ResponseEntity<ErrorResponse> response = handler.handleSigning(
                new EncodingException("MD5 digest unavailable", new NoSuchAlgorithmException("MD5")));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().getError()).isEqualTo("簽名失敗");
    }

    @Test
    @DisplayName("WebullApiException → 502")
    void webullApi() {
        ResponseEntity<ErrorResponse> response = handler.handleWebullApi(
                new WebullApiException("Webull API request failed", new IOException("timeout")));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_GATEWAY);
    }

    @Test
    @DisplayName("憑證未設定 → 503")
    void credentialsMissing() {
        ResponseEntity<ErrorResponse> response = handler.handleNotConfigured(new WebullNotConfiguredException());

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().getMessage()).contains("credentials");
    }
}
