package com.tradeiq.webull.controller;

import com.tradeiq.shared.dto.ErrorResponse;
import com.tradeiq.webull.service.WebullApiClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Webull 帳戶查詢端點
 *
 * 只是 {@link WebullApiClient} 的薄包裝；
 * 憑證未設定 / 連線失敗交給 GlobalExceptionHandler 轉成 503 / 502。
 */
@Slf4j
@RestController
@RequestMapping("/api/webull")
@RequiredArgsConstructor
public class WebullController {

    private final WebullApiClient webullApiClient;

    /**
     * 查詢帳戶列表，第一個帳戶作為預設帳戶
     * GET /api/webull/accounts
     */
    @GetMapping("/accounts")
    public ResponseEntity<Map<String, Object>> getAccounts() {
        List<String> accountIds = webullApiClient.getAccountIds();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("accounts", accountIds);
        body.put("default_account_id", accountIds.isEmpty() ? null : accountIds.get(0));
        return ResponseEntity.ok(body);
    }

    /**
     * 查詢帳戶餘額，原樣回傳 Webull 的 JSON
     * GET /api/webull/accounts/{accountId}/balance
     */
    @GetMapping("/accounts/{accountId}/balance")
    public ResponseEntity<?> getBalance(@PathVariable String accountId) {
        if (accountId == null || accountId.isBlank()) {
            return ResponseEntity.badRequest()
                    .body(new ErrorResponse("參數錯誤", "accountId is required"));
        }
        log.info("查詢 Webull 帳戶餘額: accountId={}", accountId);
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_JSON)
                .body(webullApiClient.getAccountBalance(accountId.strip()));
    }
}
