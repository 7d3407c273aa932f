package com.tradeiq.shared.controller;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * 簽名服務存活檢查
 *
 * 只回報行程還活著：不簽名、不呼叫 Webull，所以憑證未設定時也是 UP。
 * 簽名是否正確請看 /api/signature/self-check。
 */
@RestController
public class HealthController {

    @GetMapping("/api/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "UP"));
    }
}
