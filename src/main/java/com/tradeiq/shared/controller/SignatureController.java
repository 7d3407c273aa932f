package com.tradeiq.shared.controller;

import com.tradeiq.signing.service.SignatureSelfCheck;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 簽名自我檢查端點：用官方文件範例驗證目前部署的 signer
 *
 * 只用公開範例資料，不會讀取或回傳設定中的 App Secret。
 */
@RestController
@RequestMapping("/api/signature")
@RequiredArgsConstructor
public class SignatureController {

    private final SignatureSelfCheck selfCheck;

    @GetMapping("/self-check")
    public ResponseEntity<SignatureSelfCheck.SelfCheckResult> selfCheck() {
        SignatureSelfCheck.SelfCheckResult result = selfCheck.run();
        if (!result.passed()) {
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(result);
        }
        return ResponseEntity.ok(result);
    }
}
