package com.tradeiq.shared.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * 簽名 / Webull 端點共用的錯誤 body
 *
 * error 是固定的中文分類，message 是例外原文（不含 secret）。
 */
@Data
@AllArgsConstructor
public class ErrorResponse {

    private String error;

    private String message;
}
