/*
 * どこで: Timeclock API
 * 何を: 標準エラーレスポンスを定義する
 * なぜ: 例外ハンドラ間でレスポンス形状を統一するため
 */
package com.example.timeclock.api;

public record ApiErrorResponse(String code, String message) {}
