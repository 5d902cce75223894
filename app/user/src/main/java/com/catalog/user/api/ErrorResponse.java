/*
 * どこで: app/user/src/main/java/com/catalog/user/api/ErrorResponse.java
 * 何を: API エラー応答の共通 DTO
 * なぜ: Filter と Controller のどちらで失敗しても同じ {"reason": ...} 形式で返すため
 */
package com.catalog.user.api;

public record ErrorResponse(String reason) {
}
