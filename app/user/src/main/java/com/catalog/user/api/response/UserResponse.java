/*
 * どこで: app/user/src/main/java/com/catalog/user/api/response/UserResponse.java
 * 何を: GET /v1beta1/users/me の出力 DTO
 * なぜ: 解決済みユーザーの属性を安定した契約として返すため
 */
package com.catalog.user.api.response;

import java.time.Instant;

public record UserResponse(
        String id,
        String email,
        String provider,
        Instant createdAt,
        Instant updatedAt) {
}
