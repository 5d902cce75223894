/*
 * どこで: app/user/src/main/java/com/catalog/user/model/User.java
 * 何を: users テーブル相当のドメインレコード
 * なぜ: email + provider で同定されたユーザーを Service/Repository 間で受け渡すため
 */
package com.catalog.user.model;

import java.time.Instant;

public record User(
        String id,
        String email,
        String provider,
        Instant createdAt,
        Instant updatedAt) {
}
