/*
 * どこで: 共通ユーティリティ
 * 何を: Instant と Timestamp を JDBC 境界で相互変換する
 * なぜ: PostgreSQL JDBC の型推論に頼らず UTC のまま読み書きするため
 */
package com.catalog.common;

import java.sql.Timestamp;
import java.time.Instant;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  public static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }
}
