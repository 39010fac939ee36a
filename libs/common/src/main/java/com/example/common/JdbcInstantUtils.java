/*
 * どこで: 共通ユーティリティ
 * 何を: ローカルストアのエポックミリ秒列と Instant を相互変換する
 * なぜ: SQLite にはタイムスタンプ型がないため、Instant を INTEGER として明示的にバインドするため
 */
package com.example.common;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;

public final class JdbcInstantUtils {
  private JdbcInstantUtils() {}

  // Instant は UTC のミリ秒で保存し、列の並びは時刻順と一致する
  public static Long toEpochMillis(Instant instant) {
    return instant == null ? null : instant.toEpochMilli();
  }

  public static Instant getInstant(ResultSet rs, String column) throws SQLException {
    final long millis = rs.getLong(column);
    if (rs.wasNull()) {
      return null;
    }
    return Instant.ofEpochMilli(millis);
  }
}
