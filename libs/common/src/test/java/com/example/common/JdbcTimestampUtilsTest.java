/*
 * どこで: 共通ユーティリティのユニットテスト
 * 何を: Instant/Timestamp 変換の NULL 扱いと往復精度を検証する
 */
package com.example.common;

import static org.assertj.core.api.Assertions.assertThat;

import java.sql.Timestamp;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class JdbcTimestampUtilsTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-01-17T00:00:00.123456Z");

  @Test
  void toTimestampKeepsNull() {
    assertThat(JdbcTimestampUtils.toTimestamp(null)).isNull();
    assertThat(JdbcTimestampUtils.toInstant(null)).isNull();
  }

  @Test
  void toTimestampPreservesMicroseconds() {
    final Timestamp timestamp = JdbcTimestampUtils.toTimestamp(FIXED_NOW);

    assertThat(JdbcTimestampUtils.toInstant(timestamp)).isEqualTo(FIXED_NOW);
  }
}
