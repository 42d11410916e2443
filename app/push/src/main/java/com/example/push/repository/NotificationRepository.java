/*
 * どこで: Push データアクセス
 * 何を: notifications と notification_devices の登録/参照を担う
 * なぜ: 送信 1 回分の監査レコードと対象端末の紐付けを永続化するため
 */
package com.example.push.repository;

import static com.example.common.JdbcTimestampUtils.getInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.push.model.NotificationRecord;
import java.sql.Array;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class NotificationRepository {

  private static final String SELECT_COLUMNS =
      """
      SELECT n.id, n.message, n.arguments_json, n.sent_at,
             ARRAY(
               SELECT nd.device_id
               FROM notification_devices nd
               WHERE nd.notification_id = n.id
               ORDER BY nd.device_id
             ) AS device_ids
      FROM notifications n
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public long insert(String message, String argumentsJson, Instant sentAt) {
    final String sql =
        """
        INSERT INTO notifications (message, arguments_json, sent_at)
        VALUES (:message, :argumentsJson, :sentAt)
        RETURNING id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("message", message)
            .addValue("argumentsJson", argumentsJson)
            .addValue("sentAt", toTimestamp(sentAt));
    final Long id = jdbcTemplate.queryForObject(sql, params, Long.class);
    if (id == null) {
      throw new IllegalStateException("notification insert returned no id");
    }
    return id;
  }

  public void linkDevices(long notificationId, Collection<Long> deviceIds) {
    if (deviceIds.isEmpty()) {
      return;
    }
    final String sql =
        """
        INSERT INTO notification_devices (notification_id, device_id)
        VALUES (:notificationId, :deviceId)
        """;
    final SqlParameterSource[] batch =
        deviceIds.stream()
            .map(
                deviceId ->
                    new MapSqlParameterSource()
                        .addValue("notificationId", notificationId)
                        .addValue("deviceId", deviceId))
            .toArray(SqlParameterSource[]::new);
    jdbcTemplate.batchUpdate(sql, batch);
  }

  public Optional<NotificationRecord> findById(long notificationId) {
    final String sql = SELECT_COLUMNS + "WHERE n.id = :notificationId";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("notificationId", notificationId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<NotificationRecord> findByDeviceId(long deviceId) {
    final String sql =
        SELECT_COLUMNS
            + """
            WHERE EXISTS (
              SELECT 1
              FROM notification_devices link
              WHERE link.notification_id = n.id
                AND link.device_id = :deviceId
            )
            ORDER BY n.sent_at DESC, n.id DESC
            """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("deviceId", deviceId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private NotificationRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new NotificationRecord(
        rs.getLong("id"),
        rs.getString("message"),
        rs.getString("arguments_json"),
        getInstant(rs, "sent_at"),
        toDeviceIds(rs.getArray("device_ids")));
  }

  private List<Long> toDeviceIds(Array array) throws SQLException {
    final List<Long> deviceIds = new ArrayList<>();
    if (array == null) {
      return deviceIds;
    }
    for (Object value : (Object[]) array.getArray()) {
      deviceIds.add(((Number) value).longValue());
    }
    return deviceIds;
  }
}
