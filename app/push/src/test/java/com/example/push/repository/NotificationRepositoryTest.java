/*
 * どこで: notifications リポジトリの DB テスト
 * 何を: 通知と端末の紐付け、端末ごとの履歴順序を検証する
 */
package com.example.push.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.push.AbstractPostgresContainerTest;
import com.example.push.model.DeviceRecord;
import com.example.push.model.DeviceRegistration;
import com.example.push.model.NotificationRecord;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class NotificationRepositoryTest extends AbstractPostgresContainerTest {

  private static final Instant FIRST = Instant.parse("2026-01-17T00:00:00Z");
  private static final Instant SECOND = Instant.parse("2026-01-17T01:00:00Z");

  @Autowired private NotificationRepository notificationRepository;
  @Autowired private DeviceRepository deviceRepository;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM notification_devices", new MapSqlParameterSource());
    jdbcTemplate.update("DELETE FROM notifications", new MapSqlParameterSource());
    jdbcTemplate.update("DELETE FROM devices", new MapSqlParameterSource());
  }

  @Test
  void insertLinksDevicesAndFindByIdReturnsThem() {
    final DeviceRecord a = device("tok-a");
    final DeviceRecord b = device("tok-b");

    final long id = notificationRepository.insert("hi", "{\"badge\":1}", FIRST);
    notificationRepository.linkDevices(id, List.of(a.id(), b.id()));

    final NotificationRecord record = notificationRepository.findById(id).orElseThrow();
    assertThat(record.message()).isEqualTo("hi");
    assertThat(record.argumentsJson()).isEqualTo("{\"badge\":1}");
    assertThat(record.sentAt()).isEqualTo(FIRST);
    assertThat(record.deviceIds()).containsExactly(a.id(), b.id());
  }

  @Test
  void notificationWithoutDevicesHasEmptyLinkList() {
    final long id = notificationRepository.insert("hi", "{}", FIRST);
    notificationRepository.linkDevices(id, List.of());

    assertThat(notificationRepository.findById(id).orElseThrow().deviceIds()).isEmpty();
  }

  @Test
  void historyIsNewestFirstAndScopedToDevice() {
    final DeviceRecord a = device("tok-a");
    final DeviceRecord b = device("tok-b");
    final long older = notificationRepository.insert("first", "{}", FIRST);
    notificationRepository.linkDevices(older, List.of(a.id()));
    final long newer = notificationRepository.insert("second", "{}", SECOND);
    notificationRepository.linkDevices(newer, List.of(a.id(), b.id()));

    assertThat(notificationRepository.findByDeviceId(a.id()))
        .extracting(NotificationRecord::notificationId)
        .containsExactly(newer, older);
    assertThat(notificationRepository.findByDeviceId(b.id()))
        .extracting(NotificationRecord::notificationId)
        .containsExactly(newer);
    assertThat(notificationCount()).isEqualTo(2);
  }

  private long notificationCount() {
    return jdbcTemplate.queryForObject(
        "SELECT COUNT(*) FROM notifications", new MapSqlParameterSource(), Long.class);
  }

  private DeviceRecord device(String token) {
    return deviceRepository.insert(DeviceRegistration.apns(token, null, "u_1"), "account.user", FIRST);
  }
}
