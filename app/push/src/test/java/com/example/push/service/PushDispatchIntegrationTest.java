/*
 * どこで: Push 振り分けの結合テスト
 * 何を: 実 DB 上で混在コレクション送信の記録内容とプロバイダ呼び出しを検証する
 * なぜ: 非アクティブ端末を含む送信でも監査レコードが 1 件だけ残ることを保証するため
 */
package com.example.push.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.push.AbstractPostgresContainerTest;
import com.example.push.client.ApnsClient;
import com.example.push.client.GcmClient;
import com.example.push.client.ProviderTransportException;
import com.example.push.model.DeviceRecord;
import com.example.push.model.DeviceRegistration;
import com.example.push.model.DispatchResult;
import com.example.push.model.NotificationRecord;
import com.example.push.model.ProviderResponse;
import com.example.push.model.PushArguments;
import com.example.push.model.PushProvider;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

@SpringBootTest
@ActiveProfiles("test")
class PushDispatchIntegrationTest extends AbstractPostgresContainerTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-01-17T00:00:00Z");

  @TestConfiguration
  static class FixedClockConfig {
    @Bean(name = "testClock")
    @Primary
    Clock clock() {
      return Clock.fixed(FIXED_NOW, ZoneOffset.UTC);
    }
  }

  @MockitoBean private ApnsClient apnsClient;
  @MockitoBean private GcmClient gcmClient;

  @Autowired private PushDispatchService dispatchService;
  @Autowired private DeviceRegistry deviceRegistry;
  @Autowired private NotificationLog notificationLog;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM notification_devices", new MapSqlParameterSource());
    jdbcTemplate.update("DELETE FROM notifications", new MapSqlParameterSource());
    jdbcTemplate.update("DELETE FROM devices", new MapSqlParameterSource());
  }

  @Test
  void mixedCollectionLeavesSingleRecordCoveringInactiveDevice() {
    final DeviceRecord a = deviceRegistry.register(DeviceRegistration.apns("tok-a", "A", "u_1"));
    final DeviceRecord b = deviceRegistry.register(DeviceRegistration.gcm("reg-b", "B", "u_1"));
    final DeviceRecord c =
        deviceRegistry.register(DeviceRegistration.apns("tok-c", "C", "u_1").inactive());
    when(apnsClient.sendBulk(anyList(), any(), any()))
        .thenReturn(ProviderResponse.empty(PushProvider.APNS));
    when(gcmClient.sendBulk(anyList(), any(), any()))
        .thenReturn(ProviderResponse.empty(PushProvider.GCM));

    final DispatchResult result =
        dispatchService.sendMessage(
            deviceRegistry.findAllById(List.of(a.id(), b.id(), c.id())),
            "hi",
            PushArguments.none());

    final NotificationRecord record =
        notificationLog.findById(result.notificationId()).orElseThrow();
    assertThat(countNotifications()).isEqualTo(1);
    assertThat(record.message()).isEqualTo("hi");
    assertThat(record.argumentsJson()).isEqualTo("{}");
    assertThat(record.sentAt()).isEqualTo(FIXED_NOW);
    assertThat(record.deviceIds()).containsExactlyInAnyOrder(a.id(), b.id(), c.id());
    verify(apnsClient).sendBulk(eq(List.of("tok-a")), eq("hi"), any());
    verify(gcmClient).sendBulk(List.of("reg-b"), Map.of("message", "hi"), Map.of());
  }

  @Test
  void providerFailureKeepsCommittedRecord() {
    final DeviceRecord a = deviceRegistry.register(DeviceRegistration.apns("tok-a", null, null));
    when(apnsClient.sendSingle(eq("tok-a"), eq("hi"), any()))
        .thenThrow(
            new ProviderTransportException(
                PushProvider.APNS, ProviderTransportException.Reason.BAD_GATEWAY, "down"));

    assertThatThrownBy(() -> dispatchService.sendMessage(a, "hi", PushArguments.none()))
        .isInstanceOf(ProviderTransportException.class);

    assertThat(countNotifications()).isEqualTo(1);
    assertThat(notificationLog.historyFor(a.id())).hasSize(1);
  }

  @Test
  void typedProviderViewRecordsAllDevicesOfProvider() {
    final DeviceRecord first = deviceRegistry.register(DeviceRegistration.gcm("reg-1", null, null));
    final DeviceRecord second =
        deviceRegistry.register(DeviceRegistration.gcm("reg-2", null, null).inactive());
    deviceRegistry.register(DeviceRegistration.apns("tok-1", null, null));
    when(gcmClient.sendBulk(anyList(), any(), any()))
        .thenReturn(ProviderResponse.empty(PushProvider.GCM));

    final DispatchResult result =
        dispatchService.sendMessage(
            deviceRegistry.byProvider(PushProvider.GCM), "hi", PushArguments.none());

    assertThat(notificationLog.findById(result.notificationId()).orElseThrow().deviceIds())
        .containsExactly(first.id(), second.id());
    verify(gcmClient).sendBulk(List.of("reg-1"), Map.of("message", "hi"), Map.of());
  }

  private int countNotifications() {
    final Integer count =
        jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM notifications", new MapSqlParameterSource(), Integer.class);
    return count == null ? 0 : count;
  }
}
