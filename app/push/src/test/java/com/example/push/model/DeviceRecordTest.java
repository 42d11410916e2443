/*
 * どこで: Push ドメインモデルのユニットテスト
 * 何を: device_type の解決、表示名、型付き参照の整合チェックを検証する
 */
package com.example.push.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class DeviceRecordTest {

  private static final Instant CREATED_AT = Instant.parse("2026-01-17T00:00:00Z");
  private static final int UNKNOWN_CODE = 7;

  @Test
  void providerResolvesStoredCode() {
    assertThat(device(1L, null, null, "u_1", PushProvider.APNS.code()).provider())
        .isEqualTo(PushProvider.APNS);
    assertThat(device(2L, null, null, "u_1", PushProvider.GCM.code()).provider())
        .isEqualTo(PushProvider.GCM);
  }

  @Test
  void unknownCodeFailsResolution() {
    final DeviceRecord device = device(1L, null, null, null, UNKNOWN_CODE);

    assertThatThrownBy(device::provider)
        .isInstanceOf(UnknownProviderException.class)
        .extracting(ex -> ((UnknownProviderException) ex).providerTag())
        .isEqualTo("7");
    assertThatThrownBy(() -> ProviderDevice.resolve(device))
        .isInstanceOf(UnknownProviderException.class);
  }

  @Test
  void displayNamePrefersNameThenDeviceIdThenOwner() {
    assertThat(device(1L, "Phone", "dev-1", "u_1", 0).displayName()).isEqualTo("Phone");
    assertThat(device(1L, null, "dev-1", "u_1", 0).displayName()).isEqualTo("dev-1");
    assertThat(device(1L, null, null, "u_1", 0).displayName()).isEqualTo("APNSDevice for u_1");
    assertThat(device(1L, "", null, null, 1).displayName())
        .isEqualTo("GCMDevice for unknown user");
  }

  @Test
  void providerFromNameIsCaseInsensitive() {
    assertThat(PushProvider.fromName("gcm")).isEqualTo(PushProvider.GCM);
    assertThatThrownBy(() -> PushProvider.fromName("wns"))
        .isInstanceOf(UnknownProviderException.class);
    assertThatThrownBy(() -> PushProvider.fromName(" "))
        .isInstanceOf(UnknownProviderException.class);
  }

  @Test
  void providerDeviceRejectsMismatchedProvider() {
    final DeviceRecord gcmDevice = device(5L, null, null, null, PushProvider.GCM.code());

    assertThatThrownBy(() -> new ProviderDevice(PushProvider.APNS, gcmDevice))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new ProviderDevices(PushProvider.APNS, List.of(gcmDevice)))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void activeRegistrationIdsSkipsInactiveDevices() {
    final DeviceRecord active = device(1L, null, null, null, 0);
    final DeviceRecord inactive =
        new DeviceRecord(2L, null, false, null, CREATED_AT, null, "token-2", 0);

    final ProviderDevices devices = new ProviderDevices(PushProvider.APNS, List.of(active, inactive));

    assertThat(devices.activeRegistrationIds()).containsExactly("token-1");
    assertThat(devices.devices()).hasSize(2);
  }

  @Test
  void notificationSummaryMentionsOtherDevices() {
    final NotificationRecord single = new NotificationRecord(1L, "hi", "{}", CREATED_AT, List.of(1L));
    final NotificationRecord multiple =
        new NotificationRecord(2L, "hi", "{}", CREATED_AT, List.of(1L, 2L, 3L));

    assertThat(single.summary("Phone")).isEqualTo("Phone: hi");
    assertThat(multiple.summary("Phone")).isEqualTo("Phone and 2 other: hi");
  }

  private DeviceRecord device(long id, String name, String deviceId, String ownerId, int code) {
    return new DeviceRecord(id, name, true, ownerId, CREATED_AT, deviceId, "token-" + id, code);
  }
}
