/*
 * どこで: Push ドメインモデル
 * 何を: 端末登録の入力を保持する
 * なぜ: device_type を登録時の具象プロバイダから一度だけ決めるため
 */
package com.example.push.model;

import java.util.Objects;

public record DeviceRegistration(
    PushProvider provider,
    String registrationId,
    String name,
    String deviceId,
    String ownerId,
    boolean active) {

  public DeviceRegistration {
    Objects.requireNonNull(provider, "provider");
    if (registrationId == null || registrationId.isBlank()) {
      throw new IllegalArgumentException("registration_id is required");
    }
  }

  public static DeviceRegistration apns(String registrationId, String name, String ownerId) {
    return new DeviceRegistration(PushProvider.APNS, registrationId, name, null, ownerId, true);
  }

  public static DeviceRegistration gcm(String registrationId, String name, String ownerId) {
    return new DeviceRegistration(PushProvider.GCM, registrationId, name, null, ownerId, true);
  }

  public DeviceRegistration withDeviceId(String externalDeviceId) {
    return new DeviceRegistration(provider, registrationId, name, externalDeviceId, ownerId, active);
  }

  public DeviceRegistration inactive() {
    return new DeviceRegistration(provider, registrationId, name, deviceId, ownerId, false);
  }
}
