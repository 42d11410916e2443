/*
 * どこで: Push ドメインモデル
 * 何を: devices テーブルのスナップショット
 * なぜ: プロバイダ非依存の端末情報として登録簿と配信処理で共有するため
 */
package com.example.push.model;

import java.time.Instant;

public record DeviceRecord(
    long id,
    String name,
    boolean active,
    String ownerId,
    Instant createdAt,
    String deviceId,
    String registrationId,
    int providerCode) {

  /** 保存済みの device_type を列挙へ解決する。未知のコードは {@link UnknownProviderException}。 */
  public PushProvider provider() {
    return PushProvider.fromCode(providerCode);
  }

  public String displayName() {
    if (name != null && !name.isEmpty()) {
      return name;
    }
    if (deviceId != null && !deviceId.isEmpty()) {
      return deviceId;
    }
    final String typeName =
        PushProvider.find(providerCode).map(PushProvider::deviceTypeName).orElse("Device");
    return typeName + " for " + (ownerId == null ? "unknown user" : ownerId);
  }
}
