/*
 * どこで: Push ドメインモデル
 * 何を: (id, device_type) の射影
 * なぜ: 混在コレクションを 1 クエリでプロバイダ別に振り分けるため
 */
package com.example.push.model;

public record DeviceProviderRef(long deviceId, int providerCode) {

  public PushProvider provider() {
    return PushProvider.fromCode(providerCode);
  }
}
