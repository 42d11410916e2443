/*
 * どこで: Push ドメインモデル
 * 何を: 単一プロバイダに絞り込まれた端末コレクション
 * なぜ: 一括送信経路がプロバイダ混在を前提にしなくて済むようにするため
 */
package com.example.push.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

public record ProviderDevices(PushProvider provider, List<DeviceRecord> devices) {

  public ProviderDevices {
    Objects.requireNonNull(provider, "provider");
    devices = devices == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(devices));
    for (DeviceRecord device : devices) {
      if (device.providerCode() != provider.code()) {
        throw new IllegalArgumentException(
            "device " + device.id() + " is not registered under " + provider);
      }
    }
  }

  public boolean isEmpty() {
    return devices.isEmpty();
  }

  public List<String> activeRegistrationIds() {
    return devices.stream()
        .filter(DeviceRecord::active)
        .map(DeviceRecord::registrationId)
        .toList();
  }
}
