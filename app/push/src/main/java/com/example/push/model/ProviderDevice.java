/*
 * どこで: Push ドメインモデル
 * 何を: プロバイダが確定した単一端末の参照
 * なぜ: 汎用参照の再解決を省いて送信経路へ直接渡すため
 */
package com.example.push.model;

import java.util.Objects;

public record ProviderDevice(PushProvider provider, DeviceRecord device) {

  public ProviderDevice {
    Objects.requireNonNull(provider, "provider");
    Objects.requireNonNull(device, "device");
    if (device.providerCode() != provider.code()) {
      throw new IllegalArgumentException(
          "device " + device.id() + " is not registered under " + provider);
    }
  }

  /** 保存済みの device_type から型付き参照を作る。 */
  public static ProviderDevice resolve(DeviceRecord device) {
    return new ProviderDevice(device.provider(), device);
  }
}
