/*
 * どこで: Push ドメインモデル
 * 何を: 配信プロバイダ(APNs/GCM)の種別と永続化コードを表す列挙
 * なぜ: devices.device_type とグルーピングキーを一致させるため
 */
package com.example.push.model;

import java.util.Locale;
import java.util.Optional;

public enum PushProvider {
  APNS(0, "APNSDevice"),
  GCM(1, "GCMDevice");

  private final int code;
  private final String deviceTypeName;

  PushProvider(int code, String deviceTypeName) {
    this.code = code;
    this.deviceTypeName = deviceTypeName;
  }

  public int code() {
    return code;
  }

  public String deviceTypeName() {
    return deviceTypeName;
  }

  public static Optional<PushProvider> find(int code) {
    for (PushProvider provider : values()) {
      if (provider.code == code) {
        return Optional.of(provider);
      }
    }
    return Optional.empty();
  }

  public static PushProvider fromCode(int code) {
    return find(code).orElseThrow(() -> new UnknownProviderException(code));
  }

  public static PushProvider fromName(String name) {
    if (name == null || name.isBlank()) {
      throw new UnknownProviderException(name);
    }
    try {
      return valueOf(name.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new UnknownProviderException(name);
    }
  }
}
