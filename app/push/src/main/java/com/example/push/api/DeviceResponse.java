/*
 * どこで: Push API
 * 何を: 登録済み端末のレスポンス
 */
package com.example.push.api;

import com.example.push.model.DeviceRecord;
import com.example.push.model.PushProvider;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DeviceResponse(
    long id,
    String name,
    String displayName,
    boolean active,
    String ownerId,
    Instant createdAt,
    String deviceId,
    String registrationId,
    String provider) {

  static DeviceResponse from(DeviceRecord device) {
    return new DeviceResponse(
        device.id(),
        device.name(),
        device.displayName(),
        device.active(),
        device.ownerId(),
        device.createdAt(),
        device.deviceId(),
        device.registrationId(),
        PushProvider.find(device.providerCode()).map(Enum::name).orElse(null));
  }
}
