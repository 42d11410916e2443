/*
 * どこで: Push API モデル
 * 何を: 所有者ごとの登録端末一覧のレスポンス
 */
package com.example.push.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DeviceListResponse(String ownerId, List<DeviceResponse> devices) {
  public DeviceListResponse {
    devices = devices == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(devices));
  }
}
