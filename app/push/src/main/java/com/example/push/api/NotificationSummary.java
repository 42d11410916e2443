/*
 * どこで: Push API モデル
 * 何を: 送信履歴の要素
 * なぜ: 送信内容と対象端末を確認できるようにするため
 */
package com.example.push.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationSummary(
    long notificationId,
    String summary,
    String message,
    JsonNode arguments,
    Instant sentAt,
    List<Long> deviceIds) {

  public NotificationSummary {
    deviceIds =
        deviceIds == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(deviceIds));
  }
}
