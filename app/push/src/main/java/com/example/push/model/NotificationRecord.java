/*
 * どこで: Push ドメインモデル
 * 何を: notifications テーブルと紐づく端末 ID のスナップショット
 * なぜ: 送信履歴 API と監査で共通化するため
 */
package com.example.push.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public record NotificationRecord(
    long notificationId,
    String message,
    String argumentsJson,
    Instant sentAt,
    List<Long> deviceIds) {

  public NotificationRecord {
    deviceIds =
        deviceIds == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(deviceIds));
  }

  /** 先頭端末の表示名と残り件数で 1 行の要約を作る。 */
  public String summary(String firstDeviceName) {
    final String others =
        deviceIds.size() > 1 ? " and " + (deviceIds.size() - 1) + " other" : "";
    return firstDeviceName + others + ": " + message;
  }
}
