/*
 * どこで: Push API モデル
 * 何を: 端末ごとの送信履歴のレスポンス
 */
package com.example.push.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationHistoryResponse(long deviceId, List<NotificationSummary> notifications) {
  public NotificationHistoryResponse {
    // SpotBugs の EI_EXPOSE_REP 対応: 受け取ったリストを防御的コピーして不変化する
    notifications =
        notifications == null
            ? List.of()
            : Collections.unmodifiableList(new ArrayList<>(notifications));
  }
}
