/*
 * どこで: Push ドメインモデル
 * 何を: 一括送信 1 回分の通知記録 ID とプロバイダ別応答
 * なぜ: 空コレクション送信を「記録なし・応答なし」として表現するため
 */
package com.example.push.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record DispatchResult(Long notificationId, Map<PushProvider, ProviderResponse> responses) {

  private static final DispatchResult EMPTY = new DispatchResult(null, Map.of());

  public DispatchResult {
    responses =
        responses == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(responses));
  }

  public static DispatchResult empty() {
    return EMPTY;
  }

  public boolean isEmpty() {
    return notificationId == null && responses.isEmpty();
  }
}
