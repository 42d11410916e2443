/*
 * どこで: Push API
 * 何を: 送信結果(通知 ID とプロバイダ別の生応答)のレスポンス
 */
package com.example.push.api;

import com.example.push.model.DispatchResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PushMessageResponse(Long notificationId, Map<String, List<JsonNode>> responses) {

  public PushMessageResponse {
    responses =
        responses == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(responses));
  }

  static PushMessageResponse from(DispatchResult result) {
    final Map<String, List<JsonNode>> responses = new LinkedHashMap<>();
    result
        .responses()
        .forEach((provider, response) -> responses.put(provider.name(), response.replies()));
    return new PushMessageResponse(result.notificationId(), responses);
  }
}
