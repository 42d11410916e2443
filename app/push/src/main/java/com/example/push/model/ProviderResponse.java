/*
 * どこで: Push ドメインモデル
 * 何を: プロバイダからの生の応答を保持する
 * なぜ: 端末ごとの成否解析を呼び出し側に委ねるため
 */
package com.example.push.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

public record ProviderResponse(PushProvider provider, List<JsonNode> replies) {

  public ProviderResponse {
    Objects.requireNonNull(provider, "provider");
    replies = replies == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(replies));
  }

  public static ProviderResponse empty(PushProvider provider) {
    return new ProviderResponse(provider, List.of());
  }
}
