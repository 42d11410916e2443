/*
 * どこで: Push API
 * 何を: 送信リクエストの入力を保持する
 * なぜ: 端末 ID 一覧とキーワード引数を JSON からバインドするため
 */
package com.example.push.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PushMessageRequest(
    @NotNull(message = "device_ids is required") List<Long> deviceIds,
    @NotNull(message = "message is required") String message,
    Map<String, Object> arguments) {}
