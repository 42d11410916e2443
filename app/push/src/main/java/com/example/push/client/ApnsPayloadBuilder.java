/*
 * どこで: Push プロバイダクライアント層
 * 何を: APNs 通知の JSON ペイロードとリクエストヘッダ値を組み立てる
 * なぜ: alert と aps 予約キー、extra のカスタムキーを一箇所で配置するため
 */
package com.example.push.client;

import com.example.push.model.PushArguments;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Map;

final class ApnsPayloadBuilder {

  static final String OPTION_BADGE = "badge";
  static final String OPTION_SOUND = "sound";
  static final String OPTION_CATEGORY = "category";
  static final String OPTION_CONTENT_AVAILABLE = "content_available";
  static final String OPTION_EXPIRATION = "expiration";
  static final String OPTION_PRIORITY = "priority";

  private final ObjectMapper objectMapper;

  ApnsPayloadBuilder(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  ObjectNode build(String alert, PushArguments arguments) {
    final ObjectNode root = objectMapper.createObjectNode();
    final ObjectNode aps = root.putObject("aps");
    if (alert != null) {
      aps.put("alert", alert);
    }
    final Map<String, Object> options = arguments.options();
    if (options.get(OPTION_BADGE) != null) {
      aps.set("badge", objectMapper.valueToTree(options.get(OPTION_BADGE)));
    }
    if (options.get(OPTION_SOUND) != null) {
      aps.put("sound", String.valueOf(options.get(OPTION_SOUND)));
    }
    if (options.get(OPTION_CATEGORY) != null) {
      aps.put("category", String.valueOf(options.get(OPTION_CATEGORY)));
    }
    if (Boolean.TRUE.equals(options.get(OPTION_CONTENT_AVAILABLE))) {
      aps.put("content-available", 1);
    }
    // extra はトップレベルのカスタムキー。aps は上書きさせない
    arguments
        .extra()
        .forEach(
            (key, value) -> {
              if (!"aps".equals(key)) {
                root.set(key, objectMapper.valueToTree(value));
              }
            });
    return root;
  }

  String expirationHeader(PushArguments arguments) {
    final Object expiration = arguments.option(OPTION_EXPIRATION);
    return expiration == null ? null : String.valueOf(expiration);
  }

  String priorityHeader(PushArguments arguments) {
    final Object priority = arguments.option(OPTION_PRIORITY);
    return priority == null ? null : String.valueOf(priority);
  }
}
