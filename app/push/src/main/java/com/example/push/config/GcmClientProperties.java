/*
 * どこで: Push アプリの設定バインド
 * 何を: GCM 送信エンドポイントと一括送信の上限を保持する
 */
package com.example.push.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "push.gcm")
public record GcmClientProperties(
    String baseUrl,
    String sendPath,
    String apiKey,
    int maxRecipients,
    Duration connectTimeout,
    Duration readTimeout) {

  public GcmClientProperties {
    baseUrl = baseUrl == null || baseUrl.isBlank() ? "https://fcm.googleapis.com" : baseUrl;
    sendPath = sendPath == null || sendPath.isBlank() ? "/fcm/send" : sendPath;
    // GCM の registration_ids は 1 リクエスト 1000 件まで
    maxRecipients = maxRecipients <= 0 ? 1000 : maxRecipients;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(5) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(10) : readTimeout;
  }
}
