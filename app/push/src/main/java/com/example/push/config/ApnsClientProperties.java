/*
 * どこで: Push アプリの設定バインド
 * 何を: APNs 送信とフィードバック取得の接続設定を保持する
 * なぜ: 本番/サンドボックスの切り替えや証明書の配置を外部化するため
 */
package com.example.push.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "push.apns")
public record ApnsClientProperties(
    String baseUrl,
    String devicePath,
    String topic,
    String authToken,
    String feedbackHost,
    int feedbackPort,
    String credentialFile,
    String credentialPassword,
    int maxPayloadBytes,
    Duration connectTimeout,
    Duration readTimeout) {

  public ApnsClientProperties {
    baseUrl = isBlank(baseUrl) ? "https://api.push.apple.com" : baseUrl;
    devicePath = isBlank(devicePath) ? "/3/device/{token}" : devicePath;
    feedbackHost = isBlank(feedbackHost) ? "feedback.push.apple.com" : feedbackHost;
    feedbackPort = feedbackPort <= 0 ? 2196 : feedbackPort;
    maxPayloadBytes = maxPayloadBytes <= 0 ? 4096 : maxPayloadBytes;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(5) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(10) : readTimeout;
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
