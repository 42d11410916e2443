/*
 * どこで: Push アプリのインフラ設定
 * 何を: APNs/GCM 呼び出し専用の RestClient を提供する
 * なぜ: プロバイダごとに baseUrl とタイムアウトの設定責務を分離するため
 */
package com.example.push.config;

import java.net.http.HttpClient;
import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class ProviderClientConfig {

  @Bean
  RestClient apnsRestClient(RestClient.Builder builder, ApnsClientProperties properties) {
    // APNs の provider API は HTTP/2 のみ受け付ける
    return builder
        .clone()
        .baseUrl(properties.baseUrl())
        .requestFactory(
            requestFactory(
                HttpClient.Version.HTTP_2, properties.connectTimeout(), properties.readTimeout()))
        .build();
  }

  @Bean
  RestClient gcmRestClient(RestClient.Builder builder, GcmClientProperties properties) {
    return builder
        .clone()
        .baseUrl(properties.baseUrl())
        .requestFactory(
            requestFactory(
                HttpClient.Version.HTTP_1_1, properties.connectTimeout(), properties.readTimeout()))
        .build();
  }

  private JdkClientHttpRequestFactory requestFactory(
      HttpClient.Version version, Duration connectTimeout, Duration readTimeout) {
    final HttpClient httpClient =
        HttpClient.newBuilder().version(version).connectTimeout(connectTimeout).build();
    final JdkClientHttpRequestFactory factory = new JdkClientHttpRequestFactory(httpClient);
    factory.setReadTimeout(readTimeout);
    return factory;
  }
}
