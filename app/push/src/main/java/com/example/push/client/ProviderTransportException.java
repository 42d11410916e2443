/*
 * どこで: Push プロバイダクライアント層
 * 何を: プロバイダ呼び出し失敗(通信/認証/ペイロード不正)を表現する
 * なぜ: API 層で HTTP ステータスへ一貫変換するため
 */
package com.example.push.client;

import com.example.push.model.PushProvider;

public class ProviderTransportException extends RuntimeException {

  public enum Reason {
    TIMEOUT,
    UNAUTHORIZED,
    REJECTED,
    PAYLOAD_TOO_LARGE,
    BAD_GATEWAY,
    INVALID_RESPONSE,
    FEEDBACK_UNAVAILABLE
  }

  private final PushProvider provider;
  private final Reason reason;

  public ProviderTransportException(PushProvider provider, Reason reason, String message) {
    super(message);
    this.provider = provider;
    this.reason = reason;
  }

  public ProviderTransportException(
      PushProvider provider, Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.provider = provider;
    this.reason = reason;
  }

  public PushProvider provider() {
    return provider;
  }

  public Reason reason() {
    return reason;
  }
}
