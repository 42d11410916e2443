/*
 * どこで: Push ドメインモデル
 * 何を: 既知のどのプロバイダにも該当しない device_type を示す例外
 * なぜ: 記録やネットワーク送信の前に解決失敗として打ち切るため
 */
package com.example.push.model;

public class UnknownProviderException extends RuntimeException {

  private final String providerTag;

  public UnknownProviderException(int providerCode) {
    this(String.valueOf(providerCode));
  }

  public UnknownProviderException(String providerTag) {
    super("unknown push provider: " + providerTag);
    this.providerTag = providerTag;
  }

  public String providerTag() {
    return providerTag;
  }
}
