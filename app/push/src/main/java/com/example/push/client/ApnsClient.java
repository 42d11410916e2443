/*
 * どこで: Push プロバイダクライアント層
 * 何を: APNs への送信と失効トークン取得の抽象化インターフェース
 * なぜ: 実送信/テスト差し替えを容易にするため
 */
package com.example.push.client;

import com.example.push.model.ProviderResponse;
import com.example.push.model.PushArguments;
import java.util.List;
import java.util.Set;

public interface ApnsClient {

  ProviderResponse sendSingle(String registrationId, String alert, PushArguments arguments);

  ProviderResponse sendBulk(List<String> registrationIds, String alert, PushArguments arguments);

  /**
   * フィードバックサービスから失効済みトークンを取得する。
   *
   * @param credentialFile PKCS#12 のクライアント証明書。null なら設定値を使う
   * @return 16 進小文字のトークン集合
   */
  Set<String> fetchInactiveIds(String credentialFile);
}
