/*
 * どこで: Push プロバイダクライアント層
 * 何を: GCM への送信の抽象化インターフェース
 */
package com.example.push.client;

import com.example.push.model.ProviderResponse;
import java.util.List;
import java.util.Map;

public interface GcmClient {

  ProviderResponse sendSingle(
      String registrationId, Map<String, Object> data, Map<String, Object> options);

  ProviderResponse sendBulk(
      List<String> registrationIds, Map<String, Object> data, Map<String, Object> options);
}
