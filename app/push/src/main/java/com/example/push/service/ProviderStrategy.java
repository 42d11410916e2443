/*
 * どこで: Push サービス層
 * 何を: プロバイダ固有の単一/一括送信とペイロード組み立ての差分を表す
 * なぜ: 振り分けアルゴリズムをプロバイダごとに重複させないため
 */
package com.example.push.service;

import com.example.push.model.DeviceRecord;
import com.example.push.model.ProviderResponse;
import com.example.push.model.PushArguments;
import com.example.push.model.PushProvider;
import java.util.List;

public interface ProviderStrategy {

  PushProvider provider();

  ProviderResponse sendSingle(DeviceRecord device, String message, PushArguments arguments);

  ProviderResponse sendBulk(List<String> registrationIds, String message, PushArguments arguments);
}
