/*
 * どこで: Push サービス層
 * 何を: GCM 向けの送信差分(メッセージを data.message へ合成する)
 * なぜ: GCM のワイヤ形式にメッセージ専用フィールドが無いため
 */
package com.example.push.service;

import com.example.push.client.GcmClient;
import com.example.push.model.DeviceRecord;
import com.example.push.model.ProviderResponse;
import com.example.push.model.PushArguments;
import com.example.push.model.PushProvider;
import com.google.common.annotations.VisibleForTesting;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class GcmProviderStrategy implements ProviderStrategy {

  static final String MESSAGE_KEY = "message";

  private final GcmClient gcmClient;

  @Override
  public PushProvider provider() {
    return PushProvider.GCM;
  }

  @Override
  public ProviderResponse sendSingle(
      DeviceRecord device, String message, PushArguments arguments) {
    return gcmClient.sendSingle(
        device.registrationId(), buildData(message, arguments), arguments.options());
  }

  @Override
  public ProviderResponse sendBulk(
      List<String> registrationIds, String message, PushArguments arguments) {
    return gcmClient.sendBulk(registrationIds, buildData(message, arguments), arguments.options());
  }

  /** message は NotificationLog が null を弾いた後に届く。extra の同名キーは上書きする。 */
  @VisibleForTesting
  Map<String, Object> buildData(String message, PushArguments arguments) {
    final Map<String, Object> data = arguments.extra();
    data.put(MESSAGE_KEY, message);
    return data;
  }
}
