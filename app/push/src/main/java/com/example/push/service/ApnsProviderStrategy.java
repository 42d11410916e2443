/*
 * どこで: Push サービス層
 * 何を: APNs 向けの送信差分(メッセージを alert として渡す)
 */
package com.example.push.service;

import com.example.push.client.ApnsClient;
import com.example.push.model.DeviceRecord;
import com.example.push.model.ProviderResponse;
import com.example.push.model.PushArguments;
import com.example.push.model.PushProvider;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ApnsProviderStrategy implements ProviderStrategy {

  private final ApnsClient apnsClient;

  @Override
  public PushProvider provider() {
    return PushProvider.APNS;
  }

  @Override
  public ProviderResponse sendSingle(
      DeviceRecord device, String message, PushArguments arguments) {
    return apnsClient.sendSingle(device.registrationId(), message, arguments);
  }

  @Override
  public ProviderResponse sendBulk(
      List<String> registrationIds, String message, PushArguments arguments) {
    return apnsClient.sendBulk(registrationIds, message, arguments);
  }
}
