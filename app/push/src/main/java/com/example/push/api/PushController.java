/*
 * どこで: Push API
 * 何を: 端末 ID 一覧への送信と APNs 失効トークン参照のエンドポイントを提供する
 */
package com.example.push.api;

import com.example.push.model.DeviceRecord;
import com.example.push.model.DispatchResult;
import com.example.push.model.PushArguments;
import com.example.push.service.DeviceRegistry;
import com.example.push.service.PushDispatchService;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/push")
@RequiredArgsConstructor
public class PushController {

  private final PushDispatchService dispatchService;
  private final DeviceRegistry deviceRegistry;

  @PostMapping("/messages")
  public PushMessageResponse send(@Valid @RequestBody PushMessageRequest request) {
    final List<DeviceRecord> devices = deviceRegistry.findAllById(request.deviceIds());
    final DispatchResult result =
        dispatchService.sendMessage(
            devices, request.message(), PushArguments.of(request.arguments()));
    return PushMessageResponse.from(result);
  }

  @GetMapping("/expired-tokens")
  public ExpiredTokensResponse expiredTokens() {
    // 証明書パスはリクエストから受け取らず設定値のみを使う
    return new ExpiredTokensResponse(dispatchService.getExpiredTokens(null));
  }
}
