/*
 * どこで: Push API
 * 何を: 端末登録と端末ごとの送信履歴のエンドポイントを提供する
 * なぜ: 登録フローと監査履歴の確認を HTTP から行えるようにするため
 */
package com.example.push.api;

import com.example.push.model.DeviceRecord;
import com.example.push.model.DeviceRegistration;
import com.example.push.model.NotificationRecord;
import com.example.push.model.PushProvider;
import com.example.push.service.DeviceNotFoundException;
import com.example.push.service.DeviceRegistry;
import com.example.push.service.NotificationLog;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Valid;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/devices")
@RequiredArgsConstructor
public class DeviceController {

  private final DeviceRegistry deviceRegistry;
  private final NotificationLog notificationLog;
  private final ObjectMapper objectMapper;

  @PostMapping
  public ResponseEntity<DeviceResponse> register(
      @Valid @RequestBody DeviceRegistrationRequest request) {
    final DeviceRegistration registration =
        new DeviceRegistration(
            PushProvider.fromName(request.provider()),
            request.registrationId(),
            request.name(),
            request.deviceId(),
            request.ownerId(),
            request.active() == null || request.active());
    final DeviceRecord device = deviceRegistry.register(registration);
    return ResponseEntity.status(HttpStatus.CREATED).body(DeviceResponse.from(device));
  }

  @GetMapping
  public DeviceListResponse devicesOf(
      @RequestParam(name = "owner_id", required = false) String ownerId) {
    if (ownerId == null || ownerId.isBlank()) {
      throw new IllegalArgumentException("owner_id is required");
    }
    final List<DeviceResponse> devices =
        deviceRegistry.findByOwner(ownerId).stream().map(DeviceResponse::from).toList();
    return new DeviceListResponse(ownerId, devices);
  }

  @GetMapping("/{device_id}/notifications")
  public NotificationHistoryResponse notifications(@PathVariable("device_id") long deviceId) {
    final DeviceRecord device =
        deviceRegistry
            .findById(deviceId)
            .orElseThrow(() -> new DeviceNotFoundException(List.of(deviceId)));
    final List<NotificationRecord> history = notificationLog.historyFor(deviceId);
    final Map<Long, String> firstNames = firstDeviceNames(history, device);
    final List<NotificationSummary> items =
        history.stream().map(record -> toSummary(record, firstNames, device)).toList();
    return new NotificationHistoryResponse(deviceId, items);
  }

  // 要約の先頭端末は履歴ごとに異なりうるため、まとめて 1 回で引く
  private Map<Long, String> firstDeviceNames(
      List<NotificationRecord> history, DeviceRecord requested) {
    final Set<Long> otherIds = new LinkedHashSet<>();
    for (NotificationRecord record : history) {
      if (!record.deviceIds().isEmpty() && record.deviceIds().get(0) != requested.id()) {
        otherIds.add(record.deviceIds().get(0));
      }
    }
    final Map<Long, String> names = new HashMap<>();
    names.put(requested.id(), requested.displayName());
    if (!otherIds.isEmpty()) {
      deviceRegistry
          .findAllById(otherIds)
          .forEach(other -> names.put(other.id(), other.displayName()));
    }
    return names;
  }

  private NotificationSummary toSummary(
      NotificationRecord record, Map<Long, String> firstNames, DeviceRecord requested) {
    final long firstId = record.deviceIds().isEmpty() ? requested.id() : record.deviceIds().get(0);
    return new NotificationSummary(
        record.notificationId(),
        record.summary(firstNames.get(firstId)),
        record.message(),
        parseArguments(record),
        record.sentAt(),
        record.deviceIds());
  }

  private JsonNode parseArguments(NotificationRecord record) {
    try {
      return objectMapper.readTree(record.argumentsJson());
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("notification arguments parse failure", ex);
    }
  }
}
