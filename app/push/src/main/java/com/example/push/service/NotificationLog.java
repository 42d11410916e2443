/*
 * どこで: Push サービス層
 * 何を: 送信 1 回につき 1 件の通知レコードを作成し履歴を参照する
 * なぜ: 配信結果に依存しない監査履歴を送信前に確定させるため
 */
package com.example.push.service;

import com.example.push.model.DeviceRecord;
import com.example.push.model.NotificationRecord;
import com.example.push.model.PushArguments;
import com.example.push.repository.NotificationRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class NotificationLog {

  private static final Logger logger = LoggerFactory.getLogger(NotificationLog.class);

  private final NotificationRepository notificationRepository;
  private final ObjectMapper objectMapper;
  private final PushMetrics metrics;
  private final Clock clock;

  @Transactional
  public NotificationRecord record(
      Collection<DeviceRecord> devices, String message, PushArguments arguments) {
    if (message == null) {
      throw new IllegalArgumentException("message is required");
    }
    final String argumentsJson = serializeArguments(arguments);
    final Instant sentAt = Instant.now(clock);
    // 同一端末が重複して渡されても紐付けは 1 件にする
    final Set<Long> deviceIds = new LinkedHashSet<>();
    devices.forEach(device -> deviceIds.add(device.id()));
    final long notificationId = notificationRepository.insert(message, argumentsJson, sentAt);
    notificationRepository.linkDevices(notificationId, deviceIds);
    metrics.recordNotificationRecorded();
    logger.info("notification recorded id={} devices={}", notificationId, deviceIds.size());
    return new NotificationRecord(
        notificationId, message, argumentsJson, sentAt, new ArrayList<>(deviceIds));
  }

  public Optional<NotificationRecord> findById(long notificationId) {
    return notificationRepository.findById(notificationId);
  }

  public List<NotificationRecord> historyFor(long deviceId) {
    return notificationRepository.findByDeviceId(deviceId);
  }

  private String serializeArguments(PushArguments arguments) {
    try {
      return objectMapper.writeValueAsString(arguments.values());
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("push arguments are not serializable", ex);
    }
  }
}
