/*
 * どこで: Push サービス層
 * 何を: 単一端末/端末コレクションをプロバイダ別の送信経路へ振り分ける
 * なぜ: 対象数に関係なく送信 1 回につき通知レコードを 1 件だけ作るため
 */
package com.example.push.service;

import com.example.push.client.ApnsClient;
import com.example.push.model.DeviceRecord;
import com.example.push.model.DispatchResult;
import com.example.push.model.NotificationRecord;
import com.example.push.model.ProviderDevice;
import com.example.push.model.ProviderDevices;
import com.example.push.model.ProviderResponse;
import com.example.push.model.PushArguments;
import com.example.push.model.PushProvider;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class PushDispatchService {

  private static final Logger logger = LoggerFactory.getLogger(PushDispatchService.class);
  private static final String PATH_SINGLE = "single";
  private static final String PATH_BULK = "bulk";
  private static final String RESULT_SUCCESS = "success";
  private static final String RESULT_FAILURE = "failure";

  private final Map<PushProvider, ProviderStrategy> strategies;
  private final DeviceRegistry deviceRegistry;
  private final NotificationLog notificationLog;
  private final ApnsClient apnsClient;
  private final PushMetrics metrics;

  public PushDispatchService(
      List<ProviderStrategy> strategies,
      DeviceRegistry deviceRegistry,
      NotificationLog notificationLog,
      ApnsClient apnsClient,
      PushMetrics metrics) {
    final Map<PushProvider, ProviderStrategy> byProvider = new EnumMap<>(PushProvider.class);
    for (ProviderStrategy strategy : strategies) {
      if (byProvider.put(strategy.provider(), strategy) != null) {
        throw new IllegalStateException("duplicate strategy for provider " + strategy.provider());
      }
    }
    for (PushProvider provider : PushProvider.values()) {
      if (!byProvider.containsKey(provider)) {
        throw new IllegalStateException("no strategy for provider " + provider);
      }
    }
    this.strategies = byProvider;
    this.deviceRegistry = deviceRegistry;
    this.notificationLog = notificationLog;
    this.apnsClient = apnsClient;
    this.metrics = metrics;
  }

  /**
   * プロバイダ未確定の端末へ送る。保存済みの device_type を解決してから、元の端末で記録し単一送信する。
   *
   * @throws com.example.push.model.UnknownProviderException device_type が未知の場合(記録・送信なし)
   */
  public ProviderResponse sendMessage(DeviceRecord device, String message, PushArguments arguments) {
    final ProviderDevice resolved = ProviderDevice.resolve(device);
    return sendSingle(resolved, device, message, arguments);
  }

  public ProviderResponse sendMessage(
      ProviderDevice device, String message, PushArguments arguments) {
    return sendSingle(device, device.device(), message, arguments);
  }

  /**
   * プロバイダ混在の端末コレクションへ送る。
   *
   * <p>(id, device_type) を 1 クエリで引いてバケット化し、全端末を 1 件の通知レコードに記録した後、
   * バケットごとにプロバイダ別ビューを引き直して一括送信する。空なら何もしない。
   */
  public DispatchResult sendMessage(
      Collection<DeviceRecord> devices, String message, PushArguments arguments) {
    if (devices.isEmpty()) {
      return DispatchResult.empty();
    }
    final List<Long> ids = devices.stream().map(DeviceRecord::id).toList();
    final Map<PushProvider, List<Long>> buckets = deviceRegistry.groupByProvider(ids);
    final NotificationRecord record = notificationLog.record(devices, message, arguments);
    final Map<PushProvider, ProviderResponse> responses = new LinkedHashMap<>();
    for (Map.Entry<PushProvider, List<Long>> bucket : buckets.entrySet()) {
      final ProviderDevices scoped = deviceRegistry.byProvider(bucket.getKey(), bucket.getValue());
      responses.put(bucket.getKey(), deliverBulk(scoped, message, arguments));
    }
    logger.info(
        "push dispatched notificationId={} devices={} providers={}",
        record.notificationId(),
        devices.size(),
        responses.keySet());
    return new DispatchResult(record.notificationId(), responses);
  }

  /** プロバイダ別ビューへ送る。非アクティブ端末は送信対象外だが記録には含める。 */
  public DispatchResult sendMessage(
      ProviderDevices devices, String message, PushArguments arguments) {
    if (devices.isEmpty()) {
      return DispatchResult.empty();
    }
    final NotificationRecord record = notificationLog.record(devices.devices(), message, arguments);
    final ProviderResponse response = deliverBulk(devices, message, arguments);
    final Map<PushProvider, ProviderResponse> responses = new LinkedHashMap<>();
    responses.put(devices.provider(), response);
    return new DispatchResult(record.notificationId(), responses);
  }

  /** APNs が失効と報告したトークン。GCM には同等の問い合わせが無い。 */
  public Set<String> getExpiredTokens(String credentialFile) {
    return apnsClient.fetchInactiveIds(credentialFile);
  }

  private ProviderResponse sendSingle(
      ProviderDevice resolved, DeviceRecord recordedAs, String message, PushArguments arguments) {
    final ProviderStrategy strategy = strategies.get(resolved.provider());
    final NotificationRecord record = notificationLog.record(List.of(recordedAs), message, arguments);
    try {
      final ProviderResponse response = strategy.sendSingle(resolved.device(), message, arguments);
      metrics.recordDispatch(resolved.provider(), PATH_SINGLE, RESULT_SUCCESS);
      return response;
    } catch (RuntimeException ex) {
      // 送信失敗でも記録は残す
      metrics.recordDispatch(resolved.provider(), PATH_SINGLE, RESULT_FAILURE);
      logger.warn(
          "push single send failed notificationId={} provider={} deviceId={}",
          record.notificationId(),
          resolved.provider(),
          recordedAs.id(),
          ex);
      throw ex;
    }
  }

  private ProviderResponse deliverBulk(
      ProviderDevices devices, String message, PushArguments arguments) {
    final ProviderStrategy strategy = strategies.get(devices.provider());
    final List<String> registrationIds = new ArrayList<>(devices.activeRegistrationIds());
    try {
      final ProviderResponse response = strategy.sendBulk(registrationIds, message, arguments);
      metrics.recordDispatch(devices.provider(), PATH_BULK, RESULT_SUCCESS);
      return response;
    } catch (RuntimeException ex) {
      metrics.recordDispatch(devices.provider(), PATH_BULK, RESULT_FAILURE);
      logger.warn(
          "push bulk send failed provider={} targets={}",
          devices.provider(),
          registrationIds.size(),
          ex);
      throw ex;
    }
  }
}
