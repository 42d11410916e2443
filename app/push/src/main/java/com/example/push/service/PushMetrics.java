/*
 * どこで: Push サービス層
 * 何を: 送信経路別の件数/通知記録数/失効無効化数のアプリ固有メトリクスを記録する
 * なぜ: プロバイダ別の送信状況を Prometheus から直接観測できるようにするため
 */
package com.example.push.service;

import com.example.push.model.PushProvider;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class PushMetrics {

  private static final String METRIC_DISPATCH_TOTAL = "push.dispatch.total";
  private static final String METRIC_NOTIFICATION_RECORDED_TOTAL =
      "push.notification.recorded.total";
  private static final String METRIC_EXPIRY_DEACTIVATED_TOTAL = "push.expiry.deactivated.total";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> dispatchCounters = new ConcurrentHashMap<>();
  private final Counter notificationRecordedCounter;
  private final Counter expiryDeactivatedCounter;

  public PushMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.notificationRecordedCounter =
        Counter.builder(METRIC_NOTIFICATION_RECORDED_TOTAL)
            .description("Total number of notification audit records")
            .register(meterRegistry);
    this.expiryDeactivatedCounter =
        Counter.builder(METRIC_EXPIRY_DEACTIVATED_TOTAL)
            .description("Total number of devices deactivated by expired token pruning")
            .register(meterRegistry);
  }

  /** path は single/bulk、result は success/failure。 */
  public void recordDispatch(PushProvider provider, String path, String result) {
    final String key = provider.name() + ":" + path + ":" + result;
    dispatchCounters
        .computeIfAbsent(
            key,
            ignored ->
                Counter.builder(METRIC_DISPATCH_TOTAL)
                    .description("Push dispatch outcomes per provider")
                    .tags(Tags.of("provider", provider.name(), "path", path, "result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordNotificationRecorded() {
    notificationRecordedCounter.increment();
  }

  public void recordExpiredDeactivated(int count) {
    if (count > 0) {
      expiryDeactivatedCounter.increment(count);
    }
  }
}
