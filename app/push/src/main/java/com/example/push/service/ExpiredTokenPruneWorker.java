/*
 * Where: Push maintenance worker
 * What: Triggers expired APNs token pruning on a schedule
 */
package com.example.push.service;

import com.example.push.client.ProviderTransportException;
import com.example.push.config.ExpiredTokenProperties;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "push.expiry.enabled", havingValue = "true")
public class ExpiredTokenPruneWorker {

  private static final Logger logger = LoggerFactory.getLogger(ExpiredTokenPruneWorker.class);

  private final ExpiredTokenPruneService pruneService;
  private final ExpiredTokenProperties properties;

  @Scheduled(fixedDelayString = "${push.expiry.prune-interval}")
  public void run() {
    try {
      final int deactivated = pruneService.prune(null);
      logger.debug(
          "expired token prune finished deactivated={} nextRunIn={}",
          deactivated,
          properties.pruneInterval());
    } catch (ProviderTransportException ex) {
      // 次回の周期で再取得する
      logger.warn(
          "expired token prune skipped reason={} retryIn={}",
          ex.reason(),
          properties.pruneInterval(),
          ex);
    }
  }
}
