/*
 * Where: Push service layer
 * What: Deactivates APNs devices whose tokens the feedback service reports as expired
 * Why: Keep dead registration ids out of subsequent bulk sends
 */
package com.example.push.service;

import com.example.push.model.PushProvider;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ExpiredTokenPruneService {

  private static final Logger logger = LoggerFactory.getLogger(ExpiredTokenPruneService.class);

  private final PushDispatchService dispatchService;
  private final DeviceRegistry deviceRegistry;
  private final PushMetrics metrics;

  public int prune(String credentialFile) {
    final Set<String> expired = dispatchService.getExpiredTokens(credentialFile);
    if (expired.isEmpty()) {
      logger.info("expired token prune found nothing to deactivate");
      return 0;
    }
    final int deactivated = deviceRegistry.deactivate(PushProvider.APNS, expired);
    metrics.recordExpiredDeactivated(deactivated);
    logger.info(
        "expired token prune deactivated devices={} reportedTokens={}",
        deactivated,
        expired.size());
    return deactivated;
  }
}
