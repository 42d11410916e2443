/*
 * Where: Push application configuration binding
 * What: Holds the expired APNs token prune schedule
 */
package com.example.push.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "push.expiry")
public record ExpiredTokenProperties(boolean enabled, Duration pruneInterval) {

  public ExpiredTokenProperties {
    pruneInterval = pruneInterval == null ? Duration.ofHours(6) : pruneInterval;
  }
}
