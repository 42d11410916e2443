/*
 * どこで: Push API
 * 何を: APNs の失効トークン一覧のレスポンス
 */
package com.example.push.api;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

public record ExpiredTokensResponse(Set<String> tokens) {

  public ExpiredTokensResponse {
    tokens = tokens == null ? Set.of() : Collections.unmodifiableSet(new TreeSet<>(tokens));
  }
}
