/*
 * どこで: Push プロバイダクライアント層
 * 何を: RestClient の例外を ProviderTransportException へ変換する
 * なぜ: APNs/GCM で同じ分類規則を使うため
 */
package com.example.push.client;

import com.example.push.model.PushProvider;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;

final class ProviderExceptionMapper {

  private static final Logger logger = LoggerFactory.getLogger(ProviderExceptionMapper.class);

  private ProviderExceptionMapper() {}

  static ProviderTransportException mapResponseException(
      PushProvider provider, String operation, RestClientResponseException ex) {
    final int status = ex.getStatusCode().value();
    logger.warn(
        "{} {} failed with http status={} body={}",
        provider,
        operation,
        status,
        ex.getResponseBodyAsString());
    if (status == 401 || status == 403) {
      return new ProviderTransportException(
          provider,
          ProviderTransportException.Reason.UNAUTHORIZED,
          provider + " rejected credentials",
          ex);
    }
    if (status == 413) {
      return new ProviderTransportException(
          provider,
          ProviderTransportException.Reason.PAYLOAD_TOO_LARGE,
          provider + " payload too large",
          ex);
    }
    if (ex.getStatusCode().is4xxClientError()) {
      return new ProviderTransportException(
          provider,
          ProviderTransportException.Reason.REJECTED,
          provider + " rejected request status=" + status,
          ex);
    }
    return new ProviderTransportException(
        provider,
        ProviderTransportException.Reason.BAD_GATEWAY,
        provider + " server error status=" + status,
        ex);
  }

  static ProviderTransportException mapResourceException(
      PushProvider provider, String operation, ResourceAccessException ex) {
    if (isTimeout(ex)) {
      logger.warn("{} {} timed out", provider, operation);
      return new ProviderTransportException(
          provider, ProviderTransportException.Reason.TIMEOUT, provider + " request timeout", ex);
    }
    logger.warn("{} {} connection failed", provider, operation, ex);
    return new ProviderTransportException(
        provider,
        ProviderTransportException.Reason.BAD_GATEWAY,
        provider + " connection failed",
        ex);
  }

  private static boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException || current instanceof HttpTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}
