/*
 * どこで: Push プロバイダクライアント層
 * 何を: APNs provider API(HTTP/2) への送信を担当するクライアント
 * なぜ: 単一/一括送信とフィードバック取得を 1 つの窓口にまとめるため
 */
package com.example.push.client;

import com.example.push.config.ApnsClientProperties;
import com.example.push.model.ProviderResponse;
import com.example.push.model.PushArguments;
import com.example.push.model.PushProvider;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Service
public class HttpApnsClient implements ApnsClient {

  private static final Logger logger = LoggerFactory.getLogger(HttpApnsClient.class);
  private static final String HEADER_TOPIC = "apns-topic";
  private static final String HEADER_EXPIRATION = "apns-expiration";
  private static final String HEADER_PRIORITY = "apns-priority";
  private static final String HEADER_APNS_ID = "apns-id";
  private static final int STATUS_BAD_REQUEST = 400;
  private static final int STATUS_UNREGISTERED = 410;

  private final RestClient apnsRestClient;
  private final ApnsClientProperties properties;
  private final ApnsFeedbackReader feedbackReader;
  private final ObjectMapper objectMapper;
  private final ApnsPayloadBuilder payloadBuilder;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient/ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public HttpApnsClient(
      RestClient apnsRestClient,
      ApnsClientProperties properties,
      ApnsFeedbackReader feedbackReader,
      ObjectMapper objectMapper) {
    this.apnsRestClient = apnsRestClient;
    this.properties = properties;
    this.feedbackReader = feedbackReader;
    this.objectMapper = objectMapper;
    this.payloadBuilder = new ApnsPayloadBuilder(objectMapper);
  }

  @Override
  public ProviderResponse sendSingle(
      String registrationId, String alert, PushArguments arguments) {
    validateToken(registrationId);
    final byte[] payload = encodePayload(alert, arguments);
    try {
      return new ProviderResponse(
          PushProvider.APNS, List.of(post(registrationId, payload, arguments)));
    } catch (RestClientResponseException ex) {
      throw ProviderExceptionMapper.mapResponseException(PushProvider.APNS, "sendSingle", ex);
    } catch (ResourceAccessException ex) {
      throw ProviderExceptionMapper.mapResourceException(PushProvider.APNS, "sendSingle", ex);
    }
  }

  @Override
  public ProviderResponse sendBulk(
      List<String> registrationIds, String alert, PushArguments arguments) {
    if (registrationIds.isEmpty()) {
      return ProviderResponse.empty(PushProvider.APNS);
    }
    registrationIds.forEach(this::validateToken);
    // HTTP/2 の provider API に一括エンドポイントは無いため、同一接続上でトークンごとに送る
    final byte[] payload = encodePayload(alert, arguments);
    final List<JsonNode> replies = new ArrayList<>(registrationIds.size());
    for (String registrationId : registrationIds) {
      try {
        replies.add(post(registrationId, payload, arguments));
      } catch (RestClientResponseException ex) {
        if (!isTokenRejection(ex)) {
          throw ProviderExceptionMapper.mapResponseException(PushProvider.APNS, "sendBulk", ex);
        }
        replies.add(rejectedReply(registrationId, ex));
      } catch (ResourceAccessException ex) {
        throw ProviderExceptionMapper.mapResourceException(PushProvider.APNS, "sendBulk", ex);
      }
    }
    return new ProviderResponse(PushProvider.APNS, replies);
  }

  @Override
  public Set<String> fetchInactiveIds(String credentialFile) {
    return feedbackReader.fetch(credentialFile);
  }

  private JsonNode post(String registrationId, byte[] payload, PushArguments arguments) {
    final ResponseEntity<Void> entity =
        apnsRestClient
            .post()
            .uri(properties.devicePath(), registrationId)
            .contentType(MediaType.APPLICATION_JSON)
            .headers(headers -> applyHeaders(headers, arguments))
            .body(payload)
            .retrieve()
            .toBodilessEntity();
    final ObjectNode reply = objectMapper.createObjectNode();
    reply.put("registration_id", registrationId);
    reply.put("status", entity.getStatusCode().value());
    final String apnsId = entity.getHeaders().getFirst(HEADER_APNS_ID);
    if (apnsId != null) {
      reply.put("apns_id", apnsId);
    }
    return reply;
  }

  private void applyHeaders(HttpHeaders headers, PushArguments arguments) {
    if (hasText(properties.topic())) {
      headers.set(HEADER_TOPIC, properties.topic());
    }
    if (hasText(properties.authToken())) {
      headers.set(HttpHeaders.AUTHORIZATION, "bearer " + properties.authToken());
    }
    final String expiration = payloadBuilder.expirationHeader(arguments);
    if (expiration != null) {
      headers.set(HEADER_EXPIRATION, expiration);
    }
    final String priority = payloadBuilder.priorityHeader(arguments);
    if (priority != null) {
      headers.set(HEADER_PRIORITY, priority);
    }
  }

  private byte[] encodePayload(String alert, PushArguments arguments) {
    final byte[] payload;
    try {
      payload = objectMapper.writeValueAsBytes(payloadBuilder.build(alert, arguments));
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("apns payload serialization failure", ex);
    }
    if (payload.length > properties.maxPayloadBytes()) {
      throw new ProviderTransportException(
          PushProvider.APNS,
          ProviderTransportException.Reason.PAYLOAD_TOO_LARGE,
          "apns payload exceeds " + properties.maxPayloadBytes() + " bytes");
    }
    return payload;
  }

  private boolean isTokenRejection(RestClientResponseException ex) {
    final int status = ex.getStatusCode().value();
    return status == STATUS_BAD_REQUEST || status == STATUS_UNREGISTERED;
  }

  private JsonNode rejectedReply(String registrationId, RestClientResponseException ex) {
    final ObjectNode reply = objectMapper.createObjectNode();
    reply.put("registration_id", registrationId);
    reply.put("status", ex.getStatusCode().value());
    reply.put("reason", resolveReason(ex.getResponseBodyAsString()));
    logger.warn(
        "apns rejected token status={} reason={}",
        ex.getStatusCode().value(),
        reply.get("reason").asText());
    return reply;
  }

  private String resolveReason(String body) {
    if (!hasText(body)) {
      return "unknown";
    }
    try {
      return objectMapper.readTree(body).path("reason").asText("unknown");
    } catch (JsonProcessingException ex) {
      return "unknown";
    }
  }

  private void validateToken(String registrationId) {
    if (!hasText(registrationId)) {
      throw new IllegalArgumentException("registration_id is required");
    }
  }

  private boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
