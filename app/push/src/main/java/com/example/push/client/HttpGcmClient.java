/*
 * どこで: Push プロバイダクライアント層
 * 何を: GCM HTTP エンドポイントへの送信を担当するクライアント
 * なぜ: registration_ids の上限ごとに分割し、応答をまとめて返すため
 */
package com.example.push.client;

import com.example.push.config.GcmClientProperties;
import com.example.push.model.ProviderResponse;
import com.example.push.model.PushProvider;
import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.Lists;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Service
public class HttpGcmClient implements GcmClient {

  private final RestClient gcmRestClient;
  private final GcmClientProperties properties;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public HttpGcmClient(RestClient gcmRestClient, GcmClientProperties properties) {
    this.gcmRestClient = gcmRestClient;
    this.properties = properties;
  }

  @Override
  public ProviderResponse sendSingle(
      String registrationId, Map<String, Object> data, Map<String, Object> options) {
    if (registrationId == null || registrationId.isBlank()) {
      throw new IllegalArgumentException("registration_id is required");
    }
    final Map<String, Object> body = new LinkedHashMap<>(options);
    body.put("to", registrationId);
    body.put("data", data);
    final JsonNode reply = post(body, "sendSingle");
    // 単一送信は results[0].error をそのまま失敗として扱う
    if (reply.path("failure").asInt(0) > 0) {
      final String error = reply.path("results").path(0).path("error").asText("unknown");
      throw new ProviderTransportException(
          PushProvider.GCM,
          ProviderTransportException.Reason.REJECTED,
          "gcm rejected message error=" + error);
    }
    return new ProviderResponse(PushProvider.GCM, List.of(reply));
  }

  @Override
  public ProviderResponse sendBulk(
      List<String> registrationIds, Map<String, Object> data, Map<String, Object> options) {
    if (registrationIds.isEmpty()) {
      return ProviderResponse.empty(PushProvider.GCM);
    }
    final List<JsonNode> replies = new ArrayList<>();
    for (List<String> chunk : Lists.partition(registrationIds, properties.maxRecipients())) {
      final Map<String, Object> body = new LinkedHashMap<>(options);
      body.put("registration_ids", chunk);
      body.put("data", data);
      replies.add(post(body, "sendBulk"));
    }
    return new ProviderResponse(PushProvider.GCM, replies);
  }

  private JsonNode post(Map<String, Object> body, String operation) {
    try {
      final JsonNode reply =
          gcmRestClient
              .post()
              .uri(properties.sendPath())
              .contentType(MediaType.APPLICATION_JSON)
              .header(HttpHeaders.AUTHORIZATION, "key=" + properties.apiKey())
              .body(body)
              .retrieve()
              .body(JsonNode.class);
      if (reply == null || !reply.isObject()) {
        throw new ProviderTransportException(
            PushProvider.GCM,
            ProviderTransportException.Reason.INVALID_RESPONSE,
            "gcm response is invalid");
      }
      return reply;
    } catch (RestClientResponseException ex) {
      throw ProviderExceptionMapper.mapResponseException(PushProvider.GCM, operation, ex);
    } catch (ResourceAccessException ex) {
      throw ProviderExceptionMapper.mapResourceException(PushProvider.GCM, operation, ex);
    } catch (ProviderTransportException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      throw new ProviderTransportException(
          PushProvider.GCM,
          ProviderTransportException.Reason.INVALID_RESPONSE,
          "gcm response parse failed",
          ex);
    }
  }
}
