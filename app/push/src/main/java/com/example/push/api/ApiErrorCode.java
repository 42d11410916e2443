/*
 * どこで: Push API
 * 何を: エラー応答のコードを定義する
 * なぜ: 同じ HTTP ステータスでも原因を区別できるようにするため
 */
package com.example.push.api;

public enum ApiErrorCode {
  BAD_REQUEST,
  DEVICE_NOT_FOUND,
  DUPLICATE_DEVICE,
  UNKNOWN_PROVIDER,
  PROVIDER_TIMEOUT,
  PROVIDER_UNAUTHORIZED,
  PROVIDER_REJECTED,
  PROVIDER_PAYLOAD_TOO_LARGE,
  PROVIDER_BAD_GATEWAY,
  PROVIDER_INVALID_RESPONSE,
  PROVIDER_FEEDBACK_UNAVAILABLE
}
