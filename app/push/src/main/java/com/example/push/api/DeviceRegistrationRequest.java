/*
 * どこで: Push API
 * 何を: 端末登録リクエストの入力を保持する
 */
package com.example.push.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DeviceRegistrationRequest(
    @NotBlank(message = "provider is required") String provider,
    @NotBlank(message = "registration_id is required") String registrationId,
    @Size(max = 255, message = "name must be at most 255 characters") String name,
    @Size(max = 255, message = "device_id must be at most 255 characters") String deviceId,
    @Size(max = 64, message = "owner_id must be at most 64 characters") String ownerId,
    Boolean active) {}
