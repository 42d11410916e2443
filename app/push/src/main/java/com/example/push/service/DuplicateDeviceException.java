/*
 * どこで: Push サービス層
 * 何を: 外部端末 ID(device_id)が既に登録済みであることを示す例外
 */
package com.example.push.service;

public class DuplicateDeviceException extends RuntimeException {

  private final String deviceId;

  public DuplicateDeviceException(String deviceId, Throwable cause) {
    super("device already registered: " + deviceId, cause);
    this.deviceId = deviceId;
  }

  public String deviceId() {
    return deviceId;
  }
}
