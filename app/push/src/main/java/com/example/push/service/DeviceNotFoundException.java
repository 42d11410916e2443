/*
 * どこで: Push サービス層
 * 何を: 指定された端末 ID が登録簿に存在しないことを示す例外
 */
package com.example.push.service;

import java.util.Collection;
import java.util.List;

public class DeviceNotFoundException extends RuntimeException {

  private final List<Long> missingIds;

  public DeviceNotFoundException(Collection<Long> missingIds) {
    super("device not found: " + missingIds);
    this.missingIds = List.copyOf(missingIds);
  }

  public List<Long> missingIds() {
    return missingIds;
  }
}
