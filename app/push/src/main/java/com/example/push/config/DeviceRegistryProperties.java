/*
 * どこで: Push アプリの設定バインド
 * 何を: 端末の所有者が参照するユーザーモデル名を保持する
 * なぜ: 所有者モデルを定数ではなく登録簿の構築時に注入するため
 */
package com.example.push.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "push.registry")
public record DeviceRegistryProperties(String ownerModel) {

  public DeviceRegistryProperties {
    ownerModel = ownerModel == null || ownerModel.isBlank() ? "account.user" : ownerModel;
  }
}
