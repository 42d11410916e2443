/*
 * どこで: Push ドメインモデル
 * 何を: 送信時のプロバイダ固有キーワード引数を保持する
 * なぜ: extra とそれ以外のオプションを分離し、監査用に原形のまま直列化するため
 */
package com.example.push.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record PushArguments(Map<String, Object> values) {

  public static final String EXTRA_KEY = "extra";

  private static final PushArguments NONE = new PushArguments(Map.of());

  public PushArguments {
    // null 値を含む引数もそのまま残すため LinkedHashMap でコピーする
    values = values == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }

  public static PushArguments none() {
    return NONE;
  }

  public static PushArguments of(Map<String, ?> values) {
    return values == null || values.isEmpty() ? NONE : new PushArguments(new LinkedHashMap<>(values));
  }

  /** extra 引数を可変コピーで返す。未指定なら空。 */
  public Map<String, Object> extra() {
    final Object extra = values.get(EXTRA_KEY);
    final Map<String, Object> copy = new LinkedHashMap<>();
    if (extra == null) {
      return copy;
    }
    if (!(extra instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException("extra must be a mapping");
    }
    raw.forEach((key, value) -> copy.put(String.valueOf(key), value));
    return copy;
  }

  /** extra を除いたオプション引数。 */
  public Map<String, Object> options() {
    final Map<String, Object> options = new LinkedHashMap<>(values);
    options.remove(EXTRA_KEY);
    return options;
  }

  public Object option(String key) {
    return EXTRA_KEY.equals(key) ? null : values.get(key);
  }
}
