/*
 * どこで: Stats API ドメインモデル
 * 何を: 外部集計ジョブが生成した統計ドキュメントを不変値として保持する
 * なぜ: リクエスト中に保持するコピーが呼び出し側から書き換えられないようにするため
 */
package com.example.stats_api.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record ResultDocument(Map<String, Object> content) {

  public ResultDocument {
    if (content == null) {
      throw new IllegalArgumentException("content is required");
    }
    content = freezeMap(content);
  }

  public Object get(String name) {
    return content.get(name);
  }

  // Map.copyOf は null 値とキー順序を扱えないため、LinkedHashMap で順序を保って凍結する。
  private static Map<String, Object> freezeMap(Map<?, ?> source) {
    final Map<String, Object> copy = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : source.entrySet()) {
      copy.put(String.valueOf(entry.getKey()), freeze(entry.getValue()));
    }
    return Collections.unmodifiableMap(copy);
  }

  private static Object freeze(Object value) {
    if (value instanceof Map<?, ?> map) {
      return freezeMap(map);
    }
    if (value instanceof List<?> list) {
      final List<Object> copy = new ArrayList<>(list.size());
      for (Object element : list) {
        copy.add(freeze(element));
      }
      return Collections.unmodifiableList(copy);
    }
    return value;
  }
}
