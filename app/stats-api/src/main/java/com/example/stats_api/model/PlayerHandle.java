/*
 * どこで: Stats API ドメインモデル
 * 何を: 入力された "Name#Tag" と region を表現する
 * なぜ: 区切り文字や空文字の検証を 1 か所へ集約するため
 */
package com.example.stats_api.model;

import com.example.stats_api.service.MalformedPlayerInputException;
import java.util.Locale;

public record PlayerHandle(String gameName, String tag, String region) {

  public static final char SEPARATOR = '#';

  public PlayerHandle {
    if (gameName == null || gameName.isBlank()) {
      throw new MalformedPlayerInputException("handle game name must not be empty");
    }
    if (tag == null || tag.isBlank()) {
      throw new MalformedPlayerInputException("handle tag must not be empty");
    }
    if (region == null || region.isBlank()) {
      throw new MalformedPlayerInputException("region is required");
    }
    region = region.trim().toLowerCase(Locale.ROOT);
  }

  /**
   * 役割: "GameName#TAG" 形式の文字列を分解する。
   * 動作: 区切り文字がちょうど 1 つでない場合、または片側が空の場合は MalformedPlayerInputException を送出する。
   */
  public static PlayerHandle parse(String handle, String region) {
    if (handle == null || handle.isBlank()) {
      throw new MalformedPlayerInputException("handle is required");
    }
    final int separatorIndex = handle.indexOf(SEPARATOR);
    if (separatorIndex < 0 || separatorIndex != handle.lastIndexOf(SEPARATOR)) {
      throw new MalformedPlayerInputException(
          "handle must contain exactly one '" + SEPARATOR + "' (GameName#TAG)");
    }
    return new PlayerHandle(
        handle.substring(0, separatorIndex).trim(),
        handle.substring(separatorIndex + 1).trim(),
        region);
  }

  public Cluster cluster() {
    return RegionClusters.clusterFor(region);
  }

  public String asHandleString() {
    return gameName + SEPARATOR + tag;
  }
}
