/*
 * どこで: Stats API ドメインモデル
 * 何を: region コード(プラットフォーム別名を含む)からクラスタへの固定対応表を保持する
 * なぜ: どの region 入力でも必ず 1 つのクラスタへ解決できるようにするため
 */
package com.example.stats_api.model;

import java.util.Locale;
import java.util.Map;

public final class RegionClusters {

  /** 未知の region はこのクラスタで解決する。失敗にはしない。 */
  public static final Cluster DEFAULT_CLUSTER = Cluster.AMERICAS;

  private static final Map<String, Cluster> CLUSTER_BY_REGION =
      Map.ofEntries(
          Map.entry("na", Cluster.AMERICAS),
          Map.entry("na1", Cluster.AMERICAS),
          Map.entry("br", Cluster.AMERICAS),
          Map.entry("br1", Cluster.AMERICAS),
          Map.entry("lan", Cluster.AMERICAS),
          Map.entry("la1", Cluster.AMERICAS),
          Map.entry("las", Cluster.AMERICAS),
          Map.entry("la2", Cluster.AMERICAS),
          Map.entry("euw", Cluster.EUROPE),
          Map.entry("euw1", Cluster.EUROPE),
          Map.entry("eune", Cluster.EUROPE),
          Map.entry("eun1", Cluster.EUROPE),
          Map.entry("tr", Cluster.EUROPE),
          Map.entry("tr1", Cluster.EUROPE),
          Map.entry("ru", Cluster.EUROPE),
          Map.entry("kr", Cluster.ASIA),
          Map.entry("jp", Cluster.ASIA),
          Map.entry("jp1", Cluster.ASIA),
          Map.entry("oce", Cluster.SEA),
          Map.entry("oc1", Cluster.SEA),
          Map.entry("ph", Cluster.SEA),
          Map.entry("ph2", Cluster.SEA),
          Map.entry("sg", Cluster.SEA),
          Map.entry("sg2", Cluster.SEA),
          Map.entry("th", Cluster.SEA),
          Map.entry("th2", Cluster.SEA),
          Map.entry("tw", Cluster.SEA),
          Map.entry("tw2", Cluster.SEA),
          Map.entry("vn", Cluster.SEA),
          Map.entry("vn2", Cluster.SEA));

  private RegionClusters() {}

  /**
   * 役割: region コードを対応するクラスタへ変換する。
   * 動作: 大文字小文字を無視して表を引き、未登録または null の場合は {@link #DEFAULT_CLUSTER} を返す。
   */
  public static Cluster clusterFor(String region) {
    if (region == null) {
      return DEFAULT_CLUSTER;
    }
    return CLUSTER_BY_REGION.getOrDefault(region.trim().toLowerCase(Locale.ROOT), DEFAULT_CLUSTER);
  }

  public static boolean isKnown(String region) {
    return region != null && CLUSTER_BY_REGION.containsKey(region.trim().toLowerCase(Locale.ROOT));
  }
}
