/*
 * どこで: Stats API リポジトリ層
 * 何を: (識別子, 期間) をキーに計算済み統計ドキュメントを読み出す
 * なぜ: 書き込みは外部集計ジョブだけが行い、本サービスは読み取り専用で扱うため
 */
package com.example.stats_api.repository;

import com.example.stats_api.model.DispatchKey;
import com.example.stats_api.model.ResultDocument;

public interface ResultDocumentRepository {

  /**
   * 役割: キーに対応する統計ドキュメントを取得する。
   * 動作: オブジェクトが無い場合は ResultStoreException(NOT_FOUND)、解析できない場合は
   * ResultStoreException(DESERIALIZATION) を送出する。空ドキュメントへのフォールバックは行わない。
   */
  ResultDocument get(DispatchKey key);
}
