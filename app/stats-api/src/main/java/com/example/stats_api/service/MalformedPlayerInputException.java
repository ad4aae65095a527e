/*
 * どこで: Stats API サービス層
 * 何を: handle/region/period/limit の入力不正を表現する
 * なぜ: クライアント起因の失敗を 400 へ正規化するため
 */
package com.example.stats_api.service;

public class MalformedPlayerInputException extends RuntimeException {
  public MalformedPlayerInputException(String message) {
    super(message);
  }
}
