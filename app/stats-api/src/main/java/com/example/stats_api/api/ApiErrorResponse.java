/*
 * どこで: Stats API
 * 何を: エラー応答の標準フォーマットを定義する
 * なぜ: 失敗した段階と原因を同じ形で返すため
 */
package com.example.stats_api.api;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiErrorResponse(String code, String message, String stage) {

  public ApiErrorResponse(String code, String message) {
    this(code, message, null);
  }
}
