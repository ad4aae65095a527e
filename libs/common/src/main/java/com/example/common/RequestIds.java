/*
 * どこで: Common 共通ユーティリティ
 * 何を: リクエスト ID の採番と受信値の検証を行う
 * なぜ: 外部から渡された ID をそのままログへ載せても構造化ログが崩れないようにするため
 */
package com.example.common;

import java.util.UUID;

public final class RequestIds {

  static final int MAX_LENGTH = 128;

  private RequestIds() {}

  public static String newRequestId() {
    return UUID.randomUUID().toString();
  }

  /**
   * 役割: 受信したリクエスト ID を採用するか、新しく採番するかを決める。
   * 動作: 前後空白を除いた値が英数字と {@code - _ . :} だけで構成され、長さが上限以内ならそのまま返す。
   * それ以外(null/空/長すぎる/制御文字や引用符を含む)は新しい ID を返す。
   */
  public static String acceptOrGenerate(String candidate) {
    if (candidate == null) {
      return newRequestId();
    }
    final String trimmed = candidate.trim();
    if (trimmed.isEmpty() || trimmed.length() > MAX_LENGTH || !isAllowed(trimmed)) {
      return newRequestId();
    }
    return trimmed;
  }

  private static boolean isAllowed(String value) {
    for (int i = 0; i < value.length(); i++) {
      final char c = value.charAt(i);
      final boolean alphanumeric =
          (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
      if (!alphanumeric && c != '-' && c != '_' && c != '.' && c != ':') {
        return false;
      }
    }
    return true;
  }
}
