package com.example.stats_api.model;

import com.example.stats_api.service.MalformedPlayerInputException;

/** 集計対象の暦年。4 桁の数字文字列のみ受け付ける。 */
public record Period(String value) {

  public Period {
    if (value == null || !isFourDigits(value)) {
      throw new MalformedPlayerInputException("period must be a 4-digit year");
    }
  }

  public static Period parse(String value) {
    if (value == null || value.isBlank()) {
      throw new MalformedPlayerInputException("period is required");
    }
    return new Period(value.trim());
  }

  private static boolean isFourDigits(String value) {
    if (value.length() != 4) {
      return false;
    }
    for (int i = 0; i < value.length(); i++) {
      final char c = value.charAt(i);
      if (c < '0' || c > '9') {
        return false;
      }
    }
    return true;
  }

  @Override
  public String toString() {
    return value;
  }
}
