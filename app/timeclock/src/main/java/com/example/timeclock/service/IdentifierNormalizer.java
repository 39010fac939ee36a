/*
 * どこで: Timeclock サービス層
 * 何を: 読み取った従業員 ID から写真の対応付け用 ID を導出する
 * なぜ: バーコードには 2 文字の拠点接頭辞が付くが、写真ファイル名には含めないため
 */
package com.example.timeclock.service;

import java.util.Objects;

public final class IdentifierNormalizer {

  private static final int PREFIX_LENGTH = 2;

  private IdentifierNormalizer() {}

  /**
   * 先頭 2 文字の英字接頭辞を取り除く。接頭辞がなければ入力をそのまま返す。
   *
   * <p>{@code "TE00700" -> "00700"}, {@code "12345" -> "12345"}, {@code "A" -> "A"}.
   */
  public static String normalize(String rawEmployeeId) {
    Objects.requireNonNull(rawEmployeeId, "rawEmployeeId");
    if (rawEmployeeId.length() < PREFIX_LENGTH) {
      return rawEmployeeId;
    }
    if (isAsciiLetter(rawEmployeeId.charAt(0)) && isAsciiLetter(rawEmployeeId.charAt(1))) {
      return rawEmployeeId.substring(PREFIX_LENGTH);
    }
    return rawEmployeeId;
  }

  private static boolean isAsciiLetter(char c) {
    return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z');
  }
}
