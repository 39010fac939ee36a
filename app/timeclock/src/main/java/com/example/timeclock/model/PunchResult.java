/*
 * どこで: Timeclock ドメインモデル
 * 何を: リモート打刻送信が受理されたときの応答を表す
 * なぜ: ライブ打刻後にキオスクへ表示する内容を運ぶため
 */
package com.example.timeclock.model;

import java.math.BigDecimal;

public record PunchResult(
    String firstName, String lastName, PunchDirection direction, BigDecimal weeklyHours) {}
