/*
 * どこで: Timeclock ドメインモデル
 * 何を: 打刻に付随する写真の所有状態を定義する
 * なぜ: 写真付き打刻は写真の送信完了か利用不可の確定まで完了させないため
 */
package com.example.timeclock.model;

public enum PhotoState {
  NONE,
  PENDING,
  UPLOADED,
  UNAVAILABLE
}
