/*
 * どこで: Timeclock サービス層
 * 何を: 打刻試行ごとの結果を受け取る
 * なぜ: 打刻ワーカーを待たずにキオスク表示へ結果を描画するため
 */
package com.example.timeclock.service;

import com.example.timeclock.model.PunchOutcome;

public interface PunchResultListener {

  void onPunchResult(PunchOutcome outcome);
}
