/*
 * どこで: Timeclock サービス層
 * 何を: 勤怠サービスへ再び到達できそうなことを通知する
 * なぜ: 次のポーリングを待たずにオフラインキューを排出するため
 */
package com.example.timeclock.service;

import java.time.Instant;

public record ConnectivityRestoredEvent(String source, Instant occurredAt) {}
