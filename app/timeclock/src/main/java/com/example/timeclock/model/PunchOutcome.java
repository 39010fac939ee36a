/*
 * どこで: Timeclock ドメインモデル
 * 何を: 1 回の打刻試行について UI へ伝える結果を表す
 * なぜ: オンライン成功とオフライン成功を拒否と区別できるようにするため
 */
package com.example.timeclock.model;

import java.math.BigDecimal;
import java.util.UUID;

public record PunchOutcome(
    UUID punchId,
    Kind kind,
    PunchStatus status,
    String message,
    String firstName,
    String lastName,
    PunchDirection direction,
    BigDecimal weeklyHours,
    Integer exceptionCode) {

  public enum Kind {
    ONLINE_SUCCESS,
    OFFLINE_SUCCESS,
    REJECTED,
    INVALID,
    STORAGE_FAILURE
  }

  public boolean acknowledged() {
    return kind == Kind.ONLINE_SUCCESS || kind == Kind.OFFLINE_SUCCESS;
  }

  public boolean offline() {
    return kind == Kind.OFFLINE_SUCCESS;
  }

  public static PunchOutcome online(UUID punchId, PunchResult result) {
    final String greeting = result.direction() == PunchDirection.CHECK_OUT ? "Goodbye" : "Welcome";
    final String name = result.firstName() == null ? "" : " " + result.firstName();
    return new PunchOutcome(
        punchId,
        Kind.ONLINE_SUCCESS,
        PunchStatus.SYNCED,
        greeting + name + "!",
        result.firstName(),
        result.lastName(),
        result.direction(),
        result.weeklyHours(),
        null);
  }

  public static PunchOutcome offline(UUID punchId) {
    return new PunchOutcome(
        punchId,
        Kind.OFFLINE_SUCCESS,
        PunchStatus.OFFLINE_QUEUED,
        "Punch saved offline",
        null,
        null,
        PunchDirection.UNKNOWN,
        null,
        null);
  }

  public static PunchOutcome rejected(UUID punchId, String message, Integer exceptionCode) {
    return new PunchOutcome(
        punchId,
        Kind.REJECTED,
        PunchStatus.REJECTED,
        message,
        null,
        null,
        PunchDirection.UNKNOWN,
        null,
        exceptionCode);
  }

  public static PunchOutcome invalid(String message) {
    return new PunchOutcome(
        null, Kind.INVALID, null, message, null, null, PunchDirection.UNKNOWN, null, null);
  }

  public static PunchOutcome storageFailure(UUID punchId) {
    return new PunchOutcome(
        punchId,
        Kind.STORAGE_FAILURE,
        PunchStatus.SUBMITTING,
        "System Error - Please try again",
        null,
        null,
        PunchDirection.UNKNOWN,
        null,
        null);
  }
}
