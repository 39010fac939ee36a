/*
 * どこで: Timeclock サービス層
 * 何を: 打刻結果・同期結果・キュー滞留・削除件数・同期遅延を記録する
 * なぜ: オフライン滞留とデータ損失を actuator から確認できるようにするため
 */
package com.example.timeclock.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring managed component")
public class PunchMetrics {

  private static final String METRIC_PUNCH_TOTAL = "timeclock.punch.total";
  private static final String METRIC_SYNC_TOTAL = "timeclock.sync.total";
  private static final String METRIC_QUEUE_BACKLOG = "timeclock.queue.backlog";
  private static final String METRIC_QUEUE_PURGED_TOTAL = "timeclock.queue.purged.total";
  private static final String METRIC_SYNC_DELAY = "timeclock.sync.delay";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger queueBacklog = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> punchCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> syncCounters = new ConcurrentHashMap<>();
  private final Counter purgedCounter;
  private final Timer syncDelayTimer;

  public PunchMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_QUEUE_BACKLOG, queueBacklog, AtomicInteger::get)
        .description("Punches waiting in the offline queue")
        .register(meterRegistry);
    this.purgedCounter =
        Counter.builder(METRIC_QUEUE_PURGED_TOTAL)
            .description("Unsynced punches deleted by the retention sweep")
            .register(meterRegistry);
    this.syncDelayTimer =
        Timer.builder(METRIC_SYNC_DELAY)
            .description("Delay from punch time to confirmed sync")
            .register(meterRegistry);
  }

  public void recordPunchOutcome(String outcome) {
    punchCounters
        .computeIfAbsent(
            outcome,
            ignored ->
                Counter.builder(METRIC_PUNCH_TOTAL)
                    .description("Punch attempt outcomes")
                    .tags(Tags.of("outcome", outcome))
                    .register(meterRegistry))
        .increment();
  }

  public void recordSyncResult(String result) {
    syncCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_SYNC_TOTAL)
                    .description("Offline queue sync results")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordSyncDelay(Instant punchTimestamp, Instant syncedAt) {
    if (punchTimestamp == null || syncedAt == null || syncedAt.isBefore(punchTimestamp)) {
      return;
    }
    syncDelayTimer.record(Duration.between(punchTimestamp, syncedAt));
  }

  public void recordPurged(int count) {
    if (count > 0) {
      purgedCounter.increment(count);
    }
  }

  public void updateQueueBacklog(int backlog) {
    queueBacklog.set(Math.max(backlog, 0));
  }
}
