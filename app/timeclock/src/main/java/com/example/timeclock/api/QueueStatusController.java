/*
 * どこで: Timeclock デバッグ API
 * 何を: オフラインキューの表示と手動排出を行う
 * なぜ: 運用者が拒否済み打刻を確認し、復旧後に同期を強制するため
 */
package com.example.timeclock.api;

import com.example.timeclock.api.response.QueueStatusResponse;
import com.example.timeclock.api.response.QueuedPunchItem;
import com.example.timeclock.model.QueueSummary;
import com.example.timeclock.model.SyncReport;
import com.example.timeclock.service.OfflineQueue;
import com.example.timeclock.service.SyncManager;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/debug/punch")
@RequiredArgsConstructor
public class QueueStatusController {

  private static final int MAX_ITEMS = 500;

  private final OfflineQueue offlineQueue;
  private final SyncManager syncManager;

  @GetMapping("/queue")
  public QueueStatusResponse queue(
      @RequestParam(name = "limit", defaultValue = "100") int limit) {
    final QueueSummary summary = offlineQueue.summary();
    final List<QueuedPunchItem> items =
        offlineQueue.findAll(Math.max(1, Math.min(limit, MAX_ITEMS))).stream()
            .map(QueuedPunchItem::from)
            .toList();
    return new QueueStatusResponse(
        summary.queued(),
        summary.syncing(),
        summary.rejected(),
        summary.oldestPunchTimestamp(),
        items);
  }

  @PostMapping("/sync")
  public SyncReport sync() {
    return syncManager.drain();
  }
}
