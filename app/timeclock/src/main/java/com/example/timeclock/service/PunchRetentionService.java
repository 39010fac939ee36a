/*
 * どこで: Timeclock サービス層
 * 何を: オフラインキューに保持期間を適用する
 * なぜ: 長期障害時もストアを有限に保ち、失われた打刻をすべて報告するため
 */
package com.example.timeclock.service;

import com.example.timeclock.config.PunchRetentionProperties;
import com.example.timeclock.model.PunchRecord;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class PunchRetentionService {

  private static final Logger logger = LoggerFactory.getLogger(PunchRetentionService.class);

  private final OfflineQueue offlineQueue;
  private final PunchRetentionProperties properties;
  private final PunchMetrics metrics;

  public int cleanup() {
    final List<PunchRecord> purged = offlineQueue.purgeExpired(properties.retentionDays());
    metrics.recordPurged(purged.size());
    metrics.updateQueueBacklog(offlineQueue.countActive());
    logger.info(
        "punch retention cleanup deleted records={} retentionDays={}",
        purged.size(),
        properties.retentionDays());
    return purged.size();
  }
}
