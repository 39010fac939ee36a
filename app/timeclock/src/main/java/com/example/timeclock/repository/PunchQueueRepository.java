/*
 * どこで: Timeclock データアクセス
 * 何を: punch_queue の行を挿入・取得・更新する
 * なぜ: オフラインキューが未送信打刻の唯一の永続コピーであるため
 */
package com.example.timeclock.repository;

import static com.example.common.JdbcInstantUtils.getInstant;
import static com.example.common.JdbcInstantUtils.toEpochMillis;

import com.example.timeclock.model.PhotoState;
import com.example.timeclock.model.PunchRecord;
import com.example.timeclock.model.PunchStatus;
import com.example.timeclock.model.QueueSummary;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class PunchQueueRepository {

  private static final String COLUMNS =
      """
      punch_id, raw_employee_id, image_employee_id, punch_timestamp, department_override,
      status, photo_state, punch_accepted, sync_attempts, last_error, next_retry_at, created_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /** 同じ punch_id の行が既にある場合は false を返す。 */
  public boolean insertIfAbsent(PunchRecord record, Instant now) {
    final String sql =
        """
        INSERT INTO punch_queue (
          punch_id,
          raw_employee_id,
          image_employee_id,
          punch_timestamp,
          department_override,
          status,
          photo_state,
          punch_accepted,
          sync_attempts,
          last_error,
          next_retry_at,
          created_at,
          updated_at
        ) VALUES (
          :punchId,
          :rawEmployeeId,
          :imageEmployeeId,
          :punchTimestamp,
          :departmentOverride,
          :status,
          :photoState,
          :punchAccepted,
          :syncAttempts,
          :lastError,
          :nextRetryAt,
          :createdAt,
          :updatedAt
        )
        ON CONFLICT (punch_id) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("punchId", record.punchId().toString())
            .addValue("rawEmployeeId", record.rawEmployeeId())
            .addValue("imageEmployeeId", record.imageEmployeeId())
            .addValue("punchTimestamp", toEpochMillis(record.punchTimestamp()))
            .addValue("departmentOverride", record.departmentOverride())
            .addValue("status", record.status().name())
            .addValue("photoState", record.photoState().name())
            .addValue("punchAccepted", record.punchAccepted() ? 1 : 0)
            .addValue("syncAttempts", record.syncAttempts())
            .addValue("lastError", record.lastError())
            .addValue("nextRetryAt", toEpochMillis(record.nextRetryAt()))
            .addValue("createdAt", toEpochMillis(record.createdAt()))
            .addValue("updatedAt", toEpochMillis(now));
    return jdbcTemplate.update(sql, params) > 0;
  }

  public Optional<PunchRecord> findById(UUID punchId) {
    final String sql = "SELECT " + COLUMNS + " FROM punch_queue WHERE punch_id = :punchId";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("punchId", punchId.toString());
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /** 送信順の有効行。SYNCING は中断した排出の残りで、先頭から再開する。 */
  public List<PunchRecord> findOldestActive(int limit) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM punch_queue
            WHERE status IN ('OFFLINE_QUEUED', 'SYNCING')
            ORDER BY punch_timestamp, punch_id
            LIMIT :limit
            """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public List<PunchRecord> findAll(int limit) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM punch_queue
            ORDER BY punch_timestamp, punch_id
            LIMIT :limit
            """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public boolean existsActiveForEmployee(String rawEmployeeId) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM punch_queue
        WHERE raw_employee_id = :rawEmployeeId
          AND status IN ('OFFLINE_QUEUED', 'SYNCING')
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("rawEmployeeId", rawEmployeeId);
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count != null && count > 0;
  }

  public int countActive() {
    final String sql =
        "SELECT COUNT(*) FROM punch_queue WHERE status IN ('OFFLINE_QUEUED', 'SYNCING')";
    final Integer count =
        jdbcTemplate.queryForObject(sql, new MapSqlParameterSource(), Integer.class);
    return count == null ? 0 : count;
  }

  public QueueSummary summarize() {
    final String sql =
        """
        SELECT
          COALESCE(SUM(CASE WHEN status = 'OFFLINE_QUEUED' THEN 1 ELSE 0 END), 0) AS queued,
          COALESCE(SUM(CASE WHEN status = 'SYNCING' THEN 1 ELSE 0 END), 0) AS syncing,
          COALESCE(SUM(CASE WHEN status = 'REJECTED' THEN 1 ELSE 0 END), 0) AS rejected,
          MIN(CASE WHEN status IN ('OFFLINE_QUEUED', 'SYNCING') THEN punch_timestamp END)
            AS oldest_punch_timestamp
        FROM punch_queue
        """;
    return jdbcTemplate.queryForObject(
        sql,
        new MapSqlParameterSource(),
        (rs, rowNum) ->
            new QueueSummary(
                rs.getInt("queued"),
                rs.getInt("syncing"),
                rs.getInt("rejected"),
                getInstant(rs, "oldest_punch_timestamp")));
  }

  public int updateStatus(UUID punchId, PunchStatus from, PunchStatus to, Instant now) {
    final String sql =
        """
        UPDATE punch_queue
        SET status = :to,
            updated_at = :now
        WHERE punch_id = :punchId
          AND status = :from
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("punchId", punchId.toString())
            .addValue("from", from.name())
            .addValue("to", to.name())
            .addValue("now", toEpochMillis(now));
    return jdbcTemplate.update(sql, params);
  }

  public int markAccepted(UUID punchId, Instant now) {
    final String sql =
        """
        UPDATE punch_queue
        SET punch_accepted = 1,
            updated_at = :now
        WHERE punch_id = :punchId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("punchId", punchId.toString())
            .addValue("now", toEpochMillis(now));
    return jdbcTemplate.update(sql, params);
  }

  public int updatePhotoState(UUID punchId, PhotoState photoState, Instant now) {
    final String sql =
        """
        UPDATE punch_queue
        SET photo_state = :photoState,
            updated_at = :now
        WHERE punch_id = :punchId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("punchId", punchId.toString())
            .addValue("photoState", photoState.name())
            .addValue("now", toEpochMillis(now));
    return jdbcTemplate.update(sql, params);
  }

  public int markRetry(
      UUID punchId,
      int syncAttempts,
      String lastError,
      Instant nextRetryAt,
      boolean rejected,
      Instant now) {
    final String sql =
        """
        UPDATE punch_queue
        SET status = :status,
            sync_attempts = :syncAttempts,
            last_error = :lastError,
            next_retry_at = :nextRetryAt,
            updated_at = :now
        WHERE punch_id = :punchId
          AND status IN ('OFFLINE_QUEUED', 'SYNCING')
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("status", rejected ? "REJECTED" : "OFFLINE_QUEUED")
            .addValue("syncAttempts", syncAttempts)
            .addValue("lastError", lastError)
            .addValue("nextRetryAt", rejected ? null : toEpochMillis(nextRetryAt))
            .addValue("punchId", punchId.toString())
            .addValue("now", toEpochMillis(now));
    return jdbcTemplate.update(sql, params);
  }

  public int markRejected(UUID punchId, String lastError, Instant now) {
    final String sql =
        """
        UPDATE punch_queue
        SET status = 'REJECTED',
            last_error = :lastError,
            next_retry_at = NULL,
            updated_at = :now
        WHERE punch_id = :punchId
          AND status IN ('OFFLINE_QUEUED', 'SYNCING')
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("punchId", punchId.toString())
            .addValue("lastError", lastError)
            .addValue("now", toEpochMillis(now));
    return jdbcTemplate.update(sql, params);
  }

  public int delete(UUID punchId) {
    final String sql = "DELETE FROM punch_queue WHERE punch_id = :punchId";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("punchId", punchId.toString());
    return jdbcTemplate.update(sql, params);
  }

  public List<PunchRecord> findCreatedBefore(Instant threshold) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM punch_queue
            WHERE created_at < :threshold
            ORDER BY punch_timestamp, punch_id
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toEpochMillis(threshold));
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int deleteCreatedBefore(Instant threshold) {
    final String sql = "DELETE FROM punch_queue WHERE created_at < :threshold";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toEpochMillis(threshold));
    return jdbcTemplate.update(sql, params);
  }

  private PunchRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    final int departmentOverride = rs.getInt("department_override");
    final boolean noDepartmentOverride = rs.wasNull();
    return new PunchRecord(
        UUID.fromString(rs.getString("punch_id")),
        rs.getString("raw_employee_id"),
        rs.getString("image_employee_id"),
        getInstant(rs, "punch_timestamp"),
        noDepartmentOverride ? null : departmentOverride,
        PunchStatus.valueOf(rs.getString("status")),
        PhotoState.valueOf(rs.getString("photo_state")),
        rs.getInt("punch_accepted") == 1,
        rs.getInt("sync_attempts"),
        rs.getString("last_error"),
        getInstant(rs, "next_retry_at"),
        getInstant(rs, "created_at"));
  }
}
