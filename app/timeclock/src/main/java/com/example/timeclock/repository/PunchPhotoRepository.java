/*
 * どこで: Timeclock データアクセス
 * 何を: キュー内の打刻が所有する写真データを保存・解放する
 * なぜ: 送信が確定するまで写真を打刻と一緒に保持するため
 */
package com.example.timeclock.repository;

import static com.example.common.JdbcInstantUtils.toEpochMillis;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class PunchPhotoRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void insert(UUID punchId, String fileName, byte[] photoBytes, Instant createdAt) {
    final String sql =
        """
        INSERT INTO punch_photos (
          punch_id,
          file_name,
          photo_bytes,
          created_at
        ) VALUES (
          :punchId,
          :fileName,
          :photoBytes,
          :createdAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("punchId", punchId.toString())
            .addValue("fileName", fileName)
            .addValue("photoBytes", photoBytes)
            .addValue("createdAt", toEpochMillis(createdAt));
    jdbcTemplate.update(sql, params);
  }

  public Optional<byte[]> findBytes(UUID punchId) {
    final String sql = "SELECT photo_bytes FROM punch_photos WHERE punch_id = :punchId";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("punchId", punchId.toString());
    return jdbcTemplate
        .query(sql, params, (rs, rowNum) -> rs.getBytes("photo_bytes"))
        .stream()
        .findFirst();
  }

  public int delete(UUID punchId) {
    final String sql = "DELETE FROM punch_photos WHERE punch_id = :punchId";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("punchId", punchId.toString());
    return jdbcTemplate.update(sql, params);
  }

  public int deleteOrphans() {
    final String sql =
        """
        DELETE FROM punch_photos
        WHERE punch_id NOT IN (SELECT punch_id FROM punch_queue)
        """;
    return jdbcTemplate.update(sql, new MapSqlParameterSource());
  }
}
