package com.gpstracker.tracker.history;

import static org.assertj.core.api.Assertions.assertThat;

import com.gpstracker.tracker.model.PositionRecord;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SqlitePositionHistoryRepositoryTest {
  @TempDir
  Path tempDir;

  private Path file;
  private SqlitePositionHistoryRepository repository;

  @BeforeEach
  void setUp() {
    file = tempDir.resolve("nested/dir/history.sqlite");
    repository = new SqlitePositionHistoryRepository(file, 5);
  }

  @AfterEach
  void tearDown() throws Exception {
    repository.close();
  }

  private static PositionRecord record(String deviceId, double lat, long ts) {
    return new PositionRecord(deviceId, lat, -74.006, 25.5, 45, 12, ts);
  }

  private Connection open() throws SQLException {
    return DriverManager.getConnection("jdbc:sqlite:" + file.toAbsolutePath());
  }

  private long count(String sql, String deviceId) throws SQLException {
    try (Connection connection = open(); PreparedStatement stmt = connection.prepareStatement(sql)) {
      stmt.setString(1, deviceId);
      try (ResultSet rs = stmt.executeQuery()) {
        return rs.next() ? rs.getLong(1) : 0L;
      }
    }
  }

  private long positions(String deviceId) throws SQLException {
    return count("SELECT COUNT(*) FROM positions WHERE device_id = ?", deviceId);
  }

  @Test
  void createsDatabaseFileAndParentDirectories() {
    assertThat(Files.exists(file)).isTrue();
  }

  @Test
  void upsertKeepsOneSummaryRowWithLatestValues() throws Exception {
    repository.upsertDevice(record("TEST_001", 40.0, 1_000L));
    repository.upsertDevice(new PositionRecord("TEST_001", 41.5, -73.0, 10.0, 90, 7, 2_000L));

    try (Connection connection = open();
        PreparedStatement stmt = connection.prepareStatement(
            "SELECT last_seen, last_lat, last_lng, last_speed, last_heading, last_sats, updated_at "
                + "FROM devices WHERE device_id = ?")) {
      stmt.setString(1, "TEST_001");
      try (ResultSet rs = stmt.executeQuery()) {
        assertThat(rs.next()).isTrue();
        assertThat(rs.getLong("last_seen")).isEqualTo(2_000L);
        assertThat(rs.getDouble("last_lat")).isEqualTo(41.5);
        assertThat(rs.getDouble("last_lng")).isEqualTo(-73.0);
        assertThat(rs.getDouble("last_speed")).isEqualTo(10.0);
        assertThat(rs.getInt("last_heading")).isEqualTo(90);
        assertThat(rs.getInt("last_sats")).isEqualTo(7);
        assertThat(rs.getLong("updated_at")).isPositive();
        assertThat(rs.next()).isFalse();
      }
    }
  }

  @Test
  void findRecentReturnsNewestFirstUpToLimit() {
    repository.appendPosition(record("D1", 1.0, 100L));
    repository.appendPosition(record("D1", 3.0, 300L));
    repository.appendPosition(record("D1", 2.0, 200L));
    repository.appendPosition(record("D2", 9.0, 999L));

    List<PositionRecord> recent = repository.findRecent("D1", 2);

    assertThat(recent).extracting(PositionRecord::timestamp).containsExactly(300L, 200L);
    assertThat(recent.get(0)).isEqualTo(record("D1", 3.0, 300L));
    assertThat(repository.findRecent("D1", 10)).hasSize(3);
    assertThat(repository.findRecent("UNKNOWN", 10)).isEmpty();
  }

  @Test
  void pruneKeepsMostRecentRowsOfThatDeviceOnly() throws Exception {
    for (long ts = 1; ts <= 10; ts++) {
      repository.appendPosition(record("D1", 1.0, ts));
    }
    repository.appendPosition(record("D2", 1.0, 1L));

    int deleted = repository.prune("D1", 4);

    assertThat(deleted).isEqualTo(6);
    assertThat(positions("D1")).isEqualTo(4);
    assertThat(repository.findRecent("D1", 10)).extracting(PositionRecord::timestamp)
        .containsExactly(10L, 9L, 8L, 7L);
    assertThat(positions("D2")).isEqualTo(1);
  }

  @Test
  void pruneIsIdempotent() throws Exception {
    for (long ts = 1; ts <= 5; ts++) {
      repository.appendPosition(record("D1", 1.0, ts));
    }

    assertThat(repository.prune("D1", 3)).isEqualTo(2);
    assertThat(repository.prune("D1", 3)).isZero();
    assertThat(positions("D1")).isEqualTo(3);
  }

  @Test
  void pruneEvictsOldestInsertAmongEqualTimestamps() {
    repository.appendPosition(record("D1", 1.0, 500L));
    repository.appendPosition(record("D1", 2.0, 500L));
    repository.appendPosition(record("D1", 3.0, 500L));

    repository.prune("D1", 2);

    assertThat(repository.findRecent("D1", 10)).extracting(PositionRecord::lat).containsExactly(3.0, 2.0);
  }

  @Test
  void onlineDevicesViewOnlyListsRecentlySeenDevices() throws Exception {
    long now = System.currentTimeMillis();
    repository.upsertDevice(record("FRESH", 1.0, now - 5_000L));
    repository.upsertDevice(record("STALE", 1.0, now - 600_000L));

    assertThat(count("SELECT COUNT(*) FROM online_devices WHERE device_id = ?", "FRESH")).isEqualTo(1);
    assertThat(count("SELECT COUNT(*) FROM online_devices WHERE device_id = ?", "STALE")).isZero();
    assertThat(count("SELECT seconds_ago FROM online_devices WHERE device_id = ?", "FRESH"))
        .isBetween(0L, 60L);
  }

  @Test
  void deviceStatsViewAggregatesHistory() throws Exception {
    repository.upsertDevice(record("D1", 1.0, 300L));
    repository.appendPosition(new PositionRecord("D1", 1.0, 1.0, 10.0, 0, 0, 100L));
    repository.appendPosition(new PositionRecord("D1", 1.0, 1.0, 30.0, 0, 0, 300L));

    try (Connection connection = open();
        PreparedStatement stmt = connection.prepareStatement(
            "SELECT total_positions, first_seen, last_position, avg_speed, max_speed "
                + "FROM device_stats WHERE device_id = ?")) {
      stmt.setString(1, "D1");
      try (ResultSet rs = stmt.executeQuery()) {
        assertThat(rs.next()).isTrue();
        assertThat(rs.getLong("total_positions")).isEqualTo(2);
        assertThat(rs.getLong("first_seen")).isEqualTo(100L);
        assertThat(rs.getLong("last_position")).isEqualTo(300L);
        assertThat(rs.getDouble("avg_speed")).isEqualTo(20.0);
        assertThat(rs.getDouble("max_speed")).isEqualTo(30.0);
      }
    }
  }

  @Test
  void dataSurvivesReopen() throws Exception {
    Path other = tempDir.resolve("reopen.sqlite");
    try (SqlitePositionHistoryRepository first = new SqlitePositionHistoryRepository(other, 5)) {
      first.upsertDevice(record("D1", 1.0, 1L));
      first.appendPosition(record("D1", 1.0, 1L));
    }
    try (SqlitePositionHistoryRepository second = new SqlitePositionHistoryRepository(other, 5)) {
      assertThat(second.findRecent("D1", 10)).containsExactly(record("D1", 1.0, 1L));
    }
  }
}
