package com.gpstracker.tracker.history;

import com.gpstracker.tracker.model.PositionRecord;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * SQLite implementation of {@link PositionHistoryRepository}.
 *
 * <p>Besides the two tables the schema carries the {@code online_devices} and
 * {@code device_stats} views for operators inspecting the file with the sqlite3 shell.
 *
 * <p>One JDBC connection is shared by the history writer thread and HTTP readers, so every
 * operation synchronizes on the repository. Each statement carries a query timeout and the
 * connection a busy timeout, both set to the configured operation timeout.
 */
public class SqlitePositionHistoryRepository implements PositionHistoryRepository, AutoCloseable {
  private static final List<String> SCHEMA = List.of(
      "CREATE TABLE IF NOT EXISTS devices ("
          + "id INTEGER PRIMARY KEY AUTOINCREMENT, "
          + "device_id TEXT UNIQUE NOT NULL, "
          + "last_seen INTEGER NOT NULL, "
          + "last_lat REAL, "
          + "last_lng REAL, "
          + "last_speed REAL, "
          + "last_heading INTEGER, "
          + "last_sats INTEGER, "
          + "created_at INTEGER DEFAULT (strftime('%s', 'now')), "
          + "updated_at INTEGER DEFAULT (strftime('%s', 'now')))",
      "CREATE TABLE IF NOT EXISTS positions ("
          + "id INTEGER PRIMARY KEY AUTOINCREMENT, "
          + "device_id TEXT NOT NULL, "
          + "lat REAL NOT NULL, "
          + "lng REAL NOT NULL, "
          + "speed REAL, "
          + "heading INTEGER, "
          + "sats INTEGER, "
          + "timestamp INTEGER NOT NULL, "
          + "created_at INTEGER DEFAULT (strftime('%s', 'now')), "
          + "FOREIGN KEY (device_id) REFERENCES devices (device_id))",
      "CREATE INDEX IF NOT EXISTS idx_positions_device_id ON positions(device_id)",
      "CREATE INDEX IF NOT EXISTS idx_positions_timestamp ON positions(timestamp)",
      "CREATE INDEX IF NOT EXISTS idx_positions_device_timestamp ON positions(device_id, timestamp)",
      "CREATE INDEX IF NOT EXISTS idx_devices_last_seen ON devices(last_seen)",
      "CREATE TRIGGER IF NOT EXISTS update_devices_timestamp AFTER UPDATE ON devices FOR EACH ROW "
          + "BEGIN UPDATE devices SET updated_at = strftime('%s', 'now') WHERE id = NEW.id; END",
      // last_seen is in epoch milliseconds; strftime('%s') is seconds.
      "CREATE VIEW IF NOT EXISTS online_devices AS "
          + "SELECT device_id, last_lat, last_lng, last_speed, last_heading, last_sats, last_seen, "
          + "(CAST(strftime('%s', 'now') AS INTEGER) - last_seen / 1000) AS seconds_ago "
          + "FROM devices "
          + "WHERE last_seen > (CAST(strftime('%s', 'now') AS INTEGER) - 60) * 1000",
      "CREATE VIEW IF NOT EXISTS device_stats AS "
          + "SELECT d.device_id, d.last_seen, d.last_lat, d.last_lng, d.last_speed, d.last_heading, "
          + "d.last_sats, COUNT(p.id) AS total_positions, MIN(p.timestamp) AS first_seen, "
          + "MAX(p.timestamp) AS last_position, AVG(p.speed) AS avg_speed, MAX(p.speed) AS max_speed "
          + "FROM devices d LEFT JOIN positions p ON d.device_id = p.device_id "
          + "GROUP BY d.device_id");

  private static final String UPSERT_DEVICE_SQL =
      "INSERT INTO devices "
          + "(device_id, last_seen, last_lat, last_lng, last_speed, last_heading, last_sats, updated_at) "
          + "VALUES (?, ?, ?, ?, ?, ?, ?, strftime('%s', 'now')) "
          + "ON CONFLICT(device_id) DO UPDATE SET "
          + "last_seen = excluded.last_seen, "
          + "last_lat = excluded.last_lat, "
          + "last_lng = excluded.last_lng, "
          + "last_speed = excluded.last_speed, "
          + "last_heading = excluded.last_heading, "
          + "last_sats = excluded.last_sats, "
          + "updated_at = excluded.updated_at";

  private static final String INSERT_POSITION_SQL =
      "INSERT INTO positions (device_id, lat, lng, speed, heading, sats, timestamp) "
          + "VALUES (?, ?, ?, ?, ?, ?, ?)";

  private static final String PRUNE_SQL =
      "DELETE FROM positions WHERE device_id = ? AND id NOT IN ("
          + "SELECT id FROM positions WHERE device_id = ? "
          + "ORDER BY timestamp DESC, id DESC LIMIT ?)";

  private static final String SELECT_RECENT_SQL =
      "SELECT device_id, lat, lng, speed, heading, sats, timestamp FROM positions "
          + "WHERE device_id = ? ORDER BY timestamp DESC, id DESC LIMIT ?";

  private final Connection connection;
  private final int timeoutSeconds;

  /**
   * Opens (creating when needed) the SQLite file and its schema.
   *
   * @param sqlitePath path to the database file
   * @param timeoutSeconds per-operation timeout
   */
  public SqlitePositionHistoryRepository(Path sqlitePath, int timeoutSeconds) {
    this.timeoutSeconds = Math.max(1, timeoutSeconds);
    try {
      Path parent = sqlitePath.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      this.connection = DriverManager.getConnection("jdbc:sqlite:" + sqlitePath.toAbsolutePath());
      try (Statement stmt = connection.createStatement()) {
        stmt.setQueryTimeout(this.timeoutSeconds);
        stmt.execute("PRAGMA busy_timeout = " + (this.timeoutSeconds * 1000));
        stmt.execute("PRAGMA journal_mode = WAL");
        for (String ddl : SCHEMA) {
          stmt.execute(ddl);
        }
      }
    } catch (IOException | SQLException ex) {
      throw new IllegalStateException("Failed to open history SQLite DB at " + sqlitePath, ex);
    }
  }

  @Override
  public synchronized void upsertDevice(PositionRecord record) {
    try (PreparedStatement stmt = prepare(UPSERT_DEVICE_SQL)) {
      stmt.setString(1, record.deviceId());
      stmt.setLong(2, record.timestamp());
      stmt.setDouble(3, record.lat());
      stmt.setDouble(4, record.lng());
      stmt.setDouble(5, record.speed());
      stmt.setInt(6, record.heading());
      stmt.setInt(7, record.sats());
      stmt.executeUpdate();
    } catch (SQLException ex) {
      throw new PersistenceException("Failed to update device " + record.deviceId(), ex);
    }
  }

  @Override
  public synchronized void appendPosition(PositionRecord record) {
    try (PreparedStatement stmt = prepare(INSERT_POSITION_SQL)) {
      stmt.setString(1, record.deviceId());
      stmt.setDouble(2, record.lat());
      stmt.setDouble(3, record.lng());
      stmt.setDouble(4, record.speed());
      stmt.setInt(5, record.heading());
      stmt.setInt(6, record.sats());
      stmt.setLong(7, record.timestamp());
      stmt.executeUpdate();
    } catch (SQLException ex) {
      throw new PersistenceException("Failed to insert position for " + record.deviceId(), ex);
    }
  }

  @Override
  public synchronized int prune(String deviceId, int keep) {
    try (PreparedStatement stmt = prepare(PRUNE_SQL)) {
      stmt.setString(1, deviceId);
      stmt.setString(2, deviceId);
      stmt.setInt(3, Math.max(0, keep));
      return stmt.executeUpdate();
    } catch (SQLException ex) {
      throw new PersistenceException("Failed to prune positions for " + deviceId, ex);
    }
  }

  @Override
  public synchronized List<PositionRecord> findRecent(String deviceId, int limit) {
    try (PreparedStatement stmt = prepare(SELECT_RECENT_SQL)) {
      stmt.setString(1, deviceId);
      stmt.setInt(2, Math.max(0, limit));
      List<PositionRecord> rows = new ArrayList<>();
      try (ResultSet rs = stmt.executeQuery()) {
        while (rs.next()) {
          rows.add(new PositionRecord(
              rs.getString("device_id"),
              rs.getDouble("lat"),
              rs.getDouble("lng"),
              rs.getDouble("speed"),
              rs.getInt("heading"),
              rs.getInt("sats"),
              rs.getLong("timestamp")));
        }
      }
      return rows;
    } catch (SQLException ex) {
      throw new PersistenceException("Failed to read history for " + deviceId, ex);
    }
  }

  /**
   * Closes the JDBC connection.
   */
  @Override
  public synchronized void close() {
    try {
      connection.close();
    } catch (SQLException ignored) {
      // connection is already unusable
    }
  }

  private PreparedStatement prepare(String sql) throws SQLException {
    PreparedStatement stmt = connection.prepareStatement(sql);
    stmt.setQueryTimeout(timeoutSeconds);
    return stmt;
  }
}
