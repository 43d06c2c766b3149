package com.thermo.db;

import com.thermo.alert.AlertStateStore;
import com.thermo.model.AlertDirection;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Состояние cooldown в таблице alert_state.
 * <p>
 * Проверка и запись времени срабатывания выполняются одним оператором
 * {@code INSERT ... ON CONFLICT DO UPDATE ... WHERE}: PostgreSQL блокирует строку ключа,
 * поэтому два конкурентных замера одного устройства не могут сработать оба.
 */
public class AlertStateDao implements AlertStateStore {

  @Override
  public boolean tryFire(String deviceSerial, AlertDirection direction, Instant now, Duration cooldown) {
    String sql = """
        INSERT INTO alert_state (device_serial, direction, last_fired_at)
        VALUES (?, ?, ?)
        ON CONFLICT (device_serial, direction) DO UPDATE
            SET last_fired_at = EXCLUDED.last_fired_at
            WHERE alert_state.last_fired_at <= ?
        """;
    try (Connection conn = DatabaseConnection.getConnection();
         PreparedStatement pstmt = conn.prepareStatement(sql)) {
      pstmt.setString(1, deviceSerial);
      pstmt.setString(2, direction.name());
      JdbcTimes.setInstant(pstmt, 3, now);
      JdbcTimes.setInstant(pstmt, 4, now.minus(cooldown));
      return pstmt.executeUpdate() > 0;
    } catch (SQLException e) {
      throw new StorageException("Не удалось обновить состояние оповещения " + deviceSerial + "/" + direction, e);
    }
  }

  @Override
  public Optional<Instant> lastFired(String deviceSerial, AlertDirection direction) {
    String sql = "SELECT last_fired_at FROM alert_state WHERE device_serial = ? AND direction = ?";
    try (Connection conn = DatabaseConnection.getConnection();
         PreparedStatement pstmt = conn.prepareStatement(sql)) {
      pstmt.setString(1, deviceSerial);
      pstmt.setString(2, direction.name());
      try (ResultSet rs = pstmt.executeQuery()) {
        return rs.next() ? Optional.of(JdbcTimes.getInstant(rs, "last_fired_at")) : Optional.empty();
      }
    } catch (SQLException e) {
      throw new StorageException("Не удалось прочитать состояние оповещения " + deviceSerial + "/" + direction, e);
    }
  }
}
