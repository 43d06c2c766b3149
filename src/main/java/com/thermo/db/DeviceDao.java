package com.thermo.db;

import com.thermo.model.Device;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;

/**
 * DAO-класс для таблицы devices. Устройства не удаляются: на них ссылается телеметрия.
 */
public class DeviceDao {

  public Optional<Device> findBySerial(String serialNumber) {
    String sql = "SELECT serial_number, owner_id, name, created_at, last_seen, last_ip "
        + "FROM devices WHERE serial_number = ?";
    try (Connection conn = DatabaseConnection.getConnection();
         PreparedStatement pstmt = conn.prepareStatement(sql)) {
      pstmt.setString(1, serialNumber);
      try (ResultSet rs = pstmt.executeQuery()) {
        if (rs.next()) {
          return Optional.of(new Device(
              rs.getString("serial_number"),
              rs.getLong("owner_id"),
              rs.getString("name"),
              JdbcTimes.getInstant(rs, "created_at"),
              JdbcTimes.getInstant(rs, "last_seen"),
              rs.getString("last_ip")
          ));
        }
        return Optional.empty();
      }
    } catch (SQLException e) {
      throw new StorageException("Не удалось найти устройство " + serialNumber, e);
    }
  }

  public void createDevice(String serialNumber, long ownerId, String name, Instant createdAt) {
    String sql = "INSERT INTO devices (serial_number, owner_id, name, created_at) VALUES (?, ?, ?, ?)";
    try (Connection conn = DatabaseConnection.getConnection();
         PreparedStatement pstmt = conn.prepareStatement(sql)) {
      pstmt.setString(1, serialNumber);
      pstmt.setLong(2, ownerId);
      pstmt.setString(3, name == null ? "" : name);
      JdbcTimes.setInstant(pstmt, 4, createdAt);
      pstmt.executeUpdate();
    } catch (SQLException e) {
      throw new StorageException("Не удалось зарегистрировать устройство " + serialNumber, e);
    }
  }

  public boolean renameDevice(String serialNumber, String name) {
    String sql = "UPDATE devices SET name = ? WHERE serial_number = ?";
    try (Connection conn = DatabaseConnection.getConnection();
         PreparedStatement pstmt = conn.prepareStatement(sql)) {
      pstmt.setString(1, name == null ? "" : name);
      pstmt.setString(2, serialNumber);
      return pstmt.executeUpdate() > 0;
    } catch (SQLException e) {
      throw new StorageException("Не удалось переименовать устройство " + serialNumber, e);
    }
  }

  /**
   * Обновляет время последнего контакта. Если адрес не передан, сохраняется прежний.
   */
  public void touchLastSeen(String serialNumber, Instant seenAt, String ip) {
    String sql = "UPDATE devices SET last_seen = ?, last_ip = COALESCE(?, last_ip) WHERE serial_number = ?";
    try (Connection conn = DatabaseConnection.getConnection();
         PreparedStatement pstmt = conn.prepareStatement(sql)) {
      JdbcTimes.setInstant(pstmt, 1, seenAt);
      pstmt.setString(2, ip);
      pstmt.setString(3, serialNumber);
      pstmt.executeUpdate();
    } catch (SQLException e) {
      throw new StorageException("Не удалось обновить last_seen устройства " + serialNumber, e);
    }
  }
}
