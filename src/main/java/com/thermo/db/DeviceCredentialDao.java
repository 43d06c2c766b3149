package com.thermo.db;

import com.thermo.model.DeviceCredential;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * DAO-класс для таблицы device_credentials.
 * <p>
 * Инвариант "не более одного активного ключа на устройство" держит частичный
 * уникальный индекс; ротация выполняется в одной транзакции под блокировкой строки устройства.
 */
public class DeviceCredentialDao {

  private static final String COLUMNS = "id, device_serial, secret_hash, salt, created_at, expires_at, active";

  public Optional<DeviceCredential> findActive(String deviceSerial) {
    String sql = "SELECT " + COLUMNS + " FROM device_credentials "
        + "WHERE device_serial = ? AND active ORDER BY id DESC LIMIT 1";
    try (Connection conn = DatabaseConnection.getConnection();
         PreparedStatement pstmt = conn.prepareStatement(sql)) {
      pstmt.setString(1, deviceSerial);
      try (ResultSet rs = pstmt.executeQuery()) {
        return rs.next() ? Optional.of(map(rs)) : Optional.empty();
      }
    } catch (SQLException e) {
      throw new StorageException("Не удалось прочитать ключ устройства " + deviceSerial, e);
    }
  }

  public List<DeviceCredential> listForDevice(String deviceSerial) {
    String sql = "SELECT " + COLUMNS + " FROM device_credentials WHERE device_serial = ? ORDER BY id DESC";
    try (Connection conn = DatabaseConnection.getConnection();
         PreparedStatement pstmt = conn.prepareStatement(sql)) {
      pstmt.setString(1, deviceSerial);
      List<DeviceCredential> result = new ArrayList<>();
      try (ResultSet rs = pstmt.executeQuery()) {
        while (rs.next()) {
          result.add(map(rs));
        }
      }
      return result;
    } catch (SQLException e) {
      throw new StorageException("Не удалось прочитать ключи устройства " + deviceSerial, e);
    }
  }

  /**
   * Деактивирует все ключи устройства и создаёт новый активный.
   * @return Новая запись.
   */
  public DeviceCredential replaceActive(String deviceSerial, String secretHash, String salt,
                                        Instant createdAt, Instant expiresAt) {
    try (Connection conn = DatabaseConnection.getConnection()) {
      conn.setAutoCommit(false);
      try {
        try (PreparedStatement lock = conn.prepareStatement(
            "SELECT serial_number FROM devices WHERE serial_number = ? FOR UPDATE")) {
          lock.setString(1, deviceSerial);
          lock.executeQuery().close();
        }
        try (PreparedStatement deactivate = conn.prepareStatement(
            "UPDATE device_credentials SET active = FALSE WHERE device_serial = ? AND active")) {
          deactivate.setString(1, deviceSerial);
          deactivate.executeUpdate();
        }
        long id;
        try (PreparedStatement insert = conn.prepareStatement(
            "INSERT INTO device_credentials (device_serial, secret_hash, salt, created_at, expires_at, active) "
                + "VALUES (?, ?, ?, ?, ?, TRUE) RETURNING id")) {
          insert.setString(1, deviceSerial);
          insert.setString(2, secretHash);
          insert.setString(3, salt);
          JdbcTimes.setInstant(insert, 4, createdAt);
          JdbcTimes.setInstant(insert, 5, expiresAt);
          try (ResultSet rs = insert.executeQuery()) {
            rs.next();
            id = rs.getLong(1);
          }
        }
        conn.commit();
        return new DeviceCredential(id, deviceSerial, secretHash, salt, createdAt, expiresAt, true);
      } catch (SQLException e) {
        conn.rollback();
        throw e;
      }
    } catch (SQLException e) {
      throw new StorageException("Не удалось выпустить ключ устройства " + deviceSerial, e);
    }
  }

  /**
   * Деактивирует конкретный ключ устройства. Повторный вызов ничего не меняет.
   * @return true, если ключ был активен; false, если он уже отозван или не принадлежит устройству.
   */
  public boolean deactivate(String deviceSerial, long credentialId) {
    String sql = "UPDATE device_credentials SET active = FALSE WHERE id = ? AND device_serial = ? AND active";
    try (Connection conn = DatabaseConnection.getConnection();
         PreparedStatement pstmt = conn.prepareStatement(sql)) {
      pstmt.setLong(1, credentialId);
      pstmt.setString(2, deviceSerial);
      return pstmt.executeUpdate() > 0;
    } catch (SQLException e) {
      throw new StorageException("Не удалось отозвать ключ " + credentialId, e);
    }
  }

  private static DeviceCredential map(ResultSet rs) throws SQLException {
    return new DeviceCredential(
        rs.getLong("id"),
        rs.getString("device_serial"),
        rs.getString("secret_hash"),
        rs.getString("salt"),
        JdbcTimes.getInstant(rs, "created_at"),
        JdbcTimes.getInstant(rs, "expires_at"),
        rs.getBoolean("active")
    );
  }
}
