package com.thermo.db;

import com.thermo.model.AlertSettings;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;

/**
 * DAO-класс для таблицы alert_settings.
 */
public class AlertSettingsDao {

  public Optional<AlertSettings> find(String deviceSerial) {
    String sql = "SELECT device_serial, enabled, high_enabled, high_threshold_c, low_enabled, "
        + "low_threshold_c, cooldown_minutes, custom_email FROM alert_settings WHERE device_serial = ?";
    try (Connection conn = DatabaseConnection.getConnection();
         PreparedStatement pstmt = conn.prepareStatement(sql)) {
      pstmt.setString(1, deviceSerial);
      try (ResultSet rs = pstmt.executeQuery()) {
        if (!rs.next()) {
          return Optional.empty();
        }
        AlertSettings settings = new AlertSettings();
        settings.setDeviceSerial(rs.getString("device_serial"));
        settings.setEnabled(rs.getBoolean("enabled"));
        settings.setHighEnabled(rs.getBoolean("high_enabled"));
        settings.setHighThresholdC(rs.getDouble("high_threshold_c"));
        settings.setLowEnabled(rs.getBoolean("low_enabled"));
        settings.setLowThresholdC(rs.getDouble("low_threshold_c"));
        settings.setCooldownMinutes(rs.getInt("cooldown_minutes"));
        settings.setCustomEmail(rs.getString("custom_email"));
        return Optional.of(settings);
      }
    } catch (SQLException e) {
      throw new StorageException("Не удалось прочитать настройки оповещений " + deviceSerial, e);
    }
  }

  public void save(AlertSettings settings) {
    String sql = """
        INSERT INTO alert_settings (device_serial, enabled, high_enabled, high_threshold_c,
                                    low_enabled, low_threshold_c, cooldown_minutes, custom_email)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?)
        ON CONFLICT (device_serial) DO UPDATE SET
            enabled = EXCLUDED.enabled,
            high_enabled = EXCLUDED.high_enabled,
            high_threshold_c = EXCLUDED.high_threshold_c,
            low_enabled = EXCLUDED.low_enabled,
            low_threshold_c = EXCLUDED.low_threshold_c,
            cooldown_minutes = EXCLUDED.cooldown_minutes,
            custom_email = EXCLUDED.custom_email
        """;
    try (Connection conn = DatabaseConnection.getConnection();
         PreparedStatement pstmt = conn.prepareStatement(sql)) {
      pstmt.setString(1, settings.getDeviceSerial());
      pstmt.setBoolean(2, settings.isEnabled());
      pstmt.setBoolean(3, settings.isHighEnabled());
      pstmt.setDouble(4, settings.getHighThresholdC());
      pstmt.setBoolean(5, settings.isLowEnabled());
      pstmt.setDouble(6, settings.getLowThresholdC());
      pstmt.setInt(7, settings.getCooldownMinutes());
      pstmt.setString(8, settings.getCustomEmail());
      pstmt.executeUpdate();
    } catch (SQLException e) {
      throw new StorageException("Не удалось сохранить настройки оповещений " + settings.getDeviceSerial(), e);
    }
  }
}
