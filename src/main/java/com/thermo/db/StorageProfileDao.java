package com.thermo.db;

import com.thermo.model.StoragePlan;
import com.thermo.model.StorageProfile;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * DAO-класс для таблицы storage_profiles (тариф и кэшированный объём владельца).
 */
public class StorageProfileDao {

  /**
   * Читает профиль владельца. Только чтение: путь приёма телеметрии ничего здесь не создаёт.
   */
  public Optional<StorageProfile> find(long ownerId) {
    String sql = "SELECT owner_id, plan, cached_usage_bytes, usage_calculated_at FROM storage_profiles WHERE owner_id = ?";
    try (Connection conn = DatabaseConnection.getConnection();
         PreparedStatement pstmt = conn.prepareStatement(sql)) {
      pstmt.setLong(1, ownerId);
      try (ResultSet rs = pstmt.executeQuery()) {
        if (!rs.next()) {
          return Optional.empty();
        }
        return Optional.of(new StorageProfile(
            rs.getLong("owner_id"),
            StoragePlan.fromCode(rs.getString("plan")),
            rs.getLong("cached_usage_bytes"),
            JdbcTimes.getInstant(rs, "usage_calculated_at")));
      }
    } catch (SQLException e) {
      throw new StorageException("Не удалось прочитать профиль хранения владельца " + ownerId, e);
    }
  }

  /**
   * Создаёт профиль FREE с нулевым объёмом, если у владельца его ещё нет.
   */
  public void ensureExists(long ownerId) {
    String sql = "INSERT INTO storage_profiles (owner_id) VALUES (?) ON CONFLICT (owner_id) DO NOTHING";
    try (Connection conn = DatabaseConnection.getConnection();
         PreparedStatement pstmt = conn.prepareStatement(sql)) {
      pstmt.setLong(1, ownerId);
      pstmt.executeUpdate();
    } catch (SQLException e) {
      throw new StorageException("Не удалось создать профиль хранения владельца " + ownerId, e);
    }
  }

  public void incrementUsage(long ownerId, long bytes) {
    String sql = """
        INSERT INTO storage_profiles (owner_id, cached_usage_bytes) VALUES (?, ?)
        ON CONFLICT (owner_id) DO UPDATE
            SET cached_usage_bytes = storage_profiles.cached_usage_bytes + EXCLUDED.cached_usage_bytes
        """;
    try (Connection conn = DatabaseConnection.getConnection();
         PreparedStatement pstmt = conn.prepareStatement(sql)) {
      pstmt.setLong(1, ownerId);
      pstmt.setLong(2, bytes);
      pstmt.executeUpdate();
    } catch (SQLException e) {
      throw new StorageException("Не удалось обновить объём владельца " + ownerId, e);
    }
  }

  public void updateUsage(long ownerId, long usageBytes, Instant calculatedAt) {
    String sql = "UPDATE storage_profiles SET cached_usage_bytes = ?, usage_calculated_at = ? WHERE owner_id = ?";
    try (Connection conn = DatabaseConnection.getConnection();
         PreparedStatement pstmt = conn.prepareStatement(sql)) {
      pstmt.setLong(1, usageBytes);
      JdbcTimes.setInstant(pstmt, 2, calculatedAt);
      pstmt.setLong(3, ownerId);
      pstmt.executeUpdate();
    } catch (SQLException e) {
      throw new StorageException("Не удалось сохранить пересчитанный объём владельца " + ownerId, e);
    }
  }

  public List<Long> listOwnerIds() {
    List<Long> ids = new ArrayList<>();
    try (Connection conn = DatabaseConnection.getConnection();
         PreparedStatement pstmt = conn.prepareStatement("SELECT owner_id FROM storage_profiles ORDER BY owner_id");
         ResultSet rs = pstmt.executeQuery()) {
      while (rs.next()) {
        ids.add(rs.getLong(1));
      }
    } catch (SQLException e) {
      throw new StorageException("Не удалось получить список профилей хранения", e);
    }
    return ids;
  }
}
