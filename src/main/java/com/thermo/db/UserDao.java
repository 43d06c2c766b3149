package com.thermo.db;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;

/**
 * DAO-класс для таблицы users. Учётные записи ведёт внешний модуль регистрации;
 * здесь нужен только контактный адрес владельца.
 */
public class UserDao {

  /**
   * @return Идентификатор созданного пользователя.
   */
  public long createUser(String name, String email) {
    String sql = "INSERT INTO users(name, email) VALUES (?, ?) RETURNING id";
    try (Connection conn = DatabaseConnection.getConnection();
         PreparedStatement pstmt = conn.prepareStatement(sql)) {
      pstmt.setString(1, name);
      pstmt.setString(2, email);
      try (ResultSet rs = pstmt.executeQuery()) {
        rs.next();
        return rs.getLong(1);
      }
    } catch (SQLException e) {
      throw new StorageException("Не удалось создать пользователя " + name, e);
    }
  }

  /**
   * Контактный адрес владельца. Пустой, если пользователь не найден или адрес не задан.
   */
  public Optional<String> findContactEmail(long userId) {
    String sql = "SELECT email FROM users WHERE id = ?";
    try (Connection conn = DatabaseConnection.getConnection();
         PreparedStatement pstmt = conn.prepareStatement(sql)) {
      pstmt.setLong(1, userId);
      try (ResultSet rs = pstmt.executeQuery()) {
        if (rs.next()) {
          String email = rs.getString("email");
          return email == null || email.isBlank() ? Optional.empty() : Optional.of(email);
        }
        return Optional.empty();
      }
    } catch (SQLException e) {
      throw new StorageException("Не удалось прочитать адрес пользователя " + userId, e);
    }
  }
}
