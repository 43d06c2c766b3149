package com.thermo.db;

import com.thermo.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

/**
 * Класс для управления соединением с PostgreSQL и инициализации схемы.
 * Параметры подключения читаются через {@link Config} при каждом вызове.
 */
public class DatabaseConnection {

  private static final Logger logger = LoggerFactory.getLogger(DatabaseConnection.class);

  private static final List<String> SCHEMA = List.of(
      """
      CREATE TABLE IF NOT EXISTS users (
          id BIGSERIAL PRIMARY KEY,
          name VARCHAR(150) NOT NULL,
          email VARCHAR(254)
      )
      """,
      """
      CREATE TABLE IF NOT EXISTS devices (
          serial_number VARCHAR(64) PRIMARY KEY,
          owner_id BIGINT NOT NULL REFERENCES users(id),
          name VARCHAR(100) NOT NULL DEFAULT '',
          created_at TIMESTAMPTZ NOT NULL DEFAULT NOW(),
          last_seen TIMESTAMPTZ,
          last_ip VARCHAR(45)
      )
      """,
      """
      CREATE TABLE IF NOT EXISTS device_credentials (
          id BIGSERIAL PRIMARY KEY,
          device_serial VARCHAR(64) NOT NULL REFERENCES devices(serial_number),
          secret_hash VARCHAR(64) NOT NULL,
          salt VARCHAR(32) NOT NULL,
          created_at TIMESTAMPTZ NOT NULL,
          expires_at TIMESTAMPTZ,
          active BOOLEAN NOT NULL DEFAULT TRUE
      )
      """,
      // не более одного активного ключа на устройство
      """
      CREATE UNIQUE INDEX IF NOT EXISTS device_credentials_one_active
          ON device_credentials (device_serial) WHERE active
      """,
      """
      CREATE TABLE IF NOT EXISTS telemetry (
          id BIGSERIAL PRIMARY KEY,
          device_serial VARCHAR(64) NOT NULL REFERENCES devices(serial_number),
          mode VARCHAR(16) NOT NULL,
          setpoint_c DOUBLE PRECISION NOT NULL,
          temp_inside_c DOUBLE PRECISION NOT NULL,
          temp_outside_c DOUBLE PRECISION,
          humidity_percent DOUBLE PRECISION,
          hysteresis_c DOUBLE PRECISION NOT NULL,
          output VARCHAR(16) NOT NULL,
          device_ts TIMESTAMPTZ,
          received_at TIMESTAMPTZ NOT NULL,
          raw_payload JSON
      )
      """,
      """
      CREATE INDEX IF NOT EXISTS telemetry_device_received_idx
          ON telemetry (device_serial, received_at)
      """,
      """
      CREATE TABLE IF NOT EXISTS storage_profiles (
          owner_id BIGINT PRIMARY KEY REFERENCES users(id),
          plan VARCHAR(20) NOT NULL DEFAULT 'FREE',
          cached_usage_bytes BIGINT NOT NULL DEFAULT 0,
          usage_calculated_at TIMESTAMPTZ
      )
      """,
      """
      CREATE TABLE IF NOT EXISTS alert_settings (
          device_serial VARCHAR(64) PRIMARY KEY REFERENCES devices(serial_number),
          enabled BOOLEAN NOT NULL DEFAULT FALSE,
          high_enabled BOOLEAN NOT NULL DEFAULT FALSE,
          high_threshold_c DOUBLE PRECISION NOT NULL DEFAULT 30.0,
          low_enabled BOOLEAN NOT NULL DEFAULT FALSE,
          low_threshold_c DOUBLE PRECISION NOT NULL DEFAULT 10.0,
          cooldown_minutes INTEGER NOT NULL DEFAULT 30,
          custom_email VARCHAR(254)
      )
      """,
      """
      CREATE TABLE IF NOT EXISTS alert_state (
          device_serial VARCHAR(64) NOT NULL,
          direction VARCHAR(8) NOT NULL,
          last_fired_at TIMESTAMPTZ NOT NULL,
          PRIMARY KEY (device_serial, direction)
      )
      """
  );

  /**
   * Создаёт новое соединение с базой данных.
   * @return Новое соединение с PostgreSQL.
   * @throws StorageException если подключение не удалось.
   */
  public static Connection getConnection() {
    String url = Config.getRequiredProperty("db.url");
    try {
      return DriverManager.getConnection(
          url,
          Config.getRequiredProperty("db.user"),
          Config.getProperty("db.password", ""));
    } catch (SQLException e) {
      throw new StorageException(
          "Не удалось подключиться к базе данных по адресу: " + url
              + ". Проверьте, что PostgreSQL запущен и параметры подключения верны.",
          e
      );
    }
  }

  /**
   * Инициализирует базу данных: создаёт таблицы и индексы, если они отсутствуют.
   * Вызывается при старте приложения.
   * @throws StorageException если не удалось создать схему.
   */
  public static void initializeDatabase() {
    try (Connection conn = getConnection();
         Statement stmt = conn.createStatement()) {
      for (String ddl : SCHEMA) {
        stmt.execute(ddl);
      }
      logger.info("✅ Схема базы данных создана или уже существует ({} объектов)", SCHEMA.size());
    } catch (SQLException e) {
      throw new StorageException("Не удалось инициализировать схему базы данных.", e);
    }
  }

  private DatabaseConnection() {
    throw new UnsupportedOperationException("Utility class");
  }
}
