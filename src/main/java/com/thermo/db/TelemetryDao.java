package com.thermo.db;

import com.thermo.model.OperatingMode;
import com.thermo.model.OutputState;
import com.thermo.model.TelemetrySample;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * DAO-класс для операций с таблицей telemetry (хранилище замеров).
 * <p>
 * Запись только добавляется. Время приёма назначается здесь, непосредственно перед
 * вставкой, поэтому задержки самого хранилища отражаются в порядке замеров.
 * Каждый вызов работает с собственным соединением в режиме autocommit: запись видна
 * последующим чтениям сразу после возврата из {@link #append(TelemetrySample)}.
 */
public class TelemetryDao {

  private static final String COLUMNS =
      "id, device_serial, mode, setpoint_c, temp_inside_c, temp_outside_c, humidity_percent, "
          + "hysteresis_c, output, device_ts, received_at, raw_payload";

  private final Clock clock;

  /**
   * @param clock Источник времени приёма.
   */
  public TelemetryDao(Clock clock) {
    this.clock = clock;
  }

  /**
   * Сохраняет проверенный замер.
   * @param sample Замер без идентификатора и времени приёма.
   * @return Сохранённый замер с назначенными {@code id} и {@code receivedAt}.
   * @throws StorageException если запись не удалась; повтор не выполняется.
   */
  public TelemetrySample append(TelemetrySample sample) {
    String sql = """
        INSERT INTO telemetry (device_serial, mode, setpoint_c, temp_inside_c, temp_outside_c,
                               humidity_percent, hysteresis_c, output, device_ts, received_at, raw_payload)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, CAST(? AS json))
        RETURNING id
        """;
    try (Connection conn = DatabaseConnection.getConnection();
         PreparedStatement pstmt = conn.prepareStatement(sql)) {
      // TIMESTAMPTZ хранит микросекунды
      Instant receivedAt = clock.instant().truncatedTo(ChronoUnit.MICROS);
      pstmt.setString(1, sample.getDeviceSerial());
      pstmt.setString(2, sample.getMode().name());
      pstmt.setDouble(3, sample.getSetpointC());
      pstmt.setDouble(4, sample.getTempInsideC());
      setNullableDouble(pstmt, 5, sample.getTempOutsideC());
      setNullableDouble(pstmt, 6, sample.getHumidityPercent());
      pstmt.setDouble(7, sample.getHysteresisC());
      pstmt.setString(8, sample.getOutput().name());
      JdbcTimes.setInstant(pstmt, 9, sample.getDeviceTimestamp());
      JdbcTimes.setInstant(pstmt, 10, receivedAt);
      pstmt.setString(11, sample.getRawPayload());
      try (ResultSet rs = pstmt.executeQuery()) {
        rs.next();
        return sample.withReceipt(rs.getLong(1), receivedAt);
      }
    } catch (SQLException e) {
      throw new StorageException("Не удалось сохранить телеметрию в базу данных. "
          + "Устройство: " + sample.getDeviceSerial(), e);
    }
  }

  /**
   * Замеры устройства с временем приёма в полуинтервале [start, end), по возрастанию времени.
   */
  public List<TelemetrySample> findRange(String deviceSerial, Instant start, Instant end) {
    String sql = "SELECT " + COLUMNS + " FROM telemetry "
        + "WHERE device_serial = ? AND received_at >= ? AND received_at < ? "
        + "ORDER BY received_at, id";
    try (Connection conn = DatabaseConnection.getConnection();
         PreparedStatement pstmt = conn.prepareStatement(sql)) {
      pstmt.setString(1, deviceSerial);
      JdbcTimes.setInstant(pstmt, 2, start);
      JdbcTimes.setInstant(pstmt, 3, end);
      return readSamples(pstmt);
    } catch (SQLException e) {
      throw new StorageException("Не удалось прочитать телеметрию устройства " + deviceSerial, e);
    }
  }

  /**
   * Последние {@code limit} замеров устройства, от новых к старым.
   */
  public List<TelemetrySample> findRecent(String deviceSerial, int limit) {
    String sql = "SELECT " + COLUMNS + " FROM telemetry "
        + "WHERE device_serial = ? ORDER BY received_at DESC, id DESC LIMIT ?";
    try (Connection conn = DatabaseConnection.getConnection();
         PreparedStatement pstmt = conn.prepareStatement(sql)) {
      pstmt.setString(1, deviceSerial);
      pstmt.setInt(2, limit);
      return readSamples(pstmt);
    } catch (SQLException e) {
      throw new StorageException("Не удалось прочитать телеметрию устройства " + deviceSerial, e);
    }
  }

  /**
   * Количество замеров и средний размер сырого payload по всем устройствам владельца.
   * Используется при пересчёте занятого объёма.
   */
  public PayloadStats payloadStatsForOwner(long ownerId) {
    String sql = """
        SELECT COUNT(*) AS cnt,
               COALESCE(AVG(octet_length(t.raw_payload::text)), 0) AS avg_payload
        FROM telemetry t
        JOIN devices d ON d.serial_number = t.device_serial
        WHERE d.owner_id = ?
        """;
    try (Connection conn = DatabaseConnection.getConnection();
         PreparedStatement pstmt = conn.prepareStatement(sql)) {
      pstmt.setLong(1, ownerId);
      try (ResultSet rs = pstmt.executeQuery()) {
        rs.next();
        return new PayloadStats(rs.getLong("cnt"), rs.getDouble("avg_payload"));
      }
    } catch (SQLException e) {
      throw new StorageException("Не удалось посчитать объём телеметрии владельца " + ownerId, e);
    }
  }

  private List<TelemetrySample> readSamples(PreparedStatement pstmt) throws SQLException {
    List<TelemetrySample> samples = new ArrayList<>();
    try (ResultSet rs = pstmt.executeQuery()) {
      while (rs.next()) {
        samples.add(new TelemetrySample(
            rs.getLong("id"),
            rs.getString("device_serial"),
            OperatingMode.valueOf(rs.getString("mode")),
            rs.getDouble("setpoint_c"),
            rs.getDouble("temp_inside_c"),
            JdbcTimes.getNullableDouble(rs, "temp_outside_c"),
            JdbcTimes.getNullableDouble(rs, "humidity_percent"),
            rs.getDouble("hysteresis_c"),
            OutputState.valueOf(rs.getString("output")),
            JdbcTimes.getInstant(rs, "device_ts"),
            JdbcTimes.getInstant(rs, "received_at"),
            rs.getString("raw_payload")
        ));
      }
    }
    return samples;
  }

  private static void setNullableDouble(PreparedStatement pstmt, int index, Double value) throws SQLException {
    if (value == null) {
      pstmt.setNull(index, Types.DOUBLE);
    } else {
      pstmt.setDouble(index, value);
    }
  }

  /**
   * Сводка по объёму телеметрии владельца.
   */
  public static final class PayloadStats {

    private final long sampleCount;
    private final double averagePayloadBytes;

    public PayloadStats(long sampleCount, double averagePayloadBytes) {
      this.sampleCount = sampleCount;
      this.averagePayloadBytes = averagePayloadBytes;
    }

    public long getSampleCount() {
      return sampleCount;
    }

    public double getAveragePayloadBytes() {
      return averagePayloadBytes;
    }
  }
}
