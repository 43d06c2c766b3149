package com.thermo.service;

import com.thermo.db.TelemetryDao;
import com.thermo.model.TelemetrySample;

import java.time.Instant;
import java.util.List;

/**
 * Чтение сохранённой телеметрии для панели пользователя и экспорта.
 */
public class TelemetryQueryService {

  private final TelemetryDao telemetryDao;
  private final int recentMax;

  /**
   * @param telemetryDao Хранилище замеров.
   * @param recentMax Наибольшее число замеров в {@link #findRecent(String, int)}.
   */
  public TelemetryQueryService(TelemetryDao telemetryDao, int recentMax) {
    if (recentMax < 1) {
      throw new IllegalArgumentException("recentMax must be positive");
    }
    this.telemetryDao = telemetryDao;
    this.recentMax = recentMax;
  }

  /**
   * Замеры устройства с временем приёма в полуоткрытом интервале [start, end),
   * по возрастанию времени приёма.
   *
   * @throws IllegalArgumentException если границы не заданы или start не раньше end.
   */
  public List<TelemetrySample> findRange(String deviceSerial, Instant start, Instant end) {
    if (deviceSerial == null || start == null || end == null) {
      throw new IllegalArgumentException("deviceSerial, start and end are required");
    }
    if (!start.isBefore(end)) {
      throw new IllegalArgumentException("start must be before end");
    }
    return telemetryDao.findRange(deviceSerial, start, end);
  }

  /**
   * Последние замеры устройства, новые первыми. Лимит приводится к 1..recentMax.
   */
  public List<TelemetrySample> findRecent(String deviceSerial, int limit) {
    if (deviceSerial == null) {
      throw new IllegalArgumentException("deviceSerial is required");
    }
    int clamped = Math.max(1, Math.min(limit, recentMax));
    return telemetryDao.findRecent(deviceSerial, clamped);
  }
}
