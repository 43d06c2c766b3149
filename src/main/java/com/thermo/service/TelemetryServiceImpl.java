package com.thermo.service;

import com.thermo.alert.AlertEvaluator;
import com.thermo.db.DeviceDao;
import com.thermo.db.StorageException;
import com.thermo.db.StorageProfileDao;
import com.thermo.db.TelemetryDao;
import com.thermo.model.Device;
import com.thermo.model.TelemetrySample;
import com.thermo.pipeline.GateResult;
import com.thermo.pipeline.IngestionContext;
import com.thermo.pipeline.IngestionError;
import com.thermo.pipeline.IngestionException;
import com.thermo.pipeline.IngestionPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;

/**
 * Реализация сервиса приёма телеметрии.
 */
public class TelemetryServiceImpl implements TelemetryService {

  private static final Logger logger = LoggerFactory.getLogger(TelemetryServiceImpl.class);

  /** Оценка накладных расходов строки telemetry сверх сырого тела. */
  static final long ROW_OVERHEAD_BYTES = 300;

  private final IngestionPipeline pipeline;
  private final TelemetryDao telemetryDao;
  private final DeviceDao deviceDao;
  private final StorageProfileDao storageProfileDao;
  private final AlertEvaluator alertEvaluator;
  private final Clock clock;

  /**
   * Конструктор сервиса.
   *
   * @param pipeline Цепочка шлюзов проверки запроса.
   * @param telemetryDao Хранилище замеров.
   * @param deviceDao DAO устройств (время последнего контакта).
   * @param storageProfileDao DAO профилей хранения (учёт объёма).
   * @param alertEvaluator Проверка порогов после сохранения.
   * @param clock Часы для времени поступления запроса.
   */
  public TelemetryServiceImpl(IngestionPipeline pipeline, TelemetryDao telemetryDao, DeviceDao deviceDao,
                              StorageProfileDao storageProfileDao, AlertEvaluator alertEvaluator, Clock clock) {
    this.pipeline = pipeline;
    this.telemetryDao = telemetryDao;
    this.deviceDao = deviceDao;
    this.storageProfileDao = storageProfileDao;
    this.alertEvaluator = alertEvaluator;
    this.clock = clock;
  }

  @Override
  public TelemetrySample ingest(String authorization, String body, String remoteAddress) {
    IngestionContext context = new IngestionContext(authorization, body, remoteAddress, clock.instant());

    GateResult result;
    try {
      result = pipeline.run(context);
    } catch (StorageException e) {
      logger.error("❌ Хранилище недоступно при проверке запроса от {}", remoteAddress, e);
      throw new IngestionException(IngestionError.STORAGE_UNAVAILABLE, "Storage is temporarily unavailable", e);
    }
    if (!result.isAdmitted()) {
      logger.warn("Запрос от {} отклонён: {} ({})", describe(context), result.getError(), result.getDetail());
      throw new IngestionException(result.getError(), result.getDetail());
    }

    TelemetrySample stored;
    try {
      stored = telemetryDao.append(context.getSample());
    } catch (StorageException e) {
      logger.error("❌ Не удалось сохранить телеметрию устройства {}", describe(context), e);
      throw new IngestionException(IngestionError.STORAGE_UNAVAILABLE, "Storage is temporarily unavailable", e);
    }

    Device device = context.getDevice();
    afterCommit(device, stored, context.getDeviceIp());

    logger.info("✅ Телеметрия от {} сохранена, id={}", device.getSerialNumber(), stored.getId());
    return stored;
  }

  /**
   * Шаги после записи. Ошибки здесь не отменяют приём: замер уже сохранён.
   */
  private void afterCommit(Device device, TelemetrySample stored, String deviceIp) {
    String serial = device.getSerialNumber();
    try {
      deviceDao.touchLastSeen(serial, stored.getReceivedAt(), deviceIp);
    } catch (StorageException e) {
      logger.warn("Не удалось обновить время контакта устройства {}", serial, e);
    }

    long estimatedBytes = ROW_OVERHEAD_BYTES
        + (stored.getRawPayload() == null ? 0 : stored.getRawPayload().getBytes(StandardCharsets.UTF_8).length);
    try {
      storageProfileDao.incrementUsage(device.getOwnerId(), estimatedBytes);
    } catch (StorageException e) {
      logger.warn("Не удалось учесть объём замера {} владельца {}", stored.getId(), device.getOwnerId(), e);
    }

    try {
      alertEvaluator.evaluate(device, stored);
    } catch (RuntimeException e) {
      logger.warn("Ошибка проверки оповещений для замера {} устройства {}", stored.getId(), serial, e);
    }
  }

  private static String describe(IngestionContext context) {
    if (context.getDevice() != null) {
      return context.getDevice().getSerialNumber();
    }
    return context.getRemoteAddress();
  }
}
