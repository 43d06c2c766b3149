package com.thermo.service;

import com.thermo.db.StorageException;
import com.thermo.db.StorageProfileDao;
import com.thermo.db.TelemetryDao;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Пересчитывает кэшированный объём хранения владельцев по сохранённым замерам.
 * <p>
 * Запускается по расписанию; между запусками объём растёт оценочными приращениями
 * при каждом принятом замере.
 */
public class StorageUsageRecalculator implements Runnable {

  private static final Logger logger = LoggerFactory.getLogger(StorageUsageRecalculator.class);

  static final long ROW_BASE_BYTES = 200;
  static final long INDEX_OVERHEAD_BYTES = 100;

  private final TelemetryDao telemetryDao;
  private final StorageProfileDao storageProfileDao;
  private final Clock clock;

  public StorageUsageRecalculator(TelemetryDao telemetryDao, StorageProfileDao storageProfileDao, Clock clock) {
    this.telemetryDao = telemetryDao;
    this.storageProfileDao = storageProfileDao;
    this.clock = clock;
  }

  /**
   * Пересчитывает объём одного владельца.
   *
   * @return Новый объём в байтах.
   */
  public long recalculate(long ownerId) {
    storageProfileDao.ensureExists(ownerId);
    TelemetryDao.PayloadStats stats = telemetryDao.payloadStatsForOwner(ownerId);
    long perRow = ROW_BASE_BYTES + Math.round(stats.getAveragePayloadBytes()) + INDEX_OVERHEAD_BYTES;
    long usage = stats.getSampleCount() == 0 ? 0 : stats.getSampleCount() * perRow;
    storageProfileDao.updateUsage(ownerId, usage, clock.instant());
    logger.debug("Объём владельца {} пересчитан: {} замеров, {} байт", ownerId, stats.getSampleCount(), usage);
    return usage;
  }

  /**
   * Пересчитывает объём всех владельцев; сбой одного не останавливает остальных.
   *
   * @return Число успешно пересчитанных владельцев.
   */
  public int recalculateAll() {
    int done = 0;
    for (Long ownerId : storageProfileDao.listOwnerIds()) {
      try {
        recalculate(ownerId);
        done++;
      } catch (StorageException e) {
        logger.error("❌ Не удалось пересчитать объём владельца {}", ownerId, e);
      }
    }
    logger.info("Пересчёт объёма хранения завершён: {} владельцев", done);
    return done;
  }

  @Override
  public void run() {
    try {
      recalculateAll();
    } catch (RuntimeException e) {
      // исключение остановило бы периодический запуск
      logger.error("❌ Пересчёт объёма хранения прерван", e);
    }
  }
}
