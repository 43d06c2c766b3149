package com.thermo.pipeline;

import com.thermo.db.StorageProfileDao;
import com.thermo.model.StoragePlan;
import com.thermo.model.StorageProfile;

/**
 * Отклоняет приём, если кэшированный объём владельца достиг лимита тарифа.
 * <p>
 * Объём не пересчитывается на каждом запросе: значение может отставать на интервал
 * пересчёта ({@code quota.recompute-interval-minutes}). Владелец без профиля
 * считается владельцем плана FREE с нулевым объёмом.
 */
public class QuotaGate implements IngestionGate {

  private final StorageProfileDao storageProfileDao;

  public QuotaGate(StorageProfileDao storageProfileDao) {
    this.storageProfileDao = storageProfileDao;
  }

  @Override
  public GateResult check(IngestionContext context) {
    long ownerId = context.getDevice().getOwnerId();
    StorageProfile profile = storageProfileDao.find(ownerId)
        .orElseGet(() -> new StorageProfile(ownerId, StoragePlan.FREE, 0, null));
    context.setStorageProfile(profile);
    if (profile.isStorageFull()) {
      return GateResult.reject(IngestionError.QUOTA_EXCEEDED,
          "Storage limit reached (" + profile.getPlan().getLimitDisplay() + "). "
              + "Please delete old telemetry data or upgrade your plan.");
    }
    return GateResult.admit();
  }
}
