package com.thermo.model;

import java.time.Instant;

/**
 * Тариф владельца и кэшированный объём занятого хранилища.
 * <p>
 * Кэш пересчитывается вне пути приёма телеметрии, поэтому может отставать
 * от реального объёма не больше чем на интервал пересчёта.
 */
public class StorageProfile {

  private final long ownerId;
  private final StoragePlan plan;
  private final long cachedUsageBytes;
  private final Instant usageCalculatedAt;

  public StorageProfile(long ownerId, StoragePlan plan, long cachedUsageBytes, Instant usageCalculatedAt) {
    this.ownerId = ownerId;
    this.plan = plan;
    this.cachedUsageBytes = cachedUsageBytes;
    this.usageCalculatedAt = usageCalculatedAt;
  }

  public long getOwnerId() {
    return ownerId;
  }

  public StoragePlan getPlan() {
    return plan;
  }

  public long getCachedUsageBytes() {
    return cachedUsageBytes;
  }

  public Instant getUsageCalculatedAt() {
    return usageCalculatedAt;
  }

  public long getLimitBytes() {
    return plan.getLimitBytes();
  }

  public boolean isStorageFull() {
    return cachedUsageBytes >= plan.getLimitBytes();
  }

  public long getRemainingBytes() {
    return Math.max(0, plan.getLimitBytes() - cachedUsageBytes);
  }
}
