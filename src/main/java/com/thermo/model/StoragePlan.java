package com.thermo.model;

/**
 * Тарифный план хранения с лимитом в байтах.
 */
public enum StoragePlan {
  FREE(2L * 1024 * 1024 * 1024),
  STANDARD(10L * 1024 * 1024 * 1024),
  PREMIUM(1024L * 1024 * 1024 * 1024);

  private final long limitBytes;

  StoragePlan(long limitBytes) {
    this.limitBytes = limitBytes;
  }

  public long getLimitBytes() {
    return limitBytes;
  }

  /**
   * Разбирает сохранённое имя плана. Неизвестное или пустое значение трактуется как FREE.
   */
  public static StoragePlan fromCode(String code) {
    if (code == null) {
      return FREE;
    }
    for (StoragePlan plan : values()) {
      if (plan.name().equalsIgnoreCase(code.trim())) {
        return plan;
      }
    }
    return FREE;
  }

  /**
   * Человекочитаемый лимит: "2 GB", "1 TB".
   */
  public String getLimitDisplay() {
    long tb = 1024L * 1024 * 1024 * 1024;
    long gb = 1024L * 1024 * 1024;
    if (limitBytes >= tb) {
      return (limitBytes / tb) + " TB";
    }
    return (limitBytes / gb) + " GB";
  }
}
