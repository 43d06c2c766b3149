package com.thermo.model;

import java.time.Instant;

/**
 * Зарегистрированное устройство (термостат).
 * <p>
 * Серийный номер уникален и служит ключом телеметрии; устройство не удаляется,
 * пока на него ссылаются сохранённые замеры.
 */
public class Device {

  private final String serialNumber;
  private final long ownerId;
  private final String name;
  private final Instant createdAt;
  private final Instant lastSeen;
  private final String lastIp;

  public Device(String serialNumber, long ownerId, String name,
                Instant createdAt, Instant lastSeen, String lastIp) {
    this.serialNumber = serialNumber;
    this.ownerId = ownerId;
    this.name = name;
    this.createdAt = createdAt;
    this.lastSeen = lastSeen;
    this.lastIp = lastIp;
  }

  public String getSerialNumber() {
    return serialNumber;
  }

  public long getOwnerId() {
    return ownerId;
  }

  public String getName() {
    return name;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getLastSeen() {
    return lastSeen;
  }

  public String getLastIp() {
    return lastIp;
  }

  /**
   * Имя для показа пользователю: название, если задано, иначе серийный номер.
   */
  public String getLabel() {
    return name == null || name.isBlank() ? serialNumber : name;
  }
}
