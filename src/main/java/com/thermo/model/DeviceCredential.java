package com.thermo.model;

import java.time.Instant;

/**
 * Учётные данные устройства. В базе хранится только солёный хэш секрета.
 * <p>
 * У устройства может быть много исторических записей, но активна не более одной.
 */
public class DeviceCredential {

  private final long id;
  private final String deviceSerial;
  private final String secretHash;
  private final String salt;
  private final Instant createdAt;
  private final Instant expiresAt;
  private final boolean active;

  public DeviceCredential(long id, String deviceSerial, String secretHash, String salt,
                          Instant createdAt, Instant expiresAt, boolean active) {
    this.id = id;
    this.deviceSerial = deviceSerial;
    this.secretHash = secretHash;
    this.salt = salt;
    this.createdAt = createdAt;
    this.expiresAt = expiresAt;
    this.active = active;
  }

  public long getId() {
    return id;
  }

  public String getDeviceSerial() {
    return deviceSerial;
  }

  public String getSecretHash() {
    return secretHash;
  }

  public String getSalt() {
    return salt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  /**
   * @return Момент истечения или {@code null}, если срок не ограничен.
   */
  public Instant getExpiresAt() {
    return expiresAt;
  }

  public boolean isActive() {
    return active;
  }

  public boolean isValidAt(Instant now) {
    return active && (expiresAt == null || expiresAt.isAfter(now));
  }
}
