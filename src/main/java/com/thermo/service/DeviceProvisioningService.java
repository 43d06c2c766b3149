package com.thermo.service;

import com.thermo.db.DeviceCredentialDao;
import com.thermo.db.DeviceDao;
import com.thermo.db.StorageProfileDao;
import com.thermo.model.Device;
import com.thermo.model.DeviceCredential;
import com.thermo.model.IssuedCredential;
import com.thermo.ratelimit.FixedWindowRateLimiter;
import com.thermo.security.SecretHasher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Регистрация устройств и управление их ключами.
 * <p>
 * Секрет возвращается только один раз, в момент выпуска; в базе хранится лишь его хэш.
 * У устройства не больше одного активного ключа.
 */
public class DeviceProvisioningService {

  private static final Logger logger = LoggerFactory.getLogger(DeviceProvisioningService.class);

  static final int MAX_SERIAL_LENGTH = 64;

  private final DeviceDao deviceDao;
  private final DeviceCredentialDao credentialDao;
  private final StorageProfileDao storageProfileDao;
  private final SecretHasher hasher;
  private final FixedWindowRateLimiter rotationLimiter;
  private final Duration credentialTtl;
  private final Clock clock;

  /**
   * @param rotationLimiter Лимит смен ключа на устройство.
   * @param credentialTtl Срок действия выпускаемого ключа.
   */
  public DeviceProvisioningService(DeviceDao deviceDao, DeviceCredentialDao credentialDao,
                                   StorageProfileDao storageProfileDao, SecretHasher hasher,
                                   FixedWindowRateLimiter rotationLimiter, Duration credentialTtl, Clock clock) {
    this.deviceDao = deviceDao;
    this.credentialDao = credentialDao;
    this.storageProfileDao = storageProfileDao;
    this.hasher = hasher;
    this.rotationLimiter = rotationLimiter;
    this.credentialTtl = credentialTtl;
    this.clock = clock;
  }

  /**
   * Регистрирует устройство за владельцем. Повторная регистрация тем же владельцем
   * обновляет имя, если оно передано.
   *
   * @throws IllegalArgumentException если серийный номер пуст, слишком длинный или занят другим владельцем.
   */
  public Device registerDevice(long ownerId, String serialNumber, String name) {
    String serial = normalizeSerial(serialNumber);
    String trimmedName = name == null || name.isBlank() ? null : name.trim();

    Device existing = deviceDao.findBySerial(serial).orElse(null);
    if (existing != null) {
      if (existing.getOwnerId() != ownerId) {
        throw new IllegalArgumentException("Device " + serial + " is registered to another account");
      }
      if (trimmedName != null && !trimmedName.equals(existing.getName())) {
        deviceDao.renameDevice(serial, trimmedName);
      }
    } else {
      deviceDao.createDevice(serial, ownerId, trimmedName, clock.instant());
      logger.info("✅ Устройство {} зарегистрировано за владельцем {}", serial, ownerId);
    }
    storageProfileDao.ensureExists(ownerId);
    return deviceDao.findBySerial(serial)
        .orElseThrow(() -> new IllegalStateException("Device " + serial + " disappeared after registration"));
  }

  /**
   * Выпускает первый ключ устройства.
   *
   * @throws IllegalStateException если у устройства уже есть активный ключ.
   */
  public IssuedCredential issueCredential(long ownerId, String serialNumber) {
    String serial = requireOwned(ownerId, serialNumber);
    if (credentialDao.findActive(serial).isPresent()) {
      throw new IllegalStateException("Device " + serial + " already has an active key; rotate it instead");
    }
    return issue(serial);
  }

  /**
   * Деактивирует все ключи устройства и выпускает новый.
   *
   * @throws RotationLimitExceededException если лимит смен ключа исчерпан.
   */
  public IssuedCredential rotateCredential(long ownerId, String serialNumber) {
    String serial = requireOwned(ownerId, serialNumber);
    if (!rotationLimiter.tryAcquire(serial)) {
      logger.warn("Лимит смены ключа устройства {} исчерпан", serial);
      throw new RotationLimitExceededException("Too many key rotations. Please try again later.");
    }
    return issue(serial);
  }

  /**
   * Отзывает ключ. Повторный отзыв не считается ошибкой.
   *
   * @return true, если ключ был активен и теперь отозван.
   */
  public boolean revokeCredential(long ownerId, String serialNumber, long credentialId) {
    String serial = requireOwned(ownerId, serialNumber);
    boolean revoked = credentialDao.deactivate(serial, credentialId);
    if (revoked) {
      logger.info("Ключ {} устройства {} отозван", credentialId, serial);
    }
    return revoked;
  }

  /**
   * @return Ключи устройства без секретов, новые первыми.
   */
  public List<DeviceCredential> listCredentials(long ownerId, String serialNumber) {
    return credentialDao.listForDevice(requireOwned(ownerId, serialNumber));
  }

  public void renameDevice(long ownerId, String serialNumber, String name) {
    String serial = requireOwned(ownerId, serialNumber);
    String trimmed = name == null || name.isBlank() ? null : name.trim();
    deviceDao.renameDevice(serial, trimmed);
  }

  private IssuedCredential issue(String serial) {
    String secret = hasher.newSecret();
    String salt = hasher.newSalt();
    Instant now = clock.instant();
    DeviceCredential credential = credentialDao.replaceActive(
        serial, hasher.hash(secret, salt), salt, now, now.plus(credentialTtl));
    logger.info("🔑 Выпущен ключ {} для устройства {}, действует до {}",
        credential.getId(), serial, credential.getExpiresAt());
    return new IssuedCredential(credential, secret);
  }

  private String requireOwned(long ownerId, String serialNumber) {
    String serial = normalizeSerial(serialNumber);
    Device device = deviceDao.findBySerial(serial)
        .orElseThrow(() -> new IllegalArgumentException("Unknown device " + serial));
    if (device.getOwnerId() != ownerId) {
      throw new IllegalArgumentException("Unknown device " + serial);
    }
    return serial;
  }

  private static String normalizeSerial(String serialNumber) {
    if (serialNumber == null || serialNumber.isBlank()) {
      throw new IllegalArgumentException("Serial number is required");
    }
    String serial = serialNumber.trim();
    if (serial.length() > MAX_SERIAL_LENGTH) {
      throw new IllegalArgumentException("Serial number must be at most " + MAX_SERIAL_LENGTH + " characters");
    }
    if (serial.indexOf(':') >= 0) {
      throw new IllegalArgumentException("Serial number must not contain ':'");
    }
    return serial;
  }
}
