package com.thermo.security;

import com.thermo.db.DeviceCredentialDao;
import com.thermo.db.DeviceDao;
import com.thermo.model.Device;
import com.thermo.model.DeviceCredential;

import java.time.Clock;
import java.util.Optional;

/**
 * Проверяет учётные данные устройства вида {@code serial:secret}.
 * <p>
 * Неизвестный серийный номер, отсутствие активного ключа, истёкший ключ и неверный секрет
 * дают один и тот же результат, и во всех случаях выполняется одинаковая работа:
 * один запрос активного ключа, один хэш, одно сравнение постоянного времени.
 */
public class CredentialVerifier {

  // подставляются, когда у серийного номера нет активного ключа
  private static final String DUMMY_SALT = "00000000000000000000000000000000";
  private static final String DUMMY_HASH = "0000000000000000000000000000000000000000000000000000000000000000";

  private final DeviceCredentialDao credentialDao;
  private final DeviceDao deviceDao;
  private final SecretHasher hasher;
  private final Clock clock;

  public CredentialVerifier(DeviceCredentialDao credentialDao, DeviceDao deviceDao,
                            SecretHasher hasher, Clock clock) {
    this.credentialDao = credentialDao;
    this.deviceDao = deviceDao;
    this.hasher = hasher;
    this.clock = clock;
  }

  /**
   * @param credentials Строка {@code serial:secret}.
   * @return Аутентифицированное устройство или пусто при любой ошибке проверки.
   */
  public Optional<Device> verify(String credentials) {
    if (credentials == null) {
      return Optional.empty();
    }
    int separator = credentials.indexOf(':');
    if (separator < 0) {
      return Optional.empty();
    }
    String serial = credentials.substring(0, separator).trim();
    String secret = credentials.substring(separator + 1).trim();
    if (serial.isEmpty() || secret.isEmpty()) {
      return Optional.empty();
    }

    Optional<DeviceCredential> active = credentialDao.findActive(serial);
    String salt = active.map(DeviceCredential::getSalt).orElse(DUMMY_SALT);
    String expectedHash = active.map(DeviceCredential::getSecretHash).orElse(DUMMY_HASH);

    boolean secretMatches = hasher.matches(secret, salt, expectedHash);
    boolean valid = active.isPresent() && active.get().isValidAt(clock.instant());
    if (!(secretMatches & valid)) {
      return Optional.empty();
    }
    return deviceDao.findBySerial(serial);
  }
}
