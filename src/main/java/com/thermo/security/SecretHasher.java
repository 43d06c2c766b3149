package com.thermo.security;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.HexFormat;

/**
 * Генерация и хэширование секретов устройств: SHA-256 от соли и секрета.
 * <p>
 * Секреты случайные (256 бит), поэтому медленная функция растяжения ключа не нужна,
 * а проверка остаётся дешёвой на каждом запросе телеметрии.
 */
public class SecretHasher {

  private static final int SECRET_BYTES = 32;
  private static final int SALT_BYTES = 16;

  private final SecureRandom random = new SecureRandom();

  /**
   * @return Новый URL-безопасный секрет (около 43 символов).
   */
  public String newSecret() {
    byte[] bytes = new byte[SECRET_BYTES];
    random.nextBytes(bytes);
    return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
  }

  /**
   * @return Новая соль в hex (32 символа).
   */
  public String newSalt() {
    byte[] bytes = new byte[SALT_BYTES];
    random.nextBytes(bytes);
    return HexFormat.of().formatHex(bytes);
  }

  /**
   * @return Хэш в hex (64 символа).
   */
  public String hash(String secret, String salt) {
    return HexFormat.of().formatHex(digest(secret, salt));
  }

  /**
   * Сравнивает секрет с сохранённым хэшем за время, не зависящее от позиции
   * первого несовпадающего байта.
   */
  public boolean matches(String secret, String salt, String expectedHashHex) {
    byte[] actual = digest(secret, salt);
    byte[] expected;
    try {
      expected = HexFormat.of().parseHex(expectedHashHex);
    } catch (IllegalArgumentException e) {
      expected = new byte[actual.length];
    }
    return MessageDigest.isEqual(actual, expected);
  }

  private static byte[] digest(String secret, String salt) {
    try {
      MessageDigest sha256 = MessageDigest.getInstance("SHA-256");
      sha256.update(salt.getBytes(StandardCharsets.UTF_8));
      return sha256.digest(secret.getBytes(StandardCharsets.UTF_8));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 недоступен в JVM", e);
    }
  }
}
