package com.thermo.model;

/**
 * Результат выпуска учётных данных: запись и открытый секрет.
 * Секрет возвращается вызывающему ровно один раз и нигде не сохраняется.
 */
public class IssuedCredential {

  private final DeviceCredential credential;
  private final String secret;

  public IssuedCredential(DeviceCredential credential, String secret) {
    this.credential = credential;
    this.secret = secret;
  }

  public DeviceCredential getCredential() {
    return credential;
  }

  public String getSecret() {
    return secret;
  }

  /**
   * Значение для заголовка {@code Authorization: Device <serial>:<secret>}.
   */
  public String toAuthorizationValue() {
    return "Device " + credential.getDeviceSerial() + ":" + secret;
  }
}
