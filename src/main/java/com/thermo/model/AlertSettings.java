package com.thermo.model;

/**
 * Настройки температурных оповещений устройства. Редактируются пользователем.
 */
public class AlertSettings {

  public static final double DEFAULT_HIGH_THRESHOLD_C = 30.0;
  public static final double DEFAULT_LOW_THRESHOLD_C = 10.0;
  public static final int DEFAULT_COOLDOWN_MINUTES = 30;

  private String deviceSerial;
  private boolean enabled;
  private boolean highEnabled;
  private double highThresholdC = DEFAULT_HIGH_THRESHOLD_C;
  private boolean lowEnabled;
  private double lowThresholdC = DEFAULT_LOW_THRESHOLD_C;
  private int cooldownMinutes = DEFAULT_COOLDOWN_MINUTES;
  private String customEmail;

  public AlertSettings() {}

  /**
   * Настройки по умолчанию: оповещения выключены.
   */
  public static AlertSettings defaults(String deviceSerial) {
    AlertSettings settings = new AlertSettings();
    settings.setDeviceSerial(deviceSerial);
    return settings;
  }

  public String getDeviceSerial() {
    return deviceSerial;
  }

  public void setDeviceSerial(String deviceSerial) {
    this.deviceSerial = deviceSerial;
  }

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public boolean isHighEnabled() {
    return highEnabled;
  }

  public void setHighEnabled(boolean highEnabled) {
    this.highEnabled = highEnabled;
  }

  public double getHighThresholdC() {
    return highThresholdC;
  }

  public void setHighThresholdC(double highThresholdC) {
    this.highThresholdC = highThresholdC;
  }

  public boolean isLowEnabled() {
    return lowEnabled;
  }

  public void setLowEnabled(boolean lowEnabled) {
    this.lowEnabled = lowEnabled;
  }

  public double getLowThresholdC() {
    return lowThresholdC;
  }

  public void setLowThresholdC(double lowThresholdC) {
    this.lowThresholdC = lowThresholdC;
  }

  public int getCooldownMinutes() {
    return cooldownMinutes;
  }

  public void setCooldownMinutes(int cooldownMinutes) {
    this.cooldownMinutes = cooldownMinutes;
  }

  public String getCustomEmail() {
    return customEmail;
  }

  public void setCustomEmail(String customEmail) {
    this.customEmail = customEmail;
  }

  public boolean isDirectionEnabled(AlertDirection direction) {
    return direction == AlertDirection.HIGH ? highEnabled : lowEnabled;
  }

  public double getThreshold(AlertDirection direction) {
    return direction == AlertDirection.HIGH ? highThresholdC : lowThresholdC;
  }
}
