package com.thermo.alert;

import com.thermo.model.AlertDirection;

import java.time.Instant;
import java.util.Locale;

/**
 * Сработавшее оповещение: снимок замера, порог и адресат.
 */
public class AlertNotification {

  private final String deviceSerial;
  private final String deviceLabel;
  private final AlertDirection direction;
  private final double temperatureC;
  private final double thresholdC;
  private final String recipient;
  private final long sampleId;
  private final Instant firedAt;

  public AlertNotification(String deviceSerial, String deviceLabel, AlertDirection direction,
                           double temperatureC, double thresholdC, String recipient,
                           long sampleId, Instant firedAt) {
    this.deviceSerial = deviceSerial;
    this.deviceLabel = deviceLabel;
    this.direction = direction;
    this.temperatureC = temperatureC;
    this.thresholdC = thresholdC;
    this.recipient = recipient;
    this.sampleId = sampleId;
    this.firedAt = firedAt;
  }

  public String getSubject() {
    String kind = direction == AlertDirection.HIGH ? "High" : "Low";
    return kind + " Temperature Alert - " + deviceLabel;
  }

  public String getMessage() {
    String kind = direction == AlertDirection.HIGH ? "High" : "Low";
    String explanation = direction == AlertDirection.HIGH
        ? "The temperature has exceeded your configured high threshold."
        : "The temperature has dropped below your configured low threshold.";
    return String.format(Locale.ROOT,
        "Temperature alert for your thermostat device.%n%n"
            + "Device: %s%n"
            + "Current Temperature: %.1f°C%n"
            + "%s Threshold: %.1f°C%n%n"
            + "%s",
        deviceLabel, temperatureC, kind, thresholdC, explanation);
  }

  public String getDeviceSerial() {
    return deviceSerial;
  }

  public String getDeviceLabel() {
    return deviceLabel;
  }

  public AlertDirection getDirection() {
    return direction;
  }

  public double getTemperatureC() {
    return temperatureC;
  }

  public double getThresholdC() {
    return thresholdC;
  }

  public String getRecipient() {
    return recipient;
  }

  public long getSampleId() {
    return sampleId;
  }

  public Instant getFiredAt() {
    return firedAt;
  }
}
