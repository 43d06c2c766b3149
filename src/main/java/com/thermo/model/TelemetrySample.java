package com.thermo.model;

import java.time.Instant;

/**
 * Один замер телеметрии. Неизменяем после записи.
 * <p>
 * {@code receivedAt} назначается хранилищем в момент записи и определяет порядок замеров;
 * время устройства ({@code deviceTimestamp}) сохраняется только для справки.
 * До записи {@code id} и {@code receivedAt} равны {@code null}.
 */
public class TelemetrySample {

  private final Long id;
  private final String deviceSerial;
  private final OperatingMode mode;
  private final double setpointC;
  private final double tempInsideC;
  private final Double tempOutsideC;
  private final Double humidityPercent;
  private final double hysteresisC;
  private final OutputState output;
  private final Instant deviceTimestamp;
  private final Instant receivedAt;
  private final String rawPayload;

  public TelemetrySample(Long id, String deviceSerial, OperatingMode mode, double setpointC,
                         double tempInsideC, Double tempOutsideC, Double humidityPercent,
                         double hysteresisC, OutputState output, Instant deviceTimestamp,
                         Instant receivedAt, String rawPayload) {
    this.id = id;
    this.deviceSerial = deviceSerial;
    this.mode = mode;
    this.setpointC = setpointC;
    this.tempInsideC = tempInsideC;
    this.tempOutsideC = tempOutsideC;
    this.humidityPercent = humidityPercent;
    this.hysteresisC = hysteresisC;
    this.output = output;
    this.deviceTimestamp = deviceTimestamp;
    this.receivedAt = receivedAt;
    this.rawPayload = rawPayload;
  }

  /**
   * Возвращает копию замера с идентификатором и временем приёма, назначенными хранилищем.
   */
  public TelemetrySample withReceipt(long newId, Instant newReceivedAt) {
    return new TelemetrySample(newId, deviceSerial, mode, setpointC, tempInsideC, tempOutsideC,
        humidityPercent, hysteresisC, output, deviceTimestamp, newReceivedAt, rawPayload);
  }

  public Long getId() {
    return id;
  }

  public String getDeviceSerial() {
    return deviceSerial;
  }

  public OperatingMode getMode() {
    return mode;
  }

  public double getSetpointC() {
    return setpointC;
  }

  public double getTempInsideC() {
    return tempInsideC;
  }

  public Double getTempOutsideC() {
    return tempOutsideC;
  }

  public Double getHumidityPercent() {
    return humidityPercent;
  }

  public double getHysteresisC() {
    return hysteresisC;
  }

  public OutputState getOutput() {
    return output;
  }

  public Instant getDeviceTimestamp() {
    return deviceTimestamp;
  }

  public Instant getReceivedAt() {
    return receivedAt;
  }

  public String getRawPayload() {
    return rawPayload;
  }
}
