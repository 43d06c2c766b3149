package com.thermo.server;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Тело запроса POST /telemetry/ingest.
 * Используется для десериализации JSON; проверка значений выполняется отдельно.
 * <p>
 * Серийный номер в теле не принимается: устройство определяется по заголовку Authorization.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class TelemetryRequest {

  private String mode;
  @JsonProperty("setpoint_c")
  private Double setpointC;
  @JsonProperty("temp_inside_c")
  private Double tempInsideC;
  @JsonProperty("temp_outside_c")
  private Double tempOutsideC;
  @JsonProperty("humidity_percent")
  private Double humidityPercent;
  @JsonProperty("hysteresis_c")
  private Double hysteresisC;
  private String output;
  @JsonProperty("device_ip")
  private String deviceIp;
  private String timestamp;

  /**
   * Конструктор по умолчанию. Обязателен для работы с Jackson.
   */
  public TelemetryRequest() {}

  /**
   * @return Режим работы: OFF, HEAT, COOL или AUTO.
   */
  public String getMode() {
    return mode;
  }

  public void setMode(String mode) {
    this.mode = mode;
  }

  /**
   * @return Уставка в градусах Цельсия.
   */
  public Double getSetpointC() {
    return setpointC;
  }

  public void setSetpointC(Double setpointC) {
    this.setpointC = setpointC;
  }

  /**
   * @return Температура в помещении в градусах Цельсия.
   */
  public Double getTempInsideC() {
    return tempInsideC;
  }

  public void setTempInsideC(Double tempInsideC) {
    this.tempInsideC = tempInsideC;
  }

  public Double getTempOutsideC() {
    return tempOutsideC;
  }

  public void setTempOutsideC(Double tempOutsideC) {
    this.tempOutsideC = tempOutsideC;
  }

  public Double getHumidityPercent() {
    return humidityPercent;
  }

  public void setHumidityPercent(Double humidityPercent) {
    this.humidityPercent = humidityPercent;
  }

  public Double getHysteresisC() {
    return hysteresisC;
  }

  public void setHysteresisC(Double hysteresisC) {
    this.hysteresisC = hysteresisC;
  }

  /**
   * @return Состояние выхода: HEAT_ON, COOL_ON или OFF.
   */
  public String getOutput() {
    return output;
  }

  public void setOutput(String output) {
    this.output = output;
  }

  /**
   * @return Локальный IP-адрес устройства, если оно его сообщило.
   */
  public String getDeviceIp() {
    return deviceIp;
  }

  public void setDeviceIp(String deviceIp) {
    this.deviceIp = deviceIp;
  }

  /**
   * @return Время замера по часам устройства, ISO-8601.
   */
  public String getTimestamp() {
    return timestamp;
  }

  public void setTimestamp(String timestamp) {
    this.timestamp = timestamp;
  }
}
