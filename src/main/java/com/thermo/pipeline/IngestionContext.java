package com.thermo.pipeline;

import com.thermo.model.Device;
import com.thermo.model.StorageProfile;
import com.thermo.model.TelemetrySample;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Состояние одного запроса на приём, передаваемое через все шлюзы.
 * <p>
 * Заполняется по мере прохождения: устройство появляется после проверки учётных данных,
 * профиль хранения после проверки квоты, проверенный замер после проверки тела.
 * Принадлежит одному рабочему потоку, синхронизация не нужна.
 */
public class IngestionContext {

  private final String authorization;
  private final String body;
  private final String remoteAddress;
  private final Instant arrivedAt;
  private final List<String> validationErrors = new ArrayList<>();

  private Device device;
  private StorageProfile storageProfile;
  private TelemetrySample sample;
  private String deviceIp;

  /**
   * @param authorization Значение заголовка Authorization (может быть {@code null}).
   * @param body Тело запроса.
   * @param remoteAddress Адрес соединения, только для логов.
   * @param arrivedAt Время поступления запроса; не путать со временем приёма замера.
   */
  public IngestionContext(String authorization, String body, String remoteAddress, Instant arrivedAt) {
    this.authorization = authorization;
    this.body = body;
    this.remoteAddress = remoteAddress;
    this.arrivedAt = arrivedAt;
  }

  public String getAuthorization() {
    return authorization;
  }

  public String getBody() {
    return body;
  }

  public String getRemoteAddress() {
    return remoteAddress;
  }

  public Instant getArrivedAt() {
    return arrivedAt;
  }

  public Device getDevice() {
    return device;
  }

  public void setDevice(Device device) {
    this.device = device;
  }

  public StorageProfile getStorageProfile() {
    return storageProfile;
  }

  public void setStorageProfile(StorageProfile storageProfile) {
    this.storageProfile = storageProfile;
  }

  /**
   * @return Проверенный замер без идентификатора и времени приёма.
   */
  public TelemetrySample getSample() {
    return sample;
  }

  public void setSample(TelemetrySample sample) {
    this.sample = sample;
  }

  public String getDeviceIp() {
    return deviceIp;
  }

  public void setDeviceIp(String deviceIp) {
    this.deviceIp = deviceIp;
  }

  public void addValidationError(String error) {
    validationErrors.add(error);
  }

  public List<String> getValidationErrors() {
    return Collections.unmodifiableList(validationErrors);
  }
}
