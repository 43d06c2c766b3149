package com.thermo.service;

import com.thermo.model.TelemetrySample;

/**
 * Сервис приёма телеметрии от термостатов.
 * <p>
 * Проверяет запрос (учётные данные, лимит частоты, квота, тело), сохраняет замер
 * и запускает проверку оповещений.
 */
public interface TelemetryService {

  /**
   * Обрабатывает входящую телеметрию.
   *
   * @param authorization Значение заголовка Authorization.
   * @param body Тело запроса (JSON).
   * @param remoteAddress Адрес соединения, только для логов.
   * @return Сохранённый замер с идентификатором и временем приёма.
   * @throws com.thermo.pipeline.IngestionException если запрос отклонён или хранилище недоступно.
   */
  TelemetrySample ingest(String authorization, String body, String remoteAddress);
}
