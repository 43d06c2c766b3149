package com.thermo.alert;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Отправляет оповещения JSON-запросом в шлюз уведомлений (почтовый сервис).
 * <p>
 * Запрос асинхронный, с собственным таймаутом и без повторов: пропущенное оповещение
 * лучше, чем повторная рассылка в обход cooldown.
 */
public class HttpNotifier implements Notifier {

  private static final Logger logger = LoggerFactory.getLogger(HttpNotifier.class);

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final URI serviceUri;
  private final Duration timeout;
  private final String from;

  /**
   * @param httpClient HTTP-клиент для отправки в шлюз уведомлений.
   * @param serviceUri Адрес шлюза.
   * @param timeout Таймаут одного запроса.
   * @param from Адрес отправителя.
   */
  public HttpNotifier(HttpClient httpClient, URI serviceUri, Duration timeout, String from) {
    this.httpClient = httpClient;
    this.objectMapper = new ObjectMapper();
    this.serviceUri = serviceUri;
    this.timeout = timeout;
    this.from = from;
  }

  @Override
  public void dispatch(AlertNotification notification) {
    String body;
    try {
      body = objectMapper.writeValueAsString(toPayload(notification));
    } catch (JsonProcessingException e) {
      logger.error("❌ Не удалось сформировать оповещение {} для устройства {}",
          notification.getDirection(), notification.getDeviceSerial(), e);
      return;
    }

    HttpRequest request = HttpRequest.newBuilder()
        .uri(serviceUri)
        .header("Content-Type", "application/json")
        .POST(HttpRequest.BodyPublishers.ofString(body))
        .timeout(timeout)
        .build();

    try {
      httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
          .whenComplete((response, error) -> {
            if (error != null) {
              logger.error("❌ Оповещение {} для устройства {} не доставлено",
                  notification.getDirection(), notification.getDeviceSerial(), error);
            } else if (response.statusCode() >= 400) {
              logger.error("❌ Шлюз уведомлений вернул ошибку {} для устройства {}",
                  response.statusCode(), notification.getDeviceSerial());
            } else {
              logger.info("📧 Оповещение {} для устройства {} отправлено на {}",
                  notification.getDirection(), notification.getDeviceSerial(), notification.getRecipient());
            }
          });
    } catch (RuntimeException e) {
      logger.error("❌ Не удалось отправить оповещение для устройства {}", notification.getDeviceSerial(), e);
    }
  }

  private Map<String, Object> toPayload(AlertNotification notification) {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("from", from);
    payload.put("to", notification.getRecipient());
    payload.put("subject", notification.getSubject());
    payload.put("message", notification.getMessage());
    payload.put("device_serial", notification.getDeviceSerial());
    payload.put("direction", notification.getDirection().name());
    payload.put("temperature_c", notification.getTemperatureC());
    payload.put("threshold_c", notification.getThresholdC());
    payload.put("sample_id", notification.getSampleId());
    payload.put("fired_at", notification.getFiredAt().toString());
    return payload;
  }
}
