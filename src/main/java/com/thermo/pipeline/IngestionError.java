package com.thermo.pipeline;

/**
 * Причины отказа в приёме телеметрии, с HTTP-статусом и машинным кодом ответа.
 */
public enum IngestionError {
  /** Неизвестный серийный номер или неверный секрет; различие наружу не сообщается. */
  AUTHENTICATION_FAILURE(401, "invalid_credentials"),
  /** Временный отказ: устройство должно подождать и повторить. */
  RATE_LIMIT_EXCEEDED(429, "rate_limit_exceeded"),
  /** Не исчезает до смены тарифа или пересчёта объёма; немедленный повтор бесполезен. */
  QUOTA_EXCEEDED(403, "storage_limit_exceeded"),
  /** Ошибка в теле запроса; повтор того же запроса бесполезен. */
  VALIDATION_FAILURE(400, "invalid_payload"),
  /** Инфраструктурный сбой хранилища; можно повторить с задержкой. */
  STORAGE_UNAVAILABLE(503, "storage_unavailable");

  private final int httpStatus;
  private final String code;

  IngestionError(int httpStatus, String code) {
    this.httpStatus = httpStatus;
    this.code = code;
  }

  public int getHttpStatus() {
    return httpStatus;
  }

  public String getCode() {
    return code;
  }
}
