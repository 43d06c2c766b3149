package com.thermo.pipeline;

/**
 * Отказ в приёме телеметрии. Бросается сервисом по первому отказавшему шлюзу
 * или при сбое записи в хранилище.
 */
public class IngestionException extends RuntimeException {

  private final IngestionError error;

  public IngestionException(IngestionError error, String message) {
    super(message);
    this.error = error;
  }

  public IngestionException(IngestionError error, String message, Throwable cause) {
    super(message, cause);
    this.error = error;
  }

  public IngestionError getError() {
    return error;
  }
}
