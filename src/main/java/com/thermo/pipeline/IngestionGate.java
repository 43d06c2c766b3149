package com.thermo.pipeline;

/**
 * Один шаг проверки входящего замера перед записью.
 * <p>
 * Шлюз не меняет постоянное состояние: он читает данные и дополняет контекст.
 * Отказ любого шлюза прерывает конвейер.
 */
public interface IngestionGate {

  GateResult check(IngestionContext context);
}
