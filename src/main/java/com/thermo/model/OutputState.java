package com.thermo.model;

/**
 * Состояние исполнительного выхода термостата (что устройство решило включить).
 */
public enum OutputState {
  HEAT_ON,
  COOL_ON,
  OFF
}
