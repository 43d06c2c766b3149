package com.thermo.model;

/**
 * Режим работы термостата, сообщаемый устройством.
 */
public enum OperatingMode {
  OFF,
  HEAT,
  COOL,
  AUTO
}
