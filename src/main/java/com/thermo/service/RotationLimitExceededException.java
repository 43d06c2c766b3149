package com.thermo.service;

/**
 * Слишком частая смена ключа устройства.
 */
public class RotationLimitExceededException extends RuntimeException {

  public RotationLimitExceededException(String message) {
    super(message);
  }
}
