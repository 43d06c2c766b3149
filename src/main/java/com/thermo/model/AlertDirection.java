package com.thermo.model;

/**
 * Направление порога оповещения. Состояние cooldown ведётся отдельно для каждого направления.
 */
public enum AlertDirection {
  HIGH,
  LOW;

  /**
   * Проверяет, нарушает ли температура порог в этом направлении.
   * Граница включается: ровно пороговое значение считается нарушением.
   */
  public boolean isBreachedBy(double temperatureC, double thresholdC) {
    return this == HIGH ? temperatureC >= thresholdC : temperatureC <= thresholdC;
  }
}
