package com.thermo.config;

/**
 * Физические диапазоны, которые сервер принимает в телеметрии и в настройках оповещений.
 * Границы включаются.
 */
public class ValidationLimits {

  private final double tempMin;
  private final double tempMax;
  private final double setpointMin;
  private final double setpointMax;
  private final double hysteresisMin;
  private final double hysteresisMax;
  private final int cooldownMaxMinutes;

  public ValidationLimits(double tempMin, double tempMax, double setpointMin, double setpointMax,
                          double hysteresisMin, double hysteresisMax, int cooldownMaxMinutes) {
    this.tempMin = tempMin;
    this.tempMax = tempMax;
    this.setpointMin = setpointMin;
    this.setpointMax = setpointMax;
    this.hysteresisMin = hysteresisMin;
    this.hysteresisMax = hysteresisMax;
    this.cooldownMaxMinutes = cooldownMaxMinutes;
  }

  /**
   * Читает диапазоны из {@link Config}.
   */
  public static ValidationLimits fromConfig() {
    return new ValidationLimits(
        Config.getDouble("validation.temp.min", -50),
        Config.getDouble("validation.temp.max", 100),
        Config.getDouble("validation.setpoint.min", 5),
        Config.getDouble("validation.setpoint.max", 35),
        Config.getDouble("validation.hysteresis.min", 0.1),
        Config.getDouble("validation.hysteresis.max", 5.0),
        Config.getInt("validation.cooldown.max-minutes", 10080)
    );
  }

  public boolean isTemperatureInRange(double value) {
    return Double.isFinite(value) && value >= tempMin && value <= tempMax;
  }

  public boolean isSetpointInRange(double value) {
    return Double.isFinite(value) && value >= setpointMin && value <= setpointMax;
  }

  public boolean isHysteresisInRange(double value) {
    return Double.isFinite(value) && value >= hysteresisMin && value <= hysteresisMax;
  }

  public double getTempMin() {
    return tempMin;
  }

  public double getTempMax() {
    return tempMax;
  }

  public double getSetpointMin() {
    return setpointMin;
  }

  public double getSetpointMax() {
    return setpointMax;
  }

  public double getHysteresisMin() {
    return hysteresisMin;
  }

  public double getHysteresisMax() {
    return hysteresisMax;
  }

  public int getCooldownMaxMinutes() {
    return cooldownMaxMinutes;
  }
}
