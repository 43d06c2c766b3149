package com.thermo.service;

import com.thermo.config.ValidationLimits;
import com.thermo.db.AlertSettingsDao;
import com.thermo.model.AlertSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Чтение и изменение настроек оповещений устройства.
 */
public class AlertSettingsService {

  private static final Logger logger = LoggerFactory.getLogger(AlertSettingsService.class);

  private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");

  private final AlertSettingsDao alertSettingsDao;
  private final ValidationLimits limits;

  public AlertSettingsService(AlertSettingsDao alertSettingsDao, ValidationLimits limits) {
    this.alertSettingsDao = alertSettingsDao;
    this.limits = limits;
  }

  /**
   * @return Сохранённые настройки или настройки по умолчанию (оповещения выключены).
   */
  public AlertSettings get(String deviceSerial) {
    return alertSettingsDao.find(deviceSerial).orElseGet(() -> AlertSettings.defaults(deviceSerial));
  }

  /**
   * Проверяет и сохраняет настройки. Пустой адрес получателя сбрасывается на адрес владельца.
   *
   * @throws IllegalArgumentException со списком всех нарушений.
   */
  public AlertSettings update(AlertSettings settings) {
    if (settings == null || settings.getDeviceSerial() == null) {
      throw new IllegalArgumentException("Alert settings must name a device");
    }
    if (settings.getCustomEmail() != null) {
      String email = settings.getCustomEmail().trim();
      settings.setCustomEmail(email.isEmpty() ? null : email);
    }

    List<String> errors = validate(settings);
    if (!errors.isEmpty()) {
      throw new IllegalArgumentException(String.join("; ", errors));
    }

    alertSettingsDao.save(settings);
    logger.info("Настройки оповещений устройства {} обновлены (enabled={})",
        settings.getDeviceSerial(), settings.isEnabled());
    return settings;
  }

  List<String> validate(AlertSettings settings) {
    List<String> errors = new ArrayList<>();
    if (!limits.isTemperatureInRange(settings.getHighThresholdC())) {
      errors.add("high threshold is outside the physical range");
    }
    if (!limits.isTemperatureInRange(settings.getLowThresholdC())) {
      errors.add("low threshold is outside the physical range");
    }
    if (settings.isHighEnabled() && settings.isLowEnabled()
        && settings.getLowThresholdC() >= settings.getHighThresholdC()) {
      errors.add("low threshold must be below high threshold");
    }
    if (settings.getCooldownMinutes() < 1 || settings.getCooldownMinutes() > limits.getCooldownMaxMinutes()) {
      errors.add("cooldown must be between 1 and " + limits.getCooldownMaxMinutes() + " minutes");
    }
    if (settings.getCustomEmail() != null && !EMAIL.matcher(settings.getCustomEmail()).matches()) {
      errors.add("custom email is not a valid address");
    }
    return errors;
  }
}
