package com.thermo.alert;

import com.thermo.db.AlertSettingsDao;
import com.thermo.db.UserDao;
import com.thermo.model.AlertDirection;
import com.thermo.model.AlertSettings;
import com.thermo.model.Device;
import com.thermo.model.TelemetrySample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Сравнивает сохранённый замер с порогами устройства и решает, отправлять ли оповещение.
 * <p>
 * Оба направления проверяются независимо для каждого замера, у каждого свой cooldown.
 * Время замера для cooldown берётся из времени приёма, назначенного хранилищем.
 * Нарушение порога в состоянии COOLING молча поглощается.
 */
public class AlertEvaluator {

  private static final Logger logger = LoggerFactory.getLogger(AlertEvaluator.class);

  private final AlertSettingsDao alertSettingsDao;
  private final UserDao userDao;
  private final AlertStateStore stateStore;
  private final Notifier notifier;

  public AlertEvaluator(AlertSettingsDao alertSettingsDao, UserDao userDao,
                        AlertStateStore stateStore, Notifier notifier) {
    this.alertSettingsDao = alertSettingsDao;
    this.userDao = userDao;
    this.stateStore = stateStore;
    this.notifier = notifier;
  }

  /**
   * Проверяет замер и отправляет оповещения по сработавшим направлениям.
   *
   * @param device Устройство, приславшее замер.
   * @param sample Уже сохранённый замер (с временем приёма).
   * @return Направления, по которым оповещение было отправлено.
   */
  public List<AlertDirection> evaluate(Device device, TelemetrySample sample) {
    List<AlertDirection> fired = new ArrayList<>();

    Optional<AlertSettings> found = alertSettingsDao.find(device.getSerialNumber());
    if (found.isEmpty() || !found.get().isEnabled()) {
      return fired;
    }
    AlertSettings settings = found.get();

    List<AlertDirection> breached = new ArrayList<>();
    for (AlertDirection direction : AlertDirection.values()) {
      if (settings.isDirectionEnabled(direction)
          && direction.isBreachedBy(sample.getTempInsideC(), settings.getThreshold(direction))) {
        breached.add(direction);
      }
    }
    if (breached.isEmpty()) {
      return fired;
    }

    Optional<String> recipient = resolveRecipient(device, settings);
    if (recipient.isEmpty()) {
      logger.warn("Нет адреса для оповещений устройства {}", device.getSerialNumber());
      return fired;
    }

    Duration cooldown = Duration.ofMinutes(settings.getCooldownMinutes());
    for (AlertDirection direction : breached) {
      if (!stateStore.tryFire(device.getSerialNumber(), direction, sample.getReceivedAt(), cooldown)) {
        logger.debug("Оповещение {} устройства {} подавлено cooldown", direction, device.getSerialNumber());
        continue;
      }
      fired.add(direction);
      notifier.dispatch(new AlertNotification(
          device.getSerialNumber(),
          device.getLabel(),
          direction,
          sample.getTempInsideC(),
          settings.getThreshold(direction),
          recipient.get(),
          sample.getId(),
          sample.getReceivedAt()
      ));
      logger.info("🔔 Сработало оповещение {} устройства {}: {}°C (порог {}°C)",
          direction, device.getSerialNumber(), sample.getTempInsideC(), settings.getThreshold(direction));
    }
    return fired;
  }

  private Optional<String> resolveRecipient(Device device, AlertSettings settings) {
    if (settings.getCustomEmail() != null && !settings.getCustomEmail().isBlank()) {
      return Optional.of(settings.getCustomEmail());
    }
    return userDao.findContactEmail(device.getOwnerId());
  }
}
