package com.thermo.alert;

import com.thermo.model.AlertDirection;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Хранилище времени последнего срабатывания по ключу (устройство, направление).
 * <p>
 * Ключ находится в состоянии ARMED, если срабатываний не было или с последнего прошло
 * не меньше {@code cooldown}; иначе он в состоянии COOLING. Переход обратно в ARMED
 * вычисляется лениво при следующем замере, фоновых таймеров нет.
 */
public interface AlertStateStore {

  /**
   * Атомарно для одного ключа: если ключ в состоянии ARMED, записывает {@code now}
   * как время срабатывания и возвращает {@code true}; в состоянии COOLING ничего не меняет
   * и возвращает {@code false}.
   */
  boolean tryFire(String deviceSerial, AlertDirection direction, Instant now, Duration cooldown);

  Optional<Instant> lastFired(String deviceSerial, AlertDirection direction);
}
