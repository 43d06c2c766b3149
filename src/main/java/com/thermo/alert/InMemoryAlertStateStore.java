package com.thermo.alert;

import com.thermo.model.AlertDirection;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Состояние cooldown в памяти процесса, для развёртывания на одном узле.
 * <p>
 * {@link ConcurrentHashMap#compute} блокирует только свой ключ: разные устройства
 * и разные направления друг друга не ждут.
 */
public class InMemoryAlertStateStore implements AlertStateStore {

  private final ConcurrentMap<String, Instant> lastFired = new ConcurrentHashMap<>();

  @Override
  public boolean tryFire(String deviceSerial, AlertDirection direction, Instant now, Duration cooldown) {
    boolean[] fired = new boolean[1];
    lastFired.compute(key(deviceSerial, direction), (k, previous) -> {
      if (previous == null || !now.isBefore(previous.plus(cooldown))) {
        fired[0] = true;
        return now;
      }
      return previous;
    });
    return fired[0];
  }

  @Override
  public Optional<Instant> lastFired(String deviceSerial, AlertDirection direction) {
    return Optional.ofNullable(lastFired.get(key(deviceSerial, direction)));
  }

  private static String key(String deviceSerial, AlertDirection direction) {
    return deviceSerial + "/" + direction.name();
  }
}
