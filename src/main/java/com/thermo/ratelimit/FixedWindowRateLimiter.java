package com.thermo.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Ограничение частоты запросов фиксированным окном: не больше {@code capacity}
 * допущенных запросов на ключ за окно.
 * <p>
 * Счётчики сгруппированы по номеру окна. Новое окно начинается с новых счётчиков,
 * явного сброса нет; прошедшие окна удаляет {@link #purgeExpired()}.
 * <p>
 * Известное ограничение фиксированного окна: серия запросов на стыке двух окон
 * может получить почти {@code 2 * capacity} допусков за время, равное одному окну.
 */
public class FixedWindowRateLimiter {

  private static final Logger logger = LoggerFactory.getLogger(FixedWindowRateLimiter.class);

  private final int capacity;
  private final long windowMillis;
  private final Clock clock;
  private final ConcurrentMap<Long, ConcurrentMap<String, AtomicInteger>> windows = new ConcurrentHashMap<>();

  /**
   * @param capacity Допустимое число запросов на ключ за окно.
   * @param window Длительность окна.
   * @param clock Источник времени.
   */
  public FixedWindowRateLimiter(int capacity, Duration window, Clock clock) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive: " + capacity);
    }
    if (window.isZero() || window.isNegative()) {
      throw new IllegalArgumentException("window must be positive: " + window);
    }
    this.capacity = capacity;
    this.windowMillis = window.toMillis();
    this.clock = clock;
  }

  /**
   * Учитывает попытку и сообщает, допущена ли она.
   * Инкремент атомарен: из двух одновременных попыток за последнее место проходит одна.
   */
  public boolean tryAcquire(String key) {
    long window = currentWindow();
    AtomicInteger counter = windows
        .computeIfAbsent(window, w -> new ConcurrentHashMap<>())
        .computeIfAbsent(key, k -> new AtomicInteger());
    return counter.incrementAndGet() <= capacity;
  }

  /**
   * Удаляет счётчики всех окон, предшествующих текущему.
   */
  public void purgeExpired() {
    long current = currentWindow();
    int before = windows.size();
    windows.keySet().removeIf(window -> window < current);
    int removed = before - windows.size();
    if (removed > 0) {
      logger.debug("Удалено {} устаревших окон rate limit", removed);
    }
  }

  public int getCapacity() {
    return capacity;
  }

  public Duration getWindow() {
    return Duration.ofMillis(windowMillis);
  }

  private long currentWindow() {
    return Math.floorDiv(clock.millis(), windowMillis);
  }
}
