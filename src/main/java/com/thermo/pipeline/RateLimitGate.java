package com.thermo.pipeline;

import com.thermo.ratelimit.FixedWindowRateLimiter;

/**
 * Ограничивает частоту приёма по аутентифицированному устройству.
 * Стоит после проверки учётных данных: чужие запросы не расходуют лимит устройства.
 */
public class RateLimitGate implements IngestionGate {

  private final FixedWindowRateLimiter limiter;

  public RateLimitGate(FixedWindowRateLimiter limiter) {
    this.limiter = limiter;
  }

  @Override
  public GateResult check(IngestionContext context) {
    if (!limiter.tryAcquire(context.getDevice().getSerialNumber())) {
      return GateResult.reject(IngestionError.RATE_LIMIT_EXCEEDED, "Too many requests. Please try again later.");
    }
    return GateResult.admit();
  }
}
