package com.thermo.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.thermo.config.ValidationLimits;
import com.thermo.model.OperatingMode;
import com.thermo.model.OutputState;
import com.thermo.model.TelemetrySample;
import com.thermo.server.TelemetryRequest;
import io.netty.util.NetUtil;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Разбирает и проверяет тело запроса. Все нарушения накапливаются в контексте
 * и возвращаются одним отказом.
 */
public class PayloadGate implements IngestionGate {

  static final double DEFAULT_HYSTERESIS_C = 0.5;

  private final ObjectMapper objectMapper;
  // тело сохраняется в колонку json целиком: хвост после объекта отклоняется
  private final ObjectReader strictReader;
  private final ValidationLimits limits;

  public PayloadGate(ObjectMapper objectMapper, ValidationLimits limits) {
    this.objectMapper = objectMapper;
    this.strictReader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    this.limits = limits;
  }

  @Override
  public GateResult check(IngestionContext context) {
    TelemetryRequest request;
    try {
      JsonNode root = strictReader.readTree(context.getBody() == null ? "" : context.getBody());
      if (root == null || !root.isObject()) {
        return GateResult.reject(IngestionError.VALIDATION_FAILURE, "Body must be a JSON object");
      }
      request = objectMapper.treeToValue(root, TelemetryRequest.class);
    } catch (JsonProcessingException e) {
      return GateResult.reject(IngestionError.VALIDATION_FAILURE, "Invalid JSON: " + e.getOriginalMessage());
    }

    OperatingMode mode = parseEnum(OperatingMode.class, "mode", request.getMode(), true, context);
    OutputState output = parseEnum(OutputState.class, "output", request.getOutput(), false, context);

    Double setpoint = request.getSetpointC();
    if (setpoint == null) {
      context.addValidationError("Missing required field: setpoint_c");
    } else if (!limits.isSetpointInRange(setpoint)) {
      context.addValidationError("setpoint_c must be between " + limits.getSetpointMin()
          + " and " + limits.getSetpointMax());
    }

    Double tempInside = request.getTempInsideC();
    if (tempInside == null) {
      context.addValidationError("Missing required field: temp_inside_c");
    } else if (!limits.isTemperatureInRange(tempInside)) {
      context.addValidationError("temp_inside_c is outside the physical range");
    }

    Double tempOutside = request.getTempOutsideC();
    if (tempOutside != null && !limits.isTemperatureInRange(tempOutside)) {
      context.addValidationError("temp_outside_c is outside the physical range");
    }

    Double humidity = request.getHumidityPercent();
    if (humidity != null && !(Double.isFinite(humidity) && humidity >= 0 && humidity <= 100)) {
      context.addValidationError("humidity_percent must be between 0 and 100");
    }

    double hysteresis = request.getHysteresisC() == null ? DEFAULT_HYSTERESIS_C : request.getHysteresisC();
    if (!limits.isHysteresisInRange(hysteresis)) {
      context.addValidationError("hysteresis_c must be between " + limits.getHysteresisMin()
          + " and " + limits.getHysteresisMax());
    }

    String deviceIp = request.getDeviceIp() == null ? null : request.getDeviceIp().trim();
    if (deviceIp != null && !isIpLiteral(deviceIp)) {
      context.addValidationError("device_ip must be an IPv4 or IPv6 address");
    }

    Instant deviceTimestamp = null;
    if (request.getTimestamp() != null) {
      deviceTimestamp = parseTimestamp(request.getTimestamp());
      if (deviceTimestamp == null) {
        context.addValidationError("timestamp must be an ISO-8601 date-time");
      }
    }

    if (!context.getValidationErrors().isEmpty()) {
      return GateResult.reject(IngestionError.VALIDATION_FAILURE, String.join("; ", context.getValidationErrors()));
    }

    context.setDeviceIp(deviceIp);
    context.setSample(new TelemetrySample(
        null,
        context.getDevice().getSerialNumber(),
        mode,
        setpoint,
        tempInside,
        tempOutside,
        humidity,
        hysteresis,
        output == null ? OutputState.OFF : output,
        deviceTimestamp,
        null,
        context.getBody()
    ));
    return GateResult.admit();
  }

  private static <E extends Enum<E>> E parseEnum(Class<E> type, String field, String value,
                                                 boolean required, IngestionContext context) {
    if (value == null || value.isBlank()) {
      if (required) {
        context.addValidationError("Missing required field: " + field);
      }
      return null;
    }
    try {
      return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      context.addValidationError("Unknown " + field + ": " + value);
      return null;
    }
  }

  private static Instant parseTimestamp(String value) {
    try {
      return OffsetDateTime.parse(value).toInstant();
    } catch (DateTimeParseException e) {
      // без смещения считаем время UTC
      try {
        return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
      } catch (DateTimeParseException ignored) {
        return null;
      }
    }
  }

  static boolean isIpLiteral(String value) {
    return NetUtil.isValidIpV4Address(value) || NetUtil.isValidIpV6Address(value);
  }
}
