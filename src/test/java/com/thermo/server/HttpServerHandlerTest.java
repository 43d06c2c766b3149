package com.thermo.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.thermo.model.OperatingMode;
import com.thermo.model.OutputState;
import com.thermo.model.TelemetrySample;
import com.thermo.pipeline.IngestionError;
import com.thermo.pipeline.IngestionException;
import com.thermo.service.TelemetryService;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelPromise;
import io.netty.handler.codec.http.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Модульные тесты для HttpServerHandler.
 * <p>
 * Проверяют HTTP-уровень: маршрутизацию, передачу заголовка и тела в сервис,
 * перевод отказов в статусы. Сервис приёма замокан.
 */
class HttpServerHandlerTest {

  private static final String BODY = "{\"mode\":\"HEAT\",\"setpoint_c\":21.0,\"temp_inside_c\":19.5}";

  @Mock
  private TelemetryService telemetryService;

  @Mock
  private ChannelHandlerContext ctx;

  @Mock
  private ChannelPromise channelPromise;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private HttpServerHandler handler;

  @BeforeEach
  void setUp() {
    MockitoAnnotations.openMocks(this);
    handler = new HttpServerHandler(telemetryService, objectMapper);

    // Настраиваем моки так, чтобы ctx.writeAndFlush не падал
    when(ctx.writeAndFlush(any())).thenReturn(channelPromise);
    when(channelPromise.addListener(any())).thenReturn(channelPromise);
  }

  private FullHttpRequest ingestRequest(String body, String authorization) {
    FullHttpRequest request = new DefaultFullHttpRequest(
        HttpVersion.HTTP_1_1,
        HttpMethod.POST,
        "/telemetry/ingest",
        Unpooled.wrappedBuffer(body.getBytes(StandardCharsets.UTF_8))
    );
    request.headers().set(HttpHeaderNames.CONTENT_LENGTH, body.length());
    request.headers().set(HttpHeaderNames.CONTENT_TYPE, "application/json");
    if (authorization != null) {
      request.headers().set(HttpHeaderNames.AUTHORIZATION, authorization);
    }
    return request;
  }

  private FullHttpResponse captureResponse() {
    ArgumentCaptor<FullHttpResponse> responseCaptor = ArgumentCaptor.forClass(FullHttpResponse.class);
    verify(ctx).writeAndFlush(responseCaptor.capture());
    return responseCaptor.getValue();
  }

  private JsonNode json(FullHttpResponse response) throws Exception {
    return objectMapper.readTree(response.content().toString(StandardCharsets.UTF_8));
  }

  @Test
  @DisplayName("Валидный POST /telemetry/ingest → заголовок и тело переданы в сервис, 200 с id")
  void shouldPassHeaderAndBodyToService() throws Exception {
    // Given
    Instant receivedAt = Instant.parse("2024-06-01T12:00:00.123456Z");
    TelemetrySample stored = new TelemetrySample(42L, "TH-1", OperatingMode.HEAT, 21.0, 19.5, null, null, 0.5,
        OutputState.OFF, null, receivedAt, BODY);
    when(telemetryService.ingest(eq("Device TH-1:secret"), eq(BODY), anyString())).thenReturn(stored);

    // When
    handler.channelRead0(ctx, ingestRequest(BODY, "Device TH-1:secret"));

    // Then
    FullHttpResponse response = captureResponse();
    assertThat(response.status()).isEqualTo(HttpResponseStatus.OK);
    assertThat(response.headers().get(HttpHeaderNames.CONTENT_TYPE)).isEqualTo("application/json; charset=UTF-8");
    JsonNode body = json(response);
    assertThat(body.get("status").asText()).isEqualTo("ok");
    assertThat(body.get("id").asLong()).isEqualTo(42L);
    assertThat(body.get("server_ts").asText()).isEqualTo("2024-06-01T12:00:00.123456Z");
  }

  @Test
  @DisplayName("Отказы сервиса переводятся в HTTP-статус и код ошибки")
  void shouldMapIngestionErrorsToStatus() throws Exception {
    for (IngestionError error : IngestionError.values()) {
      reset(ctx);
      when(ctx.writeAndFlush(any())).thenReturn(channelPromise);
      doThrow(new IngestionException(error, "detail for " + error))
          .when(telemetryService).ingest(any(), anyString(), anyString());

      handler.channelRead0(ctx, ingestRequest(BODY, "Device TH-1:secret"));

      FullHttpResponse response = captureResponse();
      assertThat(response.status().code()).isEqualTo(error.getHttpStatus());
      JsonNode body = json(response);
      assertThat(body.get("error").asText()).isEqualTo(error.getCode());
      assertThat(body.get("detail").asText()).isEqualTo("detail for " + error);
    }
  }

  @Test
  @DisplayName("Нет заголовка Authorization → в сервис передаётся null")
  void shouldPassMissingAuthorizationAsNull() {
    when(telemetryService.ingest(any(), anyString(), anyString()))
        .thenThrow(new IngestionException(IngestionError.AUTHENTICATION_FAILURE, "Missing or invalid Authorization header"));

    handler.channelRead0(ctx, ingestRequest(BODY, null));

    verify(telemetryService).ingest(isNull(), eq(BODY), anyString());
    assertThat(captureResponse().status()).isEqualTo(HttpResponseStatus.UNAUTHORIZED);
  }

  @Test
  @DisplayName("Непредвиденная ошибка сервиса → 500")
  void shouldReturn500OnUnexpectedFailure() throws Exception {
    when(telemetryService.ingest(any(), anyString(), anyString())).thenThrow(new IllegalStateException("boom"));

    handler.channelRead0(ctx, ingestRequest(BODY, "Device TH-1:secret"));

    FullHttpResponse response = captureResponse();
    assertThat(response.status()).isEqualTo(HttpResponseStatus.INTERNAL_SERVER_ERROR);
    assertThat(json(response).get("error").asText()).isEqualTo("internal_error");
  }

  @Test
  @DisplayName("GET /telemetry/ingest → 405 с заголовком Allow")
  void shouldReturn405ForWrongMethod() {
    FullHttpRequest request = new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.GET, "/telemetry/ingest");

    handler.channelRead0(ctx, request);

    FullHttpResponse response = captureResponse();
    assertThat(response.status()).isEqualTo(HttpResponseStatus.METHOD_NOT_ALLOWED);
    assertThat(response.headers().get(HttpHeaderNames.ALLOW)).isEqualTo("POST");
    verifyNoInteractions(telemetryService);
  }

  @Test
  @DisplayName("Строка запроса не мешает маршрутизации")
  void shouldIgnoreQueryString() {
    when(telemetryService.ingest(any(), anyString(), anyString()))
        .thenThrow(new IngestionException(IngestionError.VALIDATION_FAILURE, "bad"));
    FullHttpRequest request = new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.POST,
        "/telemetry/ingest?v=2", Unpooled.wrappedBuffer("{}".getBytes(StandardCharsets.UTF_8)));

    handler.channelRead0(ctx, request);

    assertThat(captureResponse().status()).isEqualTo(HttpResponseStatus.BAD_REQUEST);
  }

  @Test
  @DisplayName("GET /health → 200")
  void shouldAnswerHealth() throws Exception {
    handler.channelRead0(ctx, new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.GET, "/health"));

    FullHttpResponse response = captureResponse();
    assertThat(response.status()).isEqualTo(HttpResponseStatus.OK);
    assertThat(json(response).get("status").asText()).isEqualTo("ok");
  }

  @Test
  @DisplayName("Неверный URI → 404 Not Found")
  void shouldReturn404ForUnknownPath() throws Exception {
    FullHttpRequest request = new DefaultFullHttpRequest(
        HttpVersion.HTTP_1_1,
        HttpMethod.POST,
        "/telemetry",
        Unpooled.EMPTY_BUFFER
    );

    handler.channelRead0(ctx, request);

    FullHttpResponse response = captureResponse();
    assertThat(response.status()).isEqualTo(HttpResponseStatus.NOT_FOUND);
    assertThat(json(response).get("error").asText()).isEqualTo("not_found");
  }
}
