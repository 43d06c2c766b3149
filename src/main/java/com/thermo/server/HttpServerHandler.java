package com.thermo.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.thermo.model.TelemetrySample;
import com.thermo.pipeline.IngestionException;
import com.thermo.service.TelemetryService;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.*;
import io.netty.util.CharsetUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Обработчик HTTP-запросов для приёма телеметрии от термостатов.
 * <p>
 * Делегирует обработку сервису {@link TelemetryService} и переводит отказы
 * в HTTP-статус и JSON-тело вида {@code {"error": код, "detail": описание}}.
 * Выполняется на отдельной группе потоков, поэтому может блокироваться на БД.
 */
public class HttpServerHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

  private static final Logger logger = LoggerFactory.getLogger(HttpServerHandler.class);

  static final String INGEST_PATH = "/telemetry/ingest";
  static final String HEALTH_PATH = "/health";

  private final TelemetryService telemetryService;
  private final ObjectMapper objectMapper;

  /**
   * Конструктор обработчика.
   *
   * @param telemetryService Сервис приёма телеметрии.
   * @param objectMapper Сериализация ответов.
   */
  public HttpServerHandler(TelemetryService telemetryService, ObjectMapper objectMapper) {
    this.telemetryService = telemetryService;
    this.objectMapper = objectMapper;
  }

  @Override
  protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request) {
    String path = stripQuery(request.uri());
    HttpMethod method = request.method();
    logger.debug("📥 {} {}", method, path);

    FullHttpResponse response;
    if (INGEST_PATH.equals(path)) {
      if (method == HttpMethod.POST) {
        response = handleIngest(ctx, request);
      } else {
        response = errorResponse(HttpResponseStatus.METHOD_NOT_ALLOWED, "method_not_allowed", "Use POST");
        response.headers().set(HttpHeaderNames.ALLOW, HttpMethod.POST.name());
      }
    } else if (HEALTH_PATH.equals(path) && method == HttpMethod.GET) {
      response = createJsonResponse(HttpResponseStatus.OK, Map.of("status", "ok"));
    } else {
      response = errorResponse(HttpResponseStatus.NOT_FOUND, "not_found", "No route for " + method + " " + path);
    }

    ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
  }

  private FullHttpResponse handleIngest(ChannelHandlerContext ctx, FullHttpRequest request) {
    String authorization = request.headers().get(HttpHeaderNames.AUTHORIZATION);
    String body = request.content().toString(CharsetUtil.UTF_8);
    try {
      TelemetrySample stored = telemetryService.ingest(authorization, body, remoteAddress(ctx));
      Map<String, Object> result = new LinkedHashMap<>();
      result.put("status", "ok");
      result.put("id", stored.getId());
      result.put("server_ts", stored.getReceivedAt().toString());
      return createJsonResponse(HttpResponseStatus.OK, result);
    } catch (IngestionException e) {
      return errorResponse(HttpResponseStatus.valueOf(e.getError().getHttpStatus()),
          e.getError().getCode(), e.getMessage());
    } catch (RuntimeException e) {
      logger.error("❌ Непредвиденная ошибка при приёме телеметрии", e);
      return errorResponse(HttpResponseStatus.INTERNAL_SERVER_ERROR, "internal_error", "Processing failed");
    }
  }

  private FullHttpResponse errorResponse(HttpResponseStatus status, String code, String detail) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("error", code);
    body.put("detail", detail);
    return createJsonResponse(status, body);
  }

  private FullHttpResponse createJsonResponse(HttpResponseStatus status, Map<String, ?> body) {
    String json;
    try {
      json = objectMapper.writeValueAsString(body);
    } catch (JsonProcessingException e) {
      logger.error("❌ Не удалось сериализовать ответ", e);
      status = HttpResponseStatus.INTERNAL_SERVER_ERROR;
      json = "{\"error\":\"internal_error\"}";
    }
    FullHttpResponse res = new DefaultFullHttpResponse(
        HttpVersion.HTTP_1_1,
        status,
        Unpooled.copiedBuffer(json, CharsetUtil.UTF_8)
    );
    res.headers().set(HttpHeaderNames.CONTENT_TYPE, "application/json; charset=UTF-8");
    res.headers().set(HttpHeaderNames.CONTENT_LENGTH, res.content().readableBytes());
    return res;
  }

  private static String stripQuery(String uri) {
    int q = uri.indexOf('?');
    return q >= 0 ? uri.substring(0, q) : uri;
  }

  private static String remoteAddress(ChannelHandlerContext ctx) {
    Channel channel = ctx.channel();
    if (channel == null || channel.remoteAddress() == null) {
      return "unknown";
    }
    return channel.remoteAddress().toString();
  }

  @Override
  public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
    logger.error("❌ Ошибка канала", cause);
    ctx.close();
  }
}
