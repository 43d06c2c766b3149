package com.thermo.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.thermo.db.AlertSettingsDao;
import com.thermo.db.DatabaseConnection;
import com.thermo.db.DeviceDao;
import com.thermo.db.StorageProfileDao;
import com.thermo.db.TelemetryDao;
import com.thermo.db.UserDao;
import com.thermo.model.AlertSettings;
import com.thermo.model.StoragePlan;
import com.thermo.model.TelemetrySample;
import com.thermo.service.DeviceProvisioningService;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.*;
import io.netty.util.CharsetUtil;
import org.junit.jupiter.api.*;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Полный путь запроса: Netty, шлюзы, PostgreSQL и мок шлюза уведомлений.
 */
@Testcontainers(disabledWithoutDocker = true)
class HttpServerIntegrationTest {

  @Container
  private static final PostgreSQLContainer<?> postgres =
      new PostgreSQLContainer<>("postgres:15")
          .withDatabaseName("thermo_db")
          .withUsername("thermo_user")
          .withPassword("thermo_pass");

  private static final int RATE_CAPACITY = 3;

  private static HttpServer server;
  private static Thread serverThread;
  private static int serverPort;
  private static Channel notifyMockChannel;
  private static EventLoopGroup bossGroup;
  private static EventLoopGroup workerGroup;
  private static final BlockingQueue<String> notifications = new LinkedBlockingQueue<>();

  private static final ObjectMapper objectMapper = new ObjectMapper();
  private static final HttpClient client = HttpClient.newHttpClient();

  private final UserDao userDao = new UserDao();
  private final DeviceDao deviceDao = new DeviceDao();
  private final StorageProfileDao storageProfileDao = new StorageProfileDao();
  private final TelemetryDao telemetryDao = new TelemetryDao(Clock.systemUTC());
  private final DeviceProvisioningService provisioning = HttpServer.createProvisioningService(
      Clock.systemUTC(), HttpServer.createRotationLimiter(Clock.systemUTC()));

  private static int freePort() throws IOException {
    try (var socket = new java.net.ServerSocket(0)) {
      return socket.getLocalPort();
    }
  }

  @BeforeAll
  static void setUp() throws Exception {
    // Настройка БД через системные свойства
    System.setProperty("db.url", postgres.getJdbcUrl());
    System.setProperty("db.user", postgres.getUsername());
    System.setProperty("db.password", postgres.getPassword());
    DatabaseConnection.initializeDatabase();

    // Запуск мока шлюза уведомлений
    int notifyPort = freePort();
    startNotifyMockServer(notifyPort);
    System.setProperty("notify.service.url", "http://127.0.0.1:" + notifyPort + "/notifications");
    System.setProperty("alert.state.backend", "jdbc");
    System.setProperty("ratelimit.telemetry.capacity", String.valueOf(RATE_CAPACITY));
    System.setProperty("ratelimit.telemetry.window-seconds", "3600");

    // Запуск основного сервера на случайном порту
    serverPort = freePort();
    Clock clock = Clock.systemUTC();
    server = new HttpServer(serverPort,
        HttpServer.createTelemetryService(clock, HttpServer.createTelemetryLimiter(clock)), 4);
    serverThread = new Thread(() -> {
      try {
        server.start();
      } catch (Exception e) {
        throw new IllegalStateException(e);
      }
    });
    serverThread.setDaemon(true);
    serverThread.start();
    awaitHealthy();
  }

  private static void awaitHealthy() throws Exception {
    long deadline = System.currentTimeMillis() + 10_000;
    while (System.currentTimeMillis() < deadline) {
      try {
        HttpResponse<String> resp = client.send(
            HttpRequest.newBuilder(URI.create("http://localhost:" + serverPort + "/health")).GET().build(),
            HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() == 200) {
          return;
        }
      } catch (IOException e) {
        Thread.sleep(100); // сервер ещё не слушает порт
      }
    }
    throw new IllegalStateException("Сервер не запустился");
  }

  private static void startNotifyMockServer(int port) throws Exception {
    bossGroup = new NioEventLoopGroup(1);
    workerGroup = new NioEventLoopGroup();
    var bootstrap = new ServerBootstrap();
    bootstrap.group(bossGroup, workerGroup)
        .channel(NioServerSocketChannel.class)
        .childHandler(new ChannelInitializer<SocketChannel>() {
          @Override
          protected void initChannel(SocketChannel ch) {
            ch.pipeline().addLast(
                new HttpServerCodec(),
                new HttpObjectAggregator(65536),
                new SimpleChannelInboundHandler<FullHttpRequest>() {
                  @Override
                  protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
                    if (req.method() == HttpMethod.POST && req.uri().equals("/notifications")) {
                      notifications.add(req.content().toString(CharsetUtil.UTF_8));
                    }
                    FullHttpResponse resp = new DefaultFullHttpResponse(
                        HttpVersion.HTTP_1_1,
                        HttpResponseStatus.OK,
                        Unpooled.copiedBuffer("{\"status\":\"queued\"}", CharsetUtil.UTF_8)
                    );
                    resp.headers().set(HttpHeaderNames.CONTENT_TYPE, "application/json");
                    resp.headers().set(HttpHeaderNames.CONTENT_LENGTH, resp.content().readableBytes());
                    ctx.writeAndFlush(resp);
                  }
                }
            );
          }
        });
    notifyMockChannel = bootstrap.bind(port).sync().channel();
  }

  @AfterAll
  static void tearDown() {
    if (server != null) server.stop();
    if (notifyMockChannel != null) notifyMockChannel.close();
    if (bossGroup != null) bossGroup.shutdownGracefully();
    if (workerGroup != null) workerGroup.shutdownGracefully();
  }

  @BeforeEach
  void clearNotifications() {
    notifications.clear();
  }

  /**
   * Регистрирует устройство нового владельца и возвращает значение заголовка Authorization.
   */
  private String provision(String serial, String ownerEmail) {
    long ownerId = userDao.createUser("Владелец " + serial, ownerEmail);
    provisioning.registerDevice(ownerId, serial, "Термостат " + serial);
    return provisioning.issueCredential(ownerId, serial).toAuthorizationValue();
  }

  private static String newSerial() {
    return "TH-" + UUID.randomUUID().toString().substring(0, 8);
  }

  private HttpResponse<String> ingest(String authorization, String json) throws Exception {
    HttpRequest.Builder builder = HttpRequest.newBuilder()
        .uri(URI.create("http://localhost:" + serverPort + "/telemetry/ingest"))
        .header("Content-Type", "application/json")
        .POST(HttpRequest.BodyPublishers.ofString(json));
    if (authorization != null) {
      builder.header("Authorization", authorization);
    }
    return client.send(builder.build(), HttpResponse.BodyHandlers.ofString());
  }

  private static String payload(double tempInside) {
    return "{\"mode\":\"HEAT\",\"setpoint_c\":21.0,\"temp_inside_c\":" + tempInside
        + ",\"output\":\"HEAT_ON\",\"device_ip\":\"192.168.1.40\",\"timestamp\":\"2024-06-01T12:00:00Z\"}";
  }

  @Test
  @DisplayName("Валидная телеметрия → 200, замер в БД, время контакта обновлено")
  void shouldStoreValidTelemetry() throws Exception {
    String serial = newSerial();
    String auth = provision(serial, "owner@example.com");

    HttpResponse<String> resp = ingest(auth, payload(20.5));

    assertThat(resp.statusCode()).isEqualTo(200);
    JsonNode body = objectMapper.readTree(resp.body());
    assertThat(body.get("status").asText()).isEqualTo("ok");
    long id = body.get("id").asLong();

    List<TelemetrySample> recent = telemetryDao.findRecent(serial, 10);
    assertThat(recent).hasSize(1);
    assertThat(recent.get(0).getId()).isEqualTo(id);
    assertThat(recent.get(0).getTempInsideC()).isEqualTo(20.5);
    assertThat(recent.get(0).getReceivedAt().toString()).isEqualTo(body.get("server_ts").asText());
    assertThat(deviceDao.findBySerial(serial).orElseThrow().getLastIp()).isEqualTo("192.168.1.40");
  }

  @Test
  @DisplayName("Неверный секрет и неизвестный серийный номер → одинаковый ответ 401")
  void shouldRejectBadCredentialsUniformly() throws Exception {
    String serial = newSerial();
    provision(serial, "owner@example.com");

    HttpResponse<String> wrongSecret = ingest("Device " + serial + ":wrong", payload(20.0));
    HttpResponse<String> unknownSerial = ingest("Device TH-NOPE:wrong", payload(20.0));
    HttpResponse<String> missing = ingest(null, payload(20.0));

    assertThat(wrongSecret.statusCode()).isEqualTo(401);
    assertThat(unknownSerial.statusCode()).isEqualTo(401);
    assertThat(wrongSecret.body()).isEqualTo(unknownSerial.body());
    assertThat(missing.statusCode()).isEqualTo(401);
    assertThat(telemetryDao.findRecent(serial, 10)).isEmpty();
  }

  @Test
  @DisplayName("Запрос сверх лимита частоты → 429, замер не сохранён")
  void shouldRateLimitPerDevice() throws Exception {
    String serial = newSerial();
    String auth = provision(serial, "owner@example.com");

    for (int i = 0; i < RATE_CAPACITY; i++) {
      assertThat(ingest(auth, payload(20.0)).statusCode()).isEqualTo(200);
    }
    HttpResponse<String> limited = ingest(auth, payload(20.0));

    assertThat(limited.statusCode()).isEqualTo(429);
    assertThat(limited.body()).contains("rate_limit_exceeded");
    assertThat(telemetryDao.findRecent(serial, 10)).hasSize(RATE_CAPACITY);
  }

  @Test
  @DisplayName("Квота исчерпана → 403, сохранённые данные по-прежнему читаются")
  void shouldRejectOverQuota() throws Exception {
    String serial = newSerial();
    String auth = provision(serial, "owner@example.com");
    assertThat(ingest(auth, payload(20.0)).statusCode()).isEqualTo(200);
    long ownerId = deviceDao.findBySerial(serial).orElseThrow().getOwnerId();
    storageProfileDao.updateUsage(ownerId, StoragePlan.FREE.getLimitBytes(), Instant.now());

    HttpResponse<String> resp = ingest(auth, payload(21.0));

    assertThat(resp.statusCode()).isEqualTo(403);
    assertThat(resp.body()).contains("storage_limit_exceeded");
    assertThat(telemetryDao.findRange(serial, Instant.EPOCH, Instant.now().plusSeconds(60))).hasSize(1);
  }

  @Test
  @DisplayName("Невалидное тело → 400 со списком ошибок")
  void shouldRejectInvalidPayload() throws Exception {
    String serial = newSerial();
    String auth = provision(serial, "owner@example.com");

    HttpResponse<String> resp = ingest(auth, "{\"mode\":\"WARP\",\"setpoint_c\":21.0}");

    assertThat(resp.statusCode()).isEqualTo(400);
    JsonNode body = objectMapper.readTree(resp.body());
    assertThat(body.get("error").asText()).isEqualTo("invalid_payload");
    assertThat(body.get("detail").asText()).contains("mode").contains("temp_inside_c");
    assertThat(telemetryDao.findRecent(serial, 10)).isEmpty();
  }

  @Test
  @DisplayName("Превышение порога → одно оповещение в шлюз, повтор внутри cooldown подавлен")
  void shouldNotifyOnceWithinCooldown() throws Exception {
    String serial = newSerial();
    String auth = provision(serial, "owner@example.com");
    AlertSettings settings = AlertSettings.defaults(serial);
    settings.setEnabled(true);
    settings.setHighEnabled(true);
    settings.setHighThresholdC(26.0);
    settings.setCooldownMinutes(10);
    new AlertSettingsDao().save(settings);

    assertThat(ingest(auth, payload(27.0)).statusCode()).isEqualTo(200);
    String notification = notifications.poll(5, TimeUnit.SECONDS);
    assertThat(ingest(auth, payload(28.0)).statusCode()).isEqualTo(200);

    assertThat(notification).isNotNull();
    JsonNode json = objectMapper.readTree(notification);
    assertThat(json.get("to").asText()).isEqualTo("owner@example.com");
    assertThat(json.get("subject").asText()).isEqualTo("High Temperature Alert - Термостат " + serial);
    assertThat(json.get("device_serial").asText()).isEqualTo(serial);
    assertThat(json.get("direction").asText()).isEqualTo("HIGH");
    assertThat(notifications.poll(1, TimeUnit.SECONDS)).isNull();
  }

  @Test
  @DisplayName("GET /health → 200")
  void shouldAnswerHealth() throws Exception {
    HttpResponse<String> resp = client.send(
        HttpRequest.newBuilder(URI.create("http://localhost:" + serverPort + "/health")).GET().build(),
        HttpResponse.BodyHandlers.ofString());

    assertThat(resp.statusCode()).isEqualTo(200);
    assertThat(resp.body()).contains("\"status\":\"ok\"");
  }
}
