package com.thermo.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.thermo.alert.AlertEvaluator;
import com.thermo.alert.AlertStateStore;
import com.thermo.alert.HttpNotifier;
import com.thermo.alert.InMemoryAlertStateStore;
import com.thermo.config.Config;
import com.thermo.config.ValidationLimits;
import com.thermo.db.AlertSettingsDao;
import com.thermo.db.AlertStateDao;
import com.thermo.db.DatabaseConnection;
import com.thermo.db.DeviceCredentialDao;
import com.thermo.db.DeviceDao;
import com.thermo.db.StorageProfileDao;
import com.thermo.db.TelemetryDao;
import com.thermo.db.UserDao;
import com.thermo.pipeline.CredentialGate;
import com.thermo.pipeline.IngestionPipeline;
import com.thermo.pipeline.PayloadGate;
import com.thermo.pipeline.QuotaGate;
import com.thermo.pipeline.RateLimitGate;
import com.thermo.ratelimit.FixedWindowRateLimiter;
import com.thermo.security.CredentialVerifier;
import com.thermo.security.SecretHasher;
import com.thermo.service.DeviceProvisioningService;
import com.thermo.service.StorageUsageRecalculator;
import com.thermo.service.TelemetryQueryService;
import com.thermo.service.TelemetryService;
import com.thermo.service.TelemetryServiceImpl;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.EventExecutorGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Главный класс приложения. Запускает HTTP-сервер приёма телеметрии на Netty.
 */
public class HttpServer {

  private static final Logger logger = LoggerFactory.getLogger(HttpServer.class);

  private static final int MAX_CONTENT_LENGTH = 65536;

  private final int port;
  private final TelemetryService telemetryService;
  private final int workerThreads;
  private final ObjectMapper objectMapper = new ObjectMapper();

  private volatile Channel serverChannel;

  /**
   * Конструктор HTTP-сервера.
   *
   * @param port Порт, на котором будет работать сервер.
   * @param telemetryService Сервис приёма телеметрии.
   * @param workerThreads Число потоков для блокирующей обработки запросов.
   */
  public HttpServer(int port, TelemetryService telemetryService, int workerThreads) {
    this.port = port;
    this.telemetryService = telemetryService;
    this.workerThreads = workerThreads;
  }

  /**
   * Запускает сервер и ожидает завершения.
   *
   * @throws Exception если произошла ошибка при запуске.
   */
  public void start() throws Exception {
    EventLoopGroup bossGroup = new NioEventLoopGroup(1);
    EventLoopGroup workerGroup = new NioEventLoopGroup();
    EventExecutorGroup handlerGroup = new DefaultEventExecutorGroup(workerThreads);
    try {
      ServerBootstrap b = new ServerBootstrap();
      b.group(bossGroup, workerGroup)
          .channel(NioServerSocketChannel.class)
          .childHandler(new ChannelInitializer<SocketChannel>() {
            @Override
            public void initChannel(SocketChannel ch) {
              ch.pipeline()
                  .addLast(new HttpServerCodec())
                  .addLast(new HttpObjectAggregator(MAX_CONTENT_LENGTH))
                  .addLast(handlerGroup, new HttpServerHandler(telemetryService, objectMapper));
            }
          })
          .option(ChannelOption.SO_BACKLOG, 128)
          .childOption(ChannelOption.SO_KEEPALIVE, true);

      ChannelFuture f = b.bind(port).sync();
      serverChannel = f.channel();
      logger.info("🚀 Сервер запущен на http://localhost:{}", port);
      f.channel().closeFuture().sync();
    } finally {
      handlerGroup.shutdownGracefully();
      workerGroup.shutdownGracefully();
      bossGroup.shutdownGracefully();
    }
  }

  /**
   * Закрывает серверный канал; {@link #start()} после этого возвращает управление.
   */
  public void stop() {
    Channel channel = serverChannel;
    if (channel != null) {
      channel.close();
    }
  }

  /**
   * Собирает сервис приёма телеметрии из настроек {@link Config}.
   *
   * @param clock Источник времени для всех компонентов.
   * @param telemetryLimiter Лимит частоты приёма на устройство.
   */
  public static TelemetryService createTelemetryService(Clock clock, FixedWindowRateLimiter telemetryLimiter) {
    TelemetryDao telemetryDao = new TelemetryDao(clock);
    DeviceDao deviceDao = new DeviceDao();
    StorageProfileDao storageProfileDao = new StorageProfileDao();

    HttpNotifier notifier = new HttpNotifier(
        HttpClient.newHttpClient(),
        URI.create(Config.getRequiredProperty("notify.service.url")),
        Duration.ofSeconds(Config.getLong("notify.timeout-seconds", 5)),
        Config.getProperty("notify.from", "alerts@thermo.local")
    );
    AlertEvaluator alertEvaluator = new AlertEvaluator(
        new AlertSettingsDao(), new UserDao(), createAlertStateStore(), notifier);

    CredentialVerifier verifier = new CredentialVerifier(
        new DeviceCredentialDao(), deviceDao, new SecretHasher(), clock);
    IngestionPipeline pipeline = new IngestionPipeline(List.of(
        new CredentialGate(verifier),
        new RateLimitGate(telemetryLimiter),
        new QuotaGate(storageProfileDao),
        new PayloadGate(new ObjectMapper(), ValidationLimits.fromConfig())
    ));

    return new TelemetryServiceImpl(pipeline, telemetryDao, deviceDao, storageProfileDao, alertEvaluator, clock);
  }

  /**
   * Лимит частоты приёма из настроек {@link Config}.
   */
  public static FixedWindowRateLimiter createTelemetryLimiter(Clock clock) {
    return new FixedWindowRateLimiter(
        Config.getInt("ratelimit.telemetry.capacity", 60),
        Duration.ofSeconds(Config.getLong("ratelimit.telemetry.window-seconds", 60)),
        clock
    );
  }

  /**
   * Лимит смен ключа на устройство из настроек {@link Config}.
   */
  public static FixedWindowRateLimiter createRotationLimiter(Clock clock) {
    return new FixedWindowRateLimiter(
        Config.getInt("ratelimit.key-rotation.capacity", 5),
        Duration.ofSeconds(Config.getLong("ratelimit.key-rotation.window-seconds", 3600)),
        clock
    );
  }

  /**
   * Сервис регистрации устройств и выпуска ключей. Срок действия ключа берётся из {@code credential.ttl-days}.
   */
  public static DeviceProvisioningService createProvisioningService(Clock clock,
                                                                    FixedWindowRateLimiter rotationLimiter) {
    return new DeviceProvisioningService(new DeviceDao(), new DeviceCredentialDao(), new StorageProfileDao(),
        new SecretHasher(), rotationLimiter, credentialTtl(), clock);
  }

  public static TelemetryQueryService createQueryService(TelemetryDao telemetryDao) {
    return new TelemetryQueryService(telemetryDao, Config.getInt("query.recent.max", 1000));
  }

  static Duration credentialTtl() {
    long days = Config.getLong("credential.ttl-days", 365);
    if (days < 1) {
      throw new IllegalStateException("credential.ttl-days должен быть положительным: " + days);
    }
    return Duration.ofDays(days);
  }

  static AlertStateStore createAlertStateStore() {
    String backend = Config.getProperty("alert.state.backend", "jdbc");
    switch (backend) {
      case "jdbc":
        return new AlertStateDao();
      case "memory":
        logger.warn("Состояние оповещений хранится в памяти: cooldown сбрасывается при перезапуске");
        return new InMemoryAlertStateStore();
      default:
        throw new IllegalStateException("Неизвестное значение alert.state.backend: " + backend);
    }
  }

  /**
   * Точка входа в приложение.
   * Инициализирует БД, запускает фоновые задачи и сервер.
   *
   * @param args Аргументы командной строки (не используются).
   * @throws Exception если произошла ошибка при запуске.
   */
  public static void main(String[] args) throws Exception {
    DatabaseConnection.initializeDatabase();

    Clock clock = Clock.systemUTC();
    FixedWindowRateLimiter telemetryLimiter = createTelemetryLimiter(clock);
    TelemetryService telemetryService = createTelemetryService(clock, telemetryLimiter);

    StorageUsageRecalculator recalculator =
        new StorageUsageRecalculator(new TelemetryDao(clock), new StorageProfileDao(), clock);
    long recomputeMinutes = Config.getLong("quota.recompute-interval-minutes", 15);
    ScheduledExecutorService scheduler = Executors.newScheduledThreadPool(1);
    scheduler.scheduleAtFixedRate(recalculator, 0, recomputeMinutes, TimeUnit.MINUTES);
    long windowSeconds = telemetryLimiter.getWindow().getSeconds();
    scheduler.scheduleAtFixedRate(telemetryLimiter::purgeExpired, windowSeconds, windowSeconds, TimeUnit.SECONDS);

    HttpServer server = new HttpServer(
        Config.getInt("server.port", 8081),
        telemetryService,
        Config.getInt("server.worker-threads", 16)
    );
    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
      logger.info("Остановка сервера");
      scheduler.shutdownNow();
      server.stop();
    }));
    server.start();
  }
}
