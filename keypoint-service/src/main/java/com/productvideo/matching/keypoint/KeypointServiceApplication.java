package com.productvideo.matching.keypoint;

import com.productvideo.matching.keypoint.db.KeypointRepository;
import com.productvideo.matching.shared.bus.RabbitMQEventBus;
import com.productvideo.matching.shared.config.BrokerConfig;
import com.productvideo.matching.shared.config.DatabaseConfig;
import com.productvideo.matching.shared.config.EnvConfig;
import com.productvideo.matching.vision.progress.JobProgressManager;
import com.productvideo.matching.vision.progress.ProgressSettings;
import io.javalin.Javalin;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Entry point for the keypoint service. Mirrors the embedding service but
 * works on unmasked images and emits {@code *.keypoints.completed}.
 */
public class KeypointServiceApplication {
    private static final Logger LOGGER = LogManager.getLogger(KeypointServiceApplication.class);

    public static void main(String[] args) throws Exception {
        ensureLogsDirectory();
        EnvConfig env = EnvConfig.load();
        String serviceName = env.get("SERVICE_NAME", HealthHandler.SERVICE);

        ProgressSettings settings = ProgressSettings.fromEnv(env);
        DatabaseConfig database = DatabaseConfig.fromEnv(env);
        Path dataRoot = Path.of(env.get("KEYPOINT_DATA_ROOT", "data"));
        LOGGER.info("Progress settings: {}, keypoint data root: {}", settings, dataRoot.toAbsolutePath());

        RabbitMQEventBus bus = new RabbitMQEventBus(BrokerConfig.fromEnv(env), serviceName);
        ScheduledExecutorService watermarks = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, serviceName + "-watermark");
            t.setDaemon(true);
            return t;
        });
        JobProgressManager progress = new JobProgressManager(bus, settings, watermarks);

        KeypointExtractor extractor = new KeypointExtractor(dataRoot);
        new VisionKeypointService(new KeypointRepository(database), extractor, progress, bus)
                .register(bus);

        Javalin app = startApp(env.getInt("KEYPOINT_PORT", 8084), progress, extractor.getKeypointDir());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOGGER.info("Shutdown: stopping keypoint service...");
            app.stop();
            progress.cleanupAll();
            watermarks.shutdownNow();
            try {
                bus.close();
            } catch (Exception e) {
                LOGGER.warn("Error closing bus", e);
            }
        }));

        LOGGER.info("Keypoint service ready");
        Thread.currentThread().join();
    }

    static Javalin createApp(JobProgressManager progress, Path keypointDir) {
        Javalin app = Javalin.create();
        app.get("/health", new HealthHandler(progress, keypointDir)::health);
        app.get("/jobs", ctx -> ctx.json(Map.of("jobs", progress.snapshot())));
        return app;
    }

    static Javalin startApp(int port, JobProgressManager progress, Path keypointDir) {
        Javalin app = createApp(progress, keypointDir);
        LOGGER.info("Starting keypoint HTTP server on port {}", port);
        app.start(port);
        return app;
    }

    private static void ensureLogsDirectory() {
        try {
            Files.createDirectories(Path.of("logs"));
        } catch (IOException e) {
            LOGGER.warn("Failed to create logs directory", e);
        }
    }
}
