package com.productvideo.matching.embedding;

import com.productvideo.matching.embedding.db.EmbeddingRepository;
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
 * Entry point for the embedding service.
 *
 * <p>Consumes masked product images and keyframes from the
 * {@code product_video_matching} TOPIC exchange, stores their embeddings and
 * publishes {@code image.embeddings.completed} / {@code video.embeddings.completed}
 * once a job's batch is done or its watermark expires.
 */
public class EmbeddingServiceApplication {
    private static final Logger LOGGER = LogManager.getLogger(EmbeddingServiceApplication.class);

    public static void main(String[] args) throws Exception {
        ensureLogsDirectory();
        EnvConfig env = EnvConfig.load();
        String serviceName = env.get("SERVICE_NAME", HealthHandler.SERVICE);

        ProgressSettings settings = ProgressSettings.fromEnv(env);
        LOGGER.info("Progress settings: {}", settings);
        DatabaseConfig database = DatabaseConfig.fromEnv(env);

        RabbitMQEventBus bus = new RabbitMQEventBus(BrokerConfig.fromEnv(env), serviceName);
        ScheduledExecutorService watermarks = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, serviceName + "-watermark");
            t.setDaemon(true);
            return t;
        });
        JobProgressManager progress = new JobProgressManager(bus, settings, watermarks);

        VisionEmbeddingService service = new VisionEmbeddingService(
                new EmbeddingRepository(database), new EmbeddingExtractor(), progress, bus);
        service.register(bus);

        int port = env.getInt("EMBEDDING_PORT", 8083);
        Javalin app = startApp(port, progress);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOGGER.info("Shutdown: stopping embedding service...");
            app.stop();
            progress.cleanupAll();
            watermarks.shutdownNow();
            try {
                bus.close();
            } catch (Exception e) {
                LOGGER.warn("Error closing bus", e);
            }
        }));

        LOGGER.info("Embedding service ready, waiting for masked assets...");
        Thread.currentThread().join();
    }

    static Javalin createApp(JobProgressManager progress) {
        Javalin app = Javalin.create();

        // GET /health, liveness and tracked streams
        app.get("/health", new HealthHandler(progress)::health);

        // GET /jobs, in-flight job progress
        app.get("/jobs", ctx -> ctx.json(Map.of("jobs", progress.snapshot())));

        return app;
    }

    static Javalin startApp(int port, JobProgressManager progress) {
        Javalin app = createApp(progress);
        LOGGER.info("Starting embedding HTTP server on port {}", port);
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
