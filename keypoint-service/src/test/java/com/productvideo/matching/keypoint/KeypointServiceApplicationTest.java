package com.productvideo.matching.keypoint;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.productvideo.matching.shared.bus.InMemoryEventBus;
import com.productvideo.matching.shared.events.AssetType;
import com.productvideo.matching.shared.events.PipelineStage;
import com.productvideo.matching.vision.progress.JobProgressManager;
import com.productvideo.matching.vision.progress.ProgressSettings;
import io.javalin.testtools.JavalinTest;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class KeypointServiceApplicationTest {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path dataRoot;

    private ScheduledExecutorService scheduler;
    private JobProgressManager progress;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        progress = new JobProgressManager(new InMemoryEventBus(), ProgressSettings.defaults(), scheduler);
    }

    @AfterEach
    void tearDown() {
        progress.cleanupAll();
        scheduler.shutdownNow();
    }

    @Test
    void health_reportsServiceName() {
        progress.onBatchAnnounced("J1", AssetType.IMAGE, "E1", 2, PipelineStage.KEYPOINTS);

        JavalinTest.test(KeypointServiceApplication.createApp(progress, dataRoot.resolve("kp")), (server, client) -> {
            var response = client.get("/health");
            assertEquals(200, response.code());
            JsonNode body = MAPPER.readTree(response.body().string());
            assertEquals("UP", body.get("status").asText());
            assertEquals("vision-keypoint", body.get("service").asText());
            assertEquals(1, body.get("tracked_streams").asInt());
            assertTrue(body.get("keypoint_dir_writable").asBoolean());
        });
    }

    @Test
    void health_downWhenKeypointDirCannotBeCreated() throws Exception {
        Path blocker = Files.writeString(dataRoot.resolve("blocker"), "not a directory");

        JavalinTest.test(KeypointServiceApplication.createApp(progress, blocker.resolve("kp")), (server, client) -> {
            var response = client.get("/health");
            assertEquals(503, response.code());
            JsonNode body = MAPPER.readTree(response.body().string());
            assertEquals("DOWN", body.get("status").asText());
            assertFalse(body.get("keypoint_dir_writable").asBoolean());
        });
    }

    @Test
    void jobs_listsTrackedKeys() {
        progress.onBatchAnnounced("J1", AssetType.VIDEO, "E1", 4, PipelineStage.KEYPOINTS);

        JavalinTest.test(KeypointServiceApplication.createApp(progress, dataRoot.resolve("kp")), (server, client) -> {
            JsonNode jobs = MAPPER.readTree(client.get("/jobs").body().string()).get("jobs");
            assertEquals(1, jobs.size());
            assertEquals("video", jobs.get(0).get("asset_type").asText());
            assertEquals("keypoints", jobs.get(0).get("stage").asText());
            assertEquals(4, jobs.get(0).get("expected").asInt());
        });
    }
}
