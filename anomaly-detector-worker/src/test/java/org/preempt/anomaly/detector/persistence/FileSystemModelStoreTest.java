package org.preempt.anomaly.detector.persistence;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.typesafe.config.ConfigFactory;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.preempt.anomaly.datamodel.codec.ObjectMapperProvider;
import org.preempt.anomaly.detector.forest.IsolationForest;
import org.preempt.anomaly.detector.forest.IsolationForestModel;

class FileSystemModelStoreTest {
  private static final IsolationForestModel MODEL =
      new IsolationForest(5, 256, 0.05, 42).fit(new double[] {1, 2, 3, 4, 50});

  @TempDir Path directory;

  private FileSystemModelStore newStore(String naming) {
    FileSystemModelStore modelStore = new FileSystemModelStore();
    modelStore.init(
        ConfigFactory.parseMap(
            Map.of(
                FileSystemModelStore.PATH_CONFIG,
                directory.toString(),
                FileSystemModelStore.NAMING_CONFIG,
                naming)));
    return modelStore;
  }

  private static ModelArtifact artifact(String jobId, String metricType) {
    return ModelArtifact.builder()
        .metricType(metricType)
        .jobId(jobId)
        .location("Berlin")
        .trainedAt(Instant.parse("2024-05-01T10:00:00Z"))
        .sampleCount(5)
        .ensembleSize(5)
        .maxSamples(256)
        .contamination(0.05)
        .randomSeed(42)
        .model(MODEL)
        .build();
  }

  @Test
  void testSaveByMetricType() throws ModelPersistenceException, IOException {
    FileSystemModelStore modelStore = newStore("metric-type");

    assertEquals("temperature_model", modelStore.save(artifact("job-1", "temperature")));
    assertEquals("temperature_model", modelStore.save(artifact("job-2", "temperature")));

    Path slot = directory.resolve("temperature_model.json");
    JsonNode saved = ObjectMapperProvider.get().readTree(slot.toFile());
    // the later job overwrote the earlier one
    assertEquals("job-2", saved.get("job_id").textValue());
    assertEquals("temperature", saved.get("metric_type").textValue());
    assertEquals("2024-05-01T10:00:00Z", saved.get("trained_at").textValue());
    assertEquals(5, saved.get("sample_count").intValue());
    assertEquals(MODEL.getOffset(), saved.get("model").get("offset").doubleValue());
    assertEquals(5, saved.get("model").get("trees").size());
    assertTrue(saved.get("model").get("trees").get(0).get("root").has("size"));
    try (Stream<Path> files = Files.list(directory)) {
      assertEquals(1, files.count());
    }
  }

  @Test
  void testSaveByJobAndMetricType() throws ModelPersistenceException {
    FileSystemModelStore modelStore = newStore("job-and-metric-type");

    assertEquals("job-1/wind_speed_model", modelStore.save(artifact("job-1", "wind_speed")));
    modelStore.save(artifact("job-2", "wind_speed"));

    assertTrue(Files.exists(directory.resolve("job-1/wind_speed_model.json")));
    assertTrue(Files.exists(directory.resolve("job-2/wind_speed_model.json")));
  }

  @Test
  void testSlotNamesAreSanitized() throws ModelPersistenceException {
    FileSystemModelStore modelStore = newStore("job-and-metric-type");

    String slot = modelStore.save(artifact("../escape", "wind speed/gust"));

    assertEquals("%2E.%2Fescape/wind%20speed%2Fgust_model", slot);
    assertTrue(Files.exists(directory.resolve("%2E.%2Fescape/wind%20speed%2Fgust_model.json")));
  }

  @Test
  void testDistinctMetricTypesGetDistinctSlots() throws ModelPersistenceException, IOException {
    FileSystemModelStore modelStore = newStore("metric-type");

    String spaced = modelStore.save(artifact("job-1", "wind speed"));
    String underscored = modelStore.save(artifact("job-2", "wind_speed"));
    String percent = modelStore.save(artifact("job-3", "wind%20speed"));

    assertEquals("wind%20speed_model", spaced);
    assertEquals("wind_speed_model", underscored);
    assertEquals("wind%2520speed_model", percent);
    JsonNode saved =
        ObjectMapperProvider.get().readTree(directory.resolve(spaced + ".json").toFile());
    assertEquals("wind speed", saved.get("metric_type").textValue());
    try (Stream<Path> files = Files.list(directory)) {
      assertEquals(3, files.count());
    }
  }

  @Test
  void testConcurrentWritesLeaveCompleteSlot() throws Exception {
    FileSystemModelStore modelStore = newStore("metric-type");
    ExecutorService executor = Executors.newFixedThreadPool(4);
    List<Future<String>> writes = new ArrayList<>();
    try {
      for (int i = 0; i < 16; i++) {
        String jobId = "job-" + i;
        writes.add(executor.submit(() -> modelStore.save(artifact(jobId, "humidity"))));
      }
      for (Future<String> write : writes) {
        write.get();
      }
    } finally {
      executor.shutdown();
    }

    JsonNode saved =
        ObjectMapperProvider.get().readTree(directory.resolve("humidity_model.json").toFile());
    assertTrue(saved.get("job_id").textValue().startsWith("job-"));
    try (Stream<Path> files = Files.list(directory)) {
      assertEquals(1, files.count());
    }
  }

  @Test
  void testWriteFailure() throws IOException {
    Files.writeString(directory.resolve("blocked"), "not a directory");
    FileSystemModelStore modelStore = new FileSystemModelStore();
    modelStore.init(
        ConfigFactory.parseMap(
            Map.of(FileSystemModelStore.PATH_CONFIG, directory.resolve("blocked").toString())));

    assertThrows(
        ModelPersistenceException.class, () -> modelStore.save(artifact("job-1", "temperature")));
  }

  @Test
  void testProvider() {
    ModelStore modelStore =
        ModelStoreProvider.getModelStore(
            ConfigFactory.parseString(
                "type = fs\nfs { path = \"" + directory.toString().replace("\\", "/") + "\" }"));

    assertTrue(modelStore instanceof FileSystemModelStore);
    assertEquals(
        directory.toAbsolutePath(), ((FileSystemModelStore) modelStore).getDirectory());
    assertThrows(
        IllegalArgumentException.class,
        () -> ModelStoreProvider.getModelStore(ConfigFactory.parseString("type = s3")));
    assertFalse(Files.exists(directory.resolve("temperature_model.json")));
  }
}
