package org.preempt.anomaly.detector.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.typesafe.config.Config;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.preempt.anomaly.datamodel.codec.ObjectMapperProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores each artifact as a JSON file {@code <path>/<slot>.json}.
 *
 * <p>Content is first written to a temporary file next to the slot and then moved over it, so a
 * slot always holds one complete artifact even when several writers target it; the last move
 * wins. Writers inside this process are additionally serialized per slot.
 */
public class FileSystemModelStore implements ModelStore {
  private static final Logger LOGGER = LoggerFactory.getLogger(FileSystemModelStore.class);

  static final String PATH_CONFIG = "path";
  static final String NAMING_CONFIG = "naming";
  private static final String SLOT_EXTENSION = ".json";
  private static final ConcurrentMap<Path, Object> SLOT_LOCKS = new ConcurrentHashMap<>();

  private final ObjectMapper objectMapper = ObjectMapperProvider.get();
  private Path directory;
  private SlotNaming slotNaming;

  @Override
  public void init(Config storeConfig) {
    this.directory = Paths.get(storeConfig.getString(PATH_CONFIG)).toAbsolutePath();
    this.slotNaming =
        storeConfig.hasPath(NAMING_CONFIG)
            ? SlotNaming.fromConfigValue(storeConfig.getString(NAMING_CONFIG))
            : SlotNaming.METRIC_TYPE;
    LOGGER.info("Model artifacts go to {} using {} slots", directory, slotNaming.getConfigValue());
  }

  @Override
  public String save(ModelArtifact artifact) throws ModelPersistenceException {
    String slotName = slotNaming.slotName(artifact.getJobId(), artifact.getMetricType());
    Path slot = directory.resolve(slotName + SLOT_EXTENSION);

    synchronized (SLOT_LOCKS.computeIfAbsent(slot, key -> new Object())) {
      try {
        Path parent = slot.getParent();
        Files.createDirectories(parent);
        Path temporary = Files.createTempFile(parent, slot.getFileName().toString(), ".tmp");
        try {
          objectMapper.writeValue(temporary.toFile(), artifact);
          moveIntoPlace(temporary, slot);
        } finally {
          Files.deleteIfExists(temporary);
        }
      } catch (IOException e) {
        throw new ModelPersistenceException(
            String.format(
                "Failed writing model of %s for job %s to %s",
                artifact.getMetricType(), artifact.getJobId(), slot),
            e);
      }
    }

    LOGGER.debug(
        "Saved model of {} for job {} to {}", artifact.getMetricType(), artifact.getJobId(), slot);
    return slotName;
  }

  Path getDirectory() {
    return directory;
  }

  private static void moveIntoPlace(Path source, Path target) throws IOException {
    try {
      Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
    } catch (AtomicMoveNotSupportedException e) {
      Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }
}
