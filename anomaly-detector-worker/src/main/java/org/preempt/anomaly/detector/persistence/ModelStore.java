package org.preempt.anomaly.detector.persistence;

import com.typesafe.config.Config;

/** Write-only storage for trained model artifacts. */
public interface ModelStore {
  void init(Config storeConfig);

  /**
   * Writes {@code artifact} to its slot, replacing any previous content.
   *
   * @return the slot name the artifact was written to
   */
  String save(ModelArtifact artifact) throws ModelPersistenceException;
}
