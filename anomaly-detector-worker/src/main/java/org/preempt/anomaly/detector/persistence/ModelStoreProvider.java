package org.preempt.anomaly.detector.persistence;

import com.typesafe.config.Config;
import java.lang.reflect.Constructor;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class ModelStoreProvider {
  private static final String STORE_TYPE_CONFIG = "type";
  private static final Map<String, Class<? extends ModelStore>> registry =
      new ConcurrentHashMap<>();

  static {
    register("fs", FileSystemModelStore.class);
  }

  public static ModelStore getModelStore(Config modelStoreConfig) {
    String storeType = modelStoreConfig.getString(STORE_TYPE_CONFIG).toLowerCase();
    Class<? extends ModelStore> clazz = registry.get(storeType);
    if (clazz == null) {
      throw new IllegalArgumentException("Unknown model store type: " + storeType);
    }

    try {
      Constructor<? extends ModelStore> constructor = clazz.getConstructor();
      ModelStore instance = constructor.newInstance();
      instance.init(modelStoreConfig.getConfig(storeType));
      return instance;
    } catch (ReflectiveOperationException e) {
      throw new IllegalArgumentException("Exception creating ModelStore of type " + storeType, e);
    }
  }

  public static void register(String type, Class<? extends ModelStore> clazz) {
    registry.put(type.toLowerCase(), clazz);
  }
}
