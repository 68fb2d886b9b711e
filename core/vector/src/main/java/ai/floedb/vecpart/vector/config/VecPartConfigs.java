/*
 * Copyright 2026 Yellowbrick Data, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package ai.floedb.vecpart.vector.config;

import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfig;
import io.smallrye.config.SmallRyeConfigBuilder;
import java.util.Map;
import java.util.Objects;

/**
 * Loads {@link VecPartConfig} outside of a CDI container.
 *
 * <p>Values come from system properties, environment variables and {@code
 * META-INF/microprofile-config.properties}, in that order of precedence.
 */
public final class VecPartConfigs {

  private static final int OVERRIDE_ORDINAL = 500;

  private static volatile VecPartConfig current;

  private VecPartConfigs() {}

  /** The configuration shared by the process, loaded on first use. */
  public static VecPartConfig current() {
    VecPartConfig config = current;
    if (config == null) {
      synchronized (VecPartConfigs.class) {
        config = current;
        if (config == null) {
          config = load(Map.of());
          current = config;
        }
      }
    }
    return config;
  }

  /** Loads a fresh configuration with {@code overrides} taking precedence over every source. */
  public static VecPartConfig load(Map<String, String> overrides) {
    Objects.requireNonNull(overrides, "overrides");
    SmallRyeConfigBuilder builder =
        new SmallRyeConfigBuilder().addDefaultSources().withMapping(VecPartConfig.class);
    if (!overrides.isEmpty()) {
      builder.withSources(
          new PropertiesConfigSource(overrides, "vecpart-overrides", OVERRIDE_ORDINAL));
    }
    SmallRyeConfig config = builder.build();
    return config.getConfigMapping(VecPartConfig.class);
  }

  /** Replaces the shared configuration; {@code null} reloads it from the sources on next use. */
  public static synchronized void setCurrent(VecPartConfig config) {
    current = config;
  }
}
